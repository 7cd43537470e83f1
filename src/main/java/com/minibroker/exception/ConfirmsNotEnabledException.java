package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

public class ConfirmsNotEnabledException extends ChannelException {

    public ConfirmsNotEnabledException(String message) {
        super(AmqpConstants.REPLY_PRECONDITION_FAILED, message);
    }
}
