package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

public class AccessRefusedException extends ChannelException {

    public AccessRefusedException(String message) {
        super(AmqpConstants.REPLY_ACCESS_REFUSED, message);
    }
}
