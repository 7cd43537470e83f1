package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

public class NotFoundException extends ChannelException {

    public NotFoundException(String message) {
        super(AmqpConstants.REPLY_NOT_FOUND, message);
    }
}
