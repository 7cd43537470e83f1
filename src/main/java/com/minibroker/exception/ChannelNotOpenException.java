package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

public class ChannelNotOpenException extends ChannelException {

    public ChannelNotOpenException(String message) {
        super(AmqpConstants.REPLY_CHANNEL_ERROR, message);
    }
}
