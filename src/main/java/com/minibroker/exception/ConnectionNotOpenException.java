package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

/**
 * Raised when a channel is requested from a connection that is not connected yet or has
 * already been closed.
 */
public class ConnectionNotOpenException extends ConnectionException {

    public ConnectionNotOpenException(String message) {
        super(AmqpConstants.REPLY_CHANNEL_ERROR, message);
    }
}
