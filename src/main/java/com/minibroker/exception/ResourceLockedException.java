package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

/**
 * Raised when a connection touches an exclusive queue owned by another connection, or
 * when an exclusive consumer cannot be registered.
 */
public class ResourceLockedException extends ChannelException {

    public ResourceLockedException(String message) {
        super(AmqpConstants.REPLY_RESOURCE_LOCKED, message);
    }
}
