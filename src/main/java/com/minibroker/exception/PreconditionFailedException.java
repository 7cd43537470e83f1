package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

/** Raised by conditional deletes and inequivalent redeclarations. */
public class PreconditionFailedException extends ChannelException {

    public PreconditionFailedException(String message) {
        super(AmqpConstants.REPLY_PRECONDITION_FAILED, message);
    }
}
