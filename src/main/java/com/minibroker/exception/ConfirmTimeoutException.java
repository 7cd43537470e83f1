package com.minibroker.exception;

import com.minibroker.amqp.AmqpConstants;

/**
 * Raised by {@code waitForConfirms} when a publisher confirm stays outstanding longer than
 * the configured bound. Every confirm pending at that moment is dropped, so retrying the
 * wait starts from a clean slate.
 */
public class ConfirmTimeoutException extends ChannelException {

    public ConfirmTimeoutException(String message) {
        super(AmqpConstants.REPLY_INTERNAL_ERROR, message);
    }
}
