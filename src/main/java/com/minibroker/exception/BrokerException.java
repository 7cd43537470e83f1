package com.minibroker.exception;

/**
 * Base type of every error raised by the broker model. Carries the AMQP reply code a
 * real broker would close the channel or connection with.
 */
public class BrokerException extends RuntimeException {

    private final int replyCode;

    public BrokerException(int replyCode, String message) {
        super(message);
        this.replyCode = replyCode;
    }

    public BrokerException(int replyCode, String message, Throwable cause) {
        super(message, cause);
        this.replyCode = replyCode;
    }

    public int getReplyCode() {
        return replyCode;
    }
}
