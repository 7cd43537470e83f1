package com.minibroker.exception;

public class ChannelException extends BrokerException {

    public ChannelException(int replyCode, String message) {
        super(replyCode, message);
    }

    public ChannelException(int replyCode, String message, Throwable cause) {
        super(replyCode, message, cause);
    }
}
