package com.minibroker.exception;

public class ConnectionException extends BrokerException {

    public ConnectionException(int replyCode, String message) {
        super(replyCode, message);
    }
}
