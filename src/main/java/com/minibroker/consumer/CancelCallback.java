package com.minibroker.consumer;

/**
 * Notified once when a consumer stops receiving messages, whether the client cancelled it,
 * its channel closed or its queue was deleted.
 */
@FunctionalInterface
public interface CancelCallback {

    void handle(String consumerTag);
}
