package com.minibroker.consumer;

import com.minibroker.model.Delivery;

/**
 * Receives messages pushed to a consumer. Invoked on the owning channel's delivery thread.
 */
@FunctionalInterface
public interface DeliverCallback {

    void handle(Delivery delivery) throws Exception;
}
