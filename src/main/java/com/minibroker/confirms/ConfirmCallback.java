package com.minibroker.confirms;

/**
 * Told once per published message whether the broker accepted it.
 */
@FunctionalInterface
public interface ConfirmCallback {

    void handle(long sequenceNumber, boolean ack);
}
