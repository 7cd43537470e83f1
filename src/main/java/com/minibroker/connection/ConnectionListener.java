package com.minibroker.connection;

/**
 * Lifecycle events of a connection. Every method has an empty default, implement the ones
 * you need.
 */
public interface ConnectionListener {

    default void onConnect(Connection connection) {
    }

    default void onClose(Connection connection) {
    }

    /**
     * A failure during close or heartbeat that was logged instead of propagated.
     */
    default void onError(Connection connection, Throwable error) {
    }

    default void onHeartbeat(Connection connection) {
    }
}
