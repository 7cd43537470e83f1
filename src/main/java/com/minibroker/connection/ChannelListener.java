package com.minibroker.connection;

public interface ChannelListener {

    default void onOpen(Channel channel) {
    }

    default void onClose(Channel channel) {
    }
}
