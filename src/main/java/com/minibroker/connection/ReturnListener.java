package com.minibroker.connection;

import com.minibroker.model.MessageProperties;

/**
 * Receives mandatory messages that matched no queue. Invoked on the channel's delivery thread.
 */
@FunctionalInterface
public interface ReturnListener {

    void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
                      MessageProperties properties, byte[] body);
}
