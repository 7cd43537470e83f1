package com.minibroker.model;

/**
 * Delivery-specific fields of a message handed to a consumer or returned by a get.
 * {@code consumerTag} is null for gets; {@code messageCount} is -1 for consumer deliveries.
 */
public final class MessageFields {
    private final String exchange;
    private final String routingKey;
    private final long deliveryTag;
    private final boolean redelivered;
    private final String consumerTag;
    private final int messageCount;

    public MessageFields(String exchange, String routingKey, long deliveryTag,
                         boolean redelivered, String consumerTag, int messageCount) {
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.consumerTag = consumerTag;
        this.messageCount = messageCount;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public int getMessageCount() {
        return messageCount;
    }

    @Override
    public String toString() {
        return String.format("MessageFields{exchange='%s', routingKey='%s', deliveryTag=%d, redelivered=%s, consumerTag='%s'}",
                exchange, routingKey, deliveryTag, redelivered, consumerTag);
    }
}
