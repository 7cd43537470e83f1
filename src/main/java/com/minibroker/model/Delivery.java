package com.minibroker.model;

/**
 * What a consumer callback or a get caller receives.
 */
public final class Delivery {
    private final MessageFields fields;
    private final MessageProperties properties;
    private final byte[] content;

    public Delivery(MessageFields fields, MessageProperties properties, byte[] content) {
        this.fields = fields;
        this.properties = properties;
        this.content = content;
    }

    public static Delivery of(Message message, long deliveryTag, String consumerTag, int messageCount) {
        MessageFields fields = new MessageFields(message.getExchange(), message.getRoutingKey(),
                deliveryTag, message.isRedelivered(), consumerTag, messageCount);
        return new Delivery(fields, message.getProperties(), message.getBody());
    }

    public MessageFields getFields() {
        return fields;
    }

    public MessageProperties getProperties() {
        return properties;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public long getDeliveryTag() {
        return fields.getDeliveryTag();
    }

    @Override
    public String toString() {
        return "Delivery{" + fields + ", bodySize=" + content.length + "}";
    }
}
