package com.minibroker.model;

import com.minibroker.exception.PreconditionFailedException;

/**
 * A published message as the broker buffers it. Immutable: requeueing produces a copy
 * flagged as redelivered.
 */
public final class Message {
    private final byte[] body;
    private final String exchange;
    private final String routingKey;
    private final MessageProperties properties;
    private final boolean redelivered;
    private final long publishedAt;
    private final long expirationMillis;

    public Message(byte[] body, String exchange, String routingKey, MessageProperties properties) {
        this(body != null ? body.clone() : new byte[0], exchange, routingKey,
             properties != null ? properties : MessageProperties.EMPTY, false, System.currentTimeMillis());
    }

    private Message(byte[] body, String exchange, String routingKey, MessageProperties properties,
                    boolean redelivered, long publishedAt) {
        this.body = body;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.properties = properties;
        this.redelivered = redelivered;
        this.publishedAt = publishedAt;
        this.expirationMillis = parseExpiration(properties.getExpiration());
    }

    private static long parseExpiration(String expiration) {
        if (expiration == null) {
            return -1;
        }
        try {
            long value = Long.parseLong(expiration.trim());
            if (value < 0) {
                throw new PreconditionFailedException("Invalid expiration: " + expiration);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new PreconditionFailedException("Invalid expiration: " + expiration);
        }
    }

    /**
     * Copy of this message flagged as redelivered. The publish time is kept so a
     * time-to-live keeps counting from the original publish.
     */
    public Message redeliver() {
        if (redelivered) {
            return this;
        }
        return new Message(body, exchange, routingKey, properties, true, publishedAt);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public int getBodySize() {
        return body.length;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public MessageProperties getProperties() {
        return properties;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public long getPublishedAt() {
        return publishedAt;
    }

    /**
     * Per-message time-to-live from the {@code expiration} property, or -1 when unset.
     */
    public long getExpirationMillis() {
        return expirationMillis;
    }

    @Override
    public String toString() {
        return String.format("Message{exchange='%s', routingKey='%s', redelivered=%s, bodySize=%d}",
                exchange, routingKey, redelivered, body.length);
    }
}
