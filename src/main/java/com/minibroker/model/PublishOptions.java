package com.minibroker.model;

import com.minibroker.amqp.AmqpConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-publish flags and message properties.
 */
public class PublishOptions {
    private boolean mandatory = false;
    private boolean persistent = false;
    private final List<String> cc = new ArrayList<>();
    private final List<String> bcc = new ArrayList<>();
    private final Map<String, Object> headers = new HashMap<>();
    private String contentType;
    private String contentEncoding;
    private Integer priority;
    private String correlationId;
    private String replyTo;
    private String expiration;
    private String messageId;
    private Long timestamp;
    private String type;
    private String userId;
    private String appId;

    public static PublishOptions defaults() {
        return new PublishOptions();
    }

    /**
     * Return the message to the publisher when no queue matches.
     */
    public PublishOptions mandatory(boolean mandatory) {
        this.mandatory = mandatory;
        return this;
    }

    public PublishOptions persistent(boolean persistent) {
        this.persistent = persistent;
        return this;
    }

    public PublishOptions cc(String... routingKeys) {
        Collections.addAll(cc, routingKeys);
        return this;
    }

    public PublishOptions bcc(String... routingKeys) {
        Collections.addAll(bcc, routingKeys);
        return this;
    }

    public PublishOptions header(String name, Object value) {
        headers.put(name, value);
        return this;
    }

    public PublishOptions headers(Map<String, Object> headers) {
        this.headers.putAll(headers);
        return this;
    }

    public PublishOptions contentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    public PublishOptions contentEncoding(String contentEncoding) {
        this.contentEncoding = contentEncoding;
        return this;
    }

    public PublishOptions priority(int priority) {
        this.priority = priority;
        return this;
    }

    public PublishOptions correlationId(String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public PublishOptions replyTo(String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    public PublishOptions expiration(String expiration) {
        this.expiration = expiration;
        return this;
    }

    public PublishOptions messageId(String messageId) {
        this.messageId = messageId;
        return this;
    }

    public PublishOptions timestamp(long timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public PublishOptions type(String type) {
        this.type = type;
        return this;
    }

    public PublishOptions userId(String userId) {
        this.userId = userId;
        return this;
    }

    public PublishOptions appId(String appId) {
        this.appId = appId;
        return this;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public boolean isPersistent() {
        return persistent;
    }

    /**
     * Extra routing keys from the {@code cc} and {@code bcc} options and from
     * {@code CC}/{@code BCC} headers set directly.
     */
    public List<String> getExtraRoutingKeys() {
        List<String> keys = new ArrayList<>(cc);
        keys.addAll(bcc);
        keys.addAll(headerKeys(headers.get(AmqpConstants.HEADER_CC)));
        keys.addAll(headerKeys(headers.get(AmqpConstants.HEADER_BCC)));
        return keys;
    }

    private static List<String> headerKeys(Object value) {
        List<String> keys = new ArrayList<>();
        if (value instanceof String) {
            keys.add((String) value);
        } else if (value instanceof Iterable) {
            for (Object key : (Iterable<?>) value) {
                if (key != null) {
                    keys.add(key.toString());
                }
            }
        }
        return keys;
    }

    /**
     * Properties as stored with the message. {@code CC} is kept as a header, {@code BCC}
     * never reaches consumers.
     */
    public MessageProperties toProperties() {
        MessageProperties.Builder builder = MessageProperties.builder()
                .contentType(contentType)
                .contentEncoding(contentEncoding)
                .headers(headers)
                .deliveryMode(persistent ? AmqpConstants.DELIVERY_MODE_PERSISTENT
                                         : AmqpConstants.DELIVERY_MODE_TRANSIENT)
                .priority(priority)
                .correlationId(correlationId)
                .replyTo(replyTo)
                .expiration(expiration)
                .messageId(messageId)
                .timestamp(timestamp)
                .type(type)
                .userId(userId)
                .appId(appId);
        if (!cc.isEmpty()) {
            List<String> ccHeader = headerKeys(headers.get(AmqpConstants.HEADER_CC));
            ccHeader.addAll(cc);
            builder.header(AmqpConstants.HEADER_CC, ccHeader);
        }
        builder.removeHeader(AmqpConstants.HEADER_BCC);
        return builder.build();
    }
}
