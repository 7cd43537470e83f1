package com.minibroker.amqp;

/**
 * AMQP 0-9-1 constants used by the broker model.
 * Replaces magic numbers and reserved names with named constants.
 */
public final class AmqpConstants {

    private AmqpConstants() {
        // Utility class
    }

    // ===== AMQP Reply Codes =====
    public static final int REPLY_SUCCESS = 200;
    public static final int REPLY_NO_ROUTE = 312;
    public static final int REPLY_CONNECTION_FORCED = 320;
    public static final int REPLY_ACCESS_REFUSED = 403;
    public static final int REPLY_NOT_FOUND = 404;
    public static final int REPLY_RESOURCE_LOCKED = 405;
    public static final int REPLY_PRECONDITION_FAILED = 406;
    public static final int REPLY_CHANNEL_ERROR = 504;
    public static final int REPLY_NOT_ALLOWED = 530;
    public static final int REPLY_INTERNAL_ERROR = 541;

    // ===== Connection/Channel Limits =====
    public static final int DEFAULT_CHANNEL_MAX = 2047;
    public static final int MAX_NAME_LENGTH = 255;

    // ===== Confirms =====
    public static final long DEFAULT_CONFIRM_TIMEOUT_MS = 30_000L;

    // ===== Predeclared Exchanges =====
    public static final String DEFAULT_EXCHANGE = "";
    public static final String AMQ_DIRECT = "amq.direct";
    public static final String AMQ_TOPIC = "amq.topic";
    public static final String AMQ_FANOUT = "amq.fanout";
    public static final String AMQ_HEADERS = "amq.headers";
    public static final String AMQ_MATCH = "amq.match";

    // ===== Reserved Name Prefixes =====
    public static final String RESERVED_PREFIX = "amq.";
    public static final String GENERATED_QUEUE_PREFIX = "amq.gen-";
    public static final String GENERATED_CONSUMER_TAG_PREFIX = "amq.ctag-";

    // ===== Arguments and Headers =====
    public static final String ARG_MAX_LENGTH = "x-max-length";
    public static final String ARG_MESSAGE_TTL = "x-message-ttl";
    public static final String ARG_PRIORITY = "x-priority";
    public static final String ARG_MATCH = "x-match";
    public static final String HEADER_CC = "CC";
    public static final String HEADER_BCC = "BCC";

    // ===== Delivery Modes =====
    public static final int DELIVERY_MODE_TRANSIENT = 1;
    public static final int DELIVERY_MODE_PERSISTENT = 2;
}
