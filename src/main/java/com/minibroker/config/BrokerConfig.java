package com.minibroker.config;

import com.minibroker.amqp.AmqpConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for an in-process broker.
 * Values are resolved from defaults, then a properties source, then environment variables.
 */
public class BrokerConfig {
    private static final Logger logger = LoggerFactory.getLogger(BrokerConfig.class);

    public static final String DEFAULT_RESOURCE = "broker.properties";

    // Connection configuration
    private int heartbeatSeconds = 0;
    private int channelMax = AmqpConstants.DEFAULT_CHANNEL_MAX;

    // Confirms
    private long confirmTimeoutMillis = AmqpConstants.DEFAULT_CONFIRM_TIMEOUT_MS;

    // Queue defaults
    private int defaultQueueMaxLength = 0;

    // Behaviour switches
    private boolean strictRedeclare = false;
    private boolean requeueUnackedOnClose = false;

    // Performance tuning
    private int deliveryThreads = 4;

    public BrokerConfig() {
        // Load from environment variables if available
        loadFromEnvironment(System.getenv());
    }

    /**
     * Create a configuration from a classpath resource, falling back to defaults when the
     * resource is absent. Environment variables still take precedence.
     */
    public static BrokerConfig fromClasspath(String resource) {
        BrokerConfig config = new BrokerConfig();
        try (InputStream in = BrokerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", resource);
                return config;
            }
            Properties properties = new Properties();
            properties.load(in);
            config.loadFromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read broker configuration: " + resource, e);
        }
        config.loadFromEnvironment(System.getenv());
        return config;
    }

    /**
     * Load configuration from environment variables.
     */
    void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("MINIBROKER_HEARTBEAT_SECONDS")) {
            heartbeatSeconds = Integer.parseInt(env.get("MINIBROKER_HEARTBEAT_SECONDS"));
        }
        if (env.containsKey("MINIBROKER_CHANNEL_MAX")) {
            channelMax = Integer.parseInt(env.get("MINIBROKER_CHANNEL_MAX"));
        }
        if (env.containsKey("MINIBROKER_CONFIRM_TIMEOUT_MS")) {
            confirmTimeoutMillis = Long.parseLong(env.get("MINIBROKER_CONFIRM_TIMEOUT_MS"));
        }
        if (env.containsKey("MINIBROKER_DELIVERY_THREADS")) {
            deliveryThreads = Integer.parseInt(env.get("MINIBROKER_DELIVERY_THREADS"));
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("broker.heartbeat-seconds")) {
            heartbeatSeconds = Integer.parseInt(properties.getProperty("broker.heartbeat-seconds").trim());
        }
        if (properties.containsKey("broker.channel-max")) {
            channelMax = Integer.parseInt(properties.getProperty("broker.channel-max").trim());
        }
        if (properties.containsKey("broker.confirm-timeout-ms")) {
            confirmTimeoutMillis = Long.parseLong(properties.getProperty("broker.confirm-timeout-ms").trim());
        }
        if (properties.containsKey("broker.delivery-threads")) {
            deliveryThreads = Integer.parseInt(properties.getProperty("broker.delivery-threads").trim());
        }
        if (properties.containsKey("broker.default-queue-max-length")) {
            defaultQueueMaxLength = Integer.parseInt(properties.getProperty("broker.default-queue-max-length").trim());
        }
        if (properties.containsKey("broker.strict-redeclare")) {
            strictRedeclare = Boolean.parseBoolean(properties.getProperty("broker.strict-redeclare").trim());
        }
        if (properties.containsKey("broker.requeue-unacked-on-close")) {
            requeueUnackedOnClose = Boolean.parseBoolean(properties.getProperty("broker.requeue-unacked-on-close").trim());
        }
    }

    /**
     * Export configuration as a map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("heartbeatSeconds", heartbeatSeconds);
        map.put("channelMax", channelMax);
        map.put("confirmTimeoutMillis", confirmTimeoutMillis);
        map.put("deliveryThreads", deliveryThreads);
        map.put("defaultQueueMaxLength", defaultQueueMaxLength);
        map.put("strictRedeclare", strictRedeclare);
        map.put("requeueUnackedOnClose", requeueUnackedOnClose);
        return map;
    }

    // Getters and setters

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public void setHeartbeatSeconds(int heartbeatSeconds) {
        this.heartbeatSeconds = heartbeatSeconds;
    }

    public int getChannelMax() {
        return channelMax;
    }

    public void setChannelMax(int channelMax) {
        this.channelMax = channelMax;
    }

    public long getConfirmTimeoutMillis() {
        return confirmTimeoutMillis;
    }

    public void setConfirmTimeoutMillis(long confirmTimeoutMillis) {
        this.confirmTimeoutMillis = confirmTimeoutMillis;
    }

    public int getDefaultQueueMaxLength() {
        return defaultQueueMaxLength;
    }

    public void setDefaultQueueMaxLength(int defaultQueueMaxLength) {
        this.defaultQueueMaxLength = defaultQueueMaxLength;
    }

    public boolean isStrictRedeclare() {
        return strictRedeclare;
    }

    public void setStrictRedeclare(boolean strictRedeclare) {
        this.strictRedeclare = strictRedeclare;
    }

    public boolean isRequeueUnackedOnClose() {
        return requeueUnackedOnClose;
    }

    public void setRequeueUnackedOnClose(boolean requeueUnackedOnClose) {
        this.requeueUnackedOnClose = requeueUnackedOnClose;
    }

    public int getDeliveryThreads() {
        return deliveryThreads;
    }

    public void setDeliveryThreads(int deliveryThreads) {
        this.deliveryThreads = deliveryThreads;
    }

    @Override
    public String toString() {
        return String.format("BrokerConfig{heartbeat=%ds, channelMax=%d, confirmTimeout=%dms, deliveryThreads=%d, strictRedeclare=%s}",
                           heartbeatSeconds, channelMax, confirmTimeoutMillis, deliveryThreads, strictRedeclare);
    }
}
