package com.minibroker.confirms;

import com.minibroker.amqp.AmqpConstants;
import com.minibroker.connection.Channel;
import com.minibroker.connection.Connection;
import com.minibroker.exception.ConfirmTimeoutException;
import com.minibroker.exception.ConfirmsNotEnabledException;
import com.minibroker.model.Message;
import com.minibroker.model.PublishOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * A channel with publisher confirms. Once confirms are enabled every publish takes a
 * sequence number, and its callback is told the outcome chosen by the broker's
 * {@link ConfirmResolver}. Outcomes are applied on the broker's worker threads, in no
 * particular order.
 */
public class ConfirmChannel extends Channel {
    private static final Logger logger = LoggerFactory.getLogger(ConfirmChannel.class);

    private static final ConfirmCallback NO_OP = (sequenceNumber, ack) -> { };

    private final PublisherConfirms confirms = new PublisherConfirms();

    public ConfirmChannel(Connection connection, int channelNumber) {
        super(connection, channelNumber);
    }

    /**
     * Switch the channel to confirm mode. There is no way back.
     */
    public void enableConfirms() {
        ensureOpen();
        confirms.enableConfirmMode();
    }

    public boolean isConfirmMode() {
        return confirms.isConfirmMode();
    }

    @Override
    public boolean publish(String exchange, String routingKey, byte[] content, PublishOptions options) {
        if (!confirms.isConfirmMode()) {
            return super.publish(exchange, routingKey, content, options);
        }
        return publish(exchange, routingKey, content, options, NO_OP);
    }

    /**
     * Publish and get told whether the broker accepted the message.
     *
     * @throws ConfirmsNotEnabledException if {@link #enableConfirms()} was not called
     */
    public boolean publish(String exchange, String routingKey, byte[] content, PublishOptions options,
                           ConfirmCallback callback) {
        ensureOpen();
        if (!confirms.isConfirmMode()) {
            throw new ConfirmsNotEnabledException("Confirms not enabled on channel " + getChannelNumber());
        }

        long sequence = confirms.register(callback != null ? callback : NO_OP, exchange, routingKey);
        Message message;
        Set<String> routed;
        try {
            message = createMessage(exchange, routingKey, content, options);
            routed = route(message, options);
        } catch (RuntimeException e) {
            confirms.confirmMessage(sequence, false, false);
            throw e;
        }
        resolve(sequence, message, routed);
        return true;
    }

    public boolean sendToQueue(String queue, byte[] content, PublishOptions options, ConfirmCallback callback) {
        return publish(AmqpConstants.DEFAULT_EXCHANGE, queue, content, options, callback);
    }

    private void resolve(long sequence, Message message, Set<String> routed) {
        CompletionStage<Boolean> outcome;
        try {
            outcome = broker.getConfirmResolver().resolve(sequence, message, routed);
        } catch (RuntimeException e) {
            logger.error("Confirm resolver failed for sequence number {}", sequence, e);
            confirms.confirmMessage(sequence, false, false);
            return;
        }
        outcome.whenCompleteAsync((ack, error) -> {
            if (error != null) {
                logger.warn("Publish {} on channel {} nacked: {}", sequence, getChannelNumber(), error.toString());
                confirms.confirmMessage(sequence, false, false);
            } else {
                confirms.confirmMessage(sequence, false, Boolean.TRUE.equals(ack));
            }
        }, broker.getWorkerExecutor());
    }

    /**
     * Wait for every outstanding confirm, using the broker's configured timeout.
     *
     * @throws ConfirmTimeoutException if a confirm stays pending longer than the timeout
     */
    public void waitForConfirms() throws InterruptedException {
        waitForConfirms(broker.getConfig().getConfirmTimeoutMillis());
    }

    public void waitForConfirms(long timeoutMillis) throws InterruptedException {
        if (!confirms.isConfirmMode()) {
            throw new ConfirmsNotEnabledException("Confirms not enabled on channel " + getChannelNumber());
        }
        confirms.awaitConfirms(timeoutMillis);
    }

    public long getNextPublishSeqNo() {
        return confirms.getNextPublishSeqNo();
    }

    public int getPendingConfirmCount() {
        return confirms.getPendingConfirmCount();
    }

    PublisherConfirms getPublisherConfirms() {
        return confirms;
    }

    /**
     * Wait for outstanding confirms, then close. A timeout is logged, not thrown.
     */
    @Override
    public void close() {
        if (isOpen() && confirms.isConfirmMode() && confirms.getPendingConfirmCount() > 0) {
            try {
                waitForConfirms();
            } catch (ConfirmTimeoutException e) {
                logger.warn("Closing channel {} with unconfirmed publishes: {}", getChannelNumber(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted waiting for confirms while closing channel {}", getChannelNumber());
            }
        }
        super.close();
    }
}
