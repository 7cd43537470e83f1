package com.minibroker.confirms;

import com.minibroker.config.BrokerConfig;
import com.minibroker.connection.Connection;
import com.minibroker.exception.ConfirmTimeoutException;
import com.minibroker.exception.ConfirmsNotEnabledException;
import com.minibroker.exception.NotFoundException;
import com.minibroker.model.PublishOptions;
import com.minibroker.server.Broker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@DisplayName("Confirm Channel Tests")
class ConfirmChannelTest {

    private Broker broker;

    private ConfirmChannel open(ConfirmResolver resolver, long timeoutMillis) {
        BrokerConfig config = new BrokerConfig();
        config.setConfirmTimeoutMillis(timeoutMillis);
        broker = resolver != null ? new Broker(config, resolver) : new Broker(config);
        broker.start();
        Connection connection = broker.newConnection();
        connection.connect();
        ConfirmChannel channel = connection.createConfirmChannel();
        channel.assertQueue("q");
        return channel;
    }

    @AfterEach
    void tearDown() {
        if (broker != null) {
            broker.stop();
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Acknowledged Publish Tests")
    class AcknowledgedPublishTests {

        @Test
        @DisplayName("Every publish should be acked")
        void testAcks() throws InterruptedException {
            ConfirmChannel channel = open(null, 1000);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();

            for (int i = 0; i < 5; i++) {
                channel.sendToQueue("q", bytes("m" + i), PublishOptions.defaults(), outcomes::put);
            }
            channel.waitForConfirms();

            assertThat(outcomes).hasSize(5).doesNotContainValue(false);
            assertThat(channel.getPendingConfirmCount()).isZero();
            assertThat(channel.checkQueue("q").getMessageCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("Sequence numbers should increase by one per publish")
        void testSequenceNumbers() {
            ConfirmChannel channel = open(null, 1000);

            assertThat(channel.isConfirmMode()).isTrue();
            assertThat(channel.getNextPublishSeqNo()).isEqualTo(1);
            channel.sendToQueue("q", bytes("a"));
            channel.sendToQueue("q", bytes("b"));
            assertThat(channel.getNextPublishSeqNo()).isEqualTo(3);
        }

        @Test
        @DisplayName("Unroutable messages should still be confirmed")
        void testUnroutableAcked() throws InterruptedException {
            ConfirmChannel channel = open(null, 1000);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();

            channel.publish("amq.direct", "nowhere", bytes("m"), PublishOptions.defaults(), outcomes::put);
            channel.waitForConfirms();

            assertThat(outcomes).containsEntry(1L, true);
        }
    }

    @Nested
    @DisplayName("Negative Outcome Tests")
    class NegativeOutcomeTests {

        @Test
        @DisplayName("Resolver nacks should reach the callback")
        void testNack() {
            ConfirmChannel channel = open((seq, message, routed) -> CompletableFuture.completedFuture(false), 1000);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();

            channel.sendToQueue("q", bytes("m"), PublishOptions.defaults(), outcomes::put);

            await().atMost(Duration.ofSeconds(5)).until(() -> outcomes.containsKey(1L));
            assertThat(outcomes).containsEntry(1L, false);
        }

        @Test
        @DisplayName("A failed resolution should count as a nack")
        void testFailedResolution() {
            ConfirmChannel channel = open((seq, message, routed) ->
                    CompletableFuture.failedFuture(new IllegalStateException("disk full")), 1000);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();

            channel.sendToQueue("q", bytes("m"), PublishOptions.defaults(), outcomes::put);

            await().atMost(Duration.ofSeconds(5)).until(() -> outcomes.containsKey(1L));
            assertThat(outcomes).containsEntry(1L, false);
        }

        @Test
        @DisplayName("Unresolved publishes should time out and leave the channel clean")
        void testTimeout() throws InterruptedException {
            ConfirmChannel channel = open((seq, message, routed) -> new CompletableFuture<>(), 100);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();
            channel.sendToQueue("q", bytes("m"), PublishOptions.defaults(), outcomes::put);

            assertThatThrownBy(channel::waitForConfirms).isInstanceOf(ConfirmTimeoutException.class);

            assertThat(outcomes).containsEntry(1L, false);
            assertThat(channel.getPendingConfirmCount()).isZero();
            channel.waitForConfirms();
        }

        @Test
        @DisplayName("Close should give up on pending confirms after the timeout")
        void testCloseWithPending() {
            ConfirmChannel channel = open((seq, message, routed) -> new CompletableFuture<>(), 200);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();
            channel.sendToQueue("q", bytes("m"), PublishOptions.defaults(), outcomes::put);

            assertThatCode(channel::close).doesNotThrowAnyException();

            assertThat(channel.isOpen()).isFalse();
            assertThat(outcomes).containsEntry(1L, false);
        }

        @Test
        @DisplayName("A failed publish should be nacked and rethrown")
        void testPublishFailure() {
            ConfirmChannel channel = open(null, 1000);
            Map<Long, Boolean> outcomes = new ConcurrentHashMap<>();

            assertThatThrownBy(() -> channel.publish("missing", "k", bytes("m"), PublishOptions.defaults(), outcomes::put))
                .isInstanceOf(NotFoundException.class);

            assertThat(outcomes).containsEntry(1L, false);
            assertThat(channel.getNextPublishSeqNo()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Confirm publishes should fail until confirms are enabled")
    void testConfirmsNotEnabled() {
        open(null, 1000);
        Connection connection = broker.newConnection();
        connection.connect();
        ConfirmChannel plain = new ConfirmChannel(connection, 99);
        plain.open();

        assertThat(plain.isConfirmMode()).isFalse();
        assertThatThrownBy(() -> plain.publish("", "q", bytes("m"), PublishOptions.defaults(), (s, a) -> { }))
            .isInstanceOf(ConfirmsNotEnabledException.class);
        assertThatThrownBy(plain::waitForConfirms).isInstanceOf(ConfirmsNotEnabledException.class);
        assertThat(plain.publish("", "q", bytes("m"))).isTrue();

        plain.enableConfirms();
        assertThat(plain.isConfirmMode()).isTrue();
        plain.close();
    }
}
