package com.minibroker.server;

import com.minibroker.config.BrokerConfig;
import com.minibroker.connection.Channel;
import com.minibroker.connection.Connection;
import com.minibroker.exception.NotFoundException;
import com.minibroker.model.Exchange;
import com.minibroker.model.Delivery;
import com.minibroker.model.ExchangeOptions;
import com.minibroker.model.Message;
import com.minibroker.model.MessageProperties;
import com.minibroker.model.QueueOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@DisplayName("Broker Tests")
class BrokerTest {

    private Broker broker;

    @BeforeEach
    void setUp() {
        broker = new Broker(new BrokerConfig());
        broker.start();
    }

    @AfterEach
    void tearDown() {
        broker.stop();
    }

    private static Message message(String exchange, String key) {
        return new Message(new byte[]{1}, exchange, key, MessageProperties.EMPTY);
    }

    @Test
    @DisplayName("Brokers should not share topology")
    void testIndependentBrokers() {
        Broker other = new Broker(new BrokerConfig());
        other.start();
        try {
            broker.declareQueue("c1", "orders", QueueOptions.defaults());

            assertThat(broker.getTopology().getQueue("orders")).isNotNull();
            assertThat(other.getTopology().getQueue("orders")).isNull();
            assertThatThrownBy(() -> other.checkQueue("c1", "orders")).isInstanceOf(NotFoundException.class);
        } finally {
            other.stop();
        }
    }

    @Test
    @DisplayName("Publish should return the queues the message reached")
    void testPublishReturnsRoutedQueues() {
        broker.declareQueue("c1", "q1", QueueOptions.defaults());
        broker.declareQueue("c1", "q2", QueueOptions.defaults());
        broker.declareExchange("events", Exchange.Type.FANOUT, ExchangeOptions.defaults());
        broker.bindQueue("c1", "q1", "events", "", null);
        broker.bindQueue("c1", "q2", "events", "", null);

        assertThat(broker.publish("events", List.of("k"), message("events", "k"))).containsExactly("q1", "q2");
        assertThat(broker.checkQueue("c1", "q1").getMessageCount()).isEqualTo(1);
        assertThat(broker.publish("", List.of("none"), message("", "none"))).isEmpty();
    }

    @Test
    @DisplayName("Stop should close every connection")
    void testStopClosesConnections() {
        Connection first = broker.newConnection();
        Connection second = broker.newConnection();
        first.connect();
        second.connect();
        Channel channel = first.createChannel();

        broker.stop();

        assertThat(broker.isRunning()).isFalse();
        assertThat(first.getState()).isEqualTo(Connection.State.CLOSED);
        assertThat(second.getState()).isEqualTo(Connection.State.CLOSED);
        assertThat(channel.isOpen()).isFalse();
        assertThat(broker.getConnections()).isEmpty();
    }

    @Test
    @DisplayName("Deleting a queue should cancel consumers on every connection")
    void testDeleteCancelsConsumers() {
        Connection connection = broker.newConnection();
        connection.connect();
        Channel channel = connection.createChannel();
        List<String> cancelled = new CopyOnWriteArrayList<>();
        channel.assertQueue("q");
        channel.consume("q", d -> { }, cancelled::add, null);

        assertThat(broker.deleteQueue("admin", "q", false, false)).isZero();

        await().atMost(Duration.ofSeconds(5)).until(() -> cancelled.size() == 1);
        assertThat(channel.getConsumers()).isEmpty();
        assertThat(broker.getDeliveryEngine().getRegistry().consumersFor("q")).isEmpty();
    }

    @Test
    @DisplayName("Start should deliver messages buffered before the broker started")
    void testDeliveryAfterLateStart() {
        Broker late = new Broker(new BrokerConfig());
        try {
            Connection connection = late.newConnection();
            connection.connect();
            Channel channel = connection.createChannel();
            List<Delivery> received = new CopyOnWriteArrayList<>();
            channel.assertQueue("q");
            channel.consume("q", received::add);
            channel.sendToQueue("q", new byte[]{1});
            assertThat(channel.checkQueue("q").getMessageCount()).isEqualTo(1);

            late.start();

            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);
            assertThat(channel.checkQueue("q").getMessageCount()).isZero();
        } finally {
            late.start();
            late.stop();
        }
    }

    @Test
    @DisplayName("Connections should get unique generated names")
    void testConnectionNames() {
        Connection first = broker.newConnection();
        Connection second = broker.newConnection();

        assertThat(first.getName()).isNotEqualTo(second.getName());
        assertThat(broker.getConnections()).contains(first, second);
    }
}
