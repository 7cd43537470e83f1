package com.minibroker.routing;

import com.minibroker.amqp.AmqpConstants;
import com.minibroker.config.BrokerConfig;
import com.minibroker.exception.AccessRefusedException;
import com.minibroker.exception.NotFoundException;
import com.minibroker.model.Exchange;
import com.minibroker.model.ExchangeOptions;
import com.minibroker.model.QueueOptions;
import com.minibroker.topology.TopologyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Router Tests")
class RouterTest {

    private TopologyStore topology;
    private Router router;

    @BeforeEach
    void setUp() {
        topology = new TopologyStore(new BrokerConfig());
        router = new Router(topology);
        for (String queue : List.of("q1", "q2", "q3")) {
            topology.declareQueue(queue, QueueOptions.defaults(), "conn");
        }
    }

    private void exchange(String name, Exchange.Type type) {
        topology.declareExchange(name, type, ExchangeOptions.defaults());
    }

    @Nested
    @DisplayName("Exchange Type Tests")
    class ExchangeTypeTests {

        @Test
        @DisplayName("Default exchange should route to the queue named by the key")
        void testDefaultExchange() {
            assertThat(router.route("", "q2", null)).containsExactly("q2");
            assertThat(router.route("", "missing", null)).isEmpty();
        }

        @Test
        @DisplayName("Direct exchange should require an exact key")
        void testDirect() {
            exchange("orders", Exchange.Type.DIRECT);
            topology.bindQueue("q1", "orders", "created", null);
            topology.bindQueue("q2", "orders", "cancelled", null);

            assertThat(router.route("orders", "created", null)).containsExactly("q1");
            assertThat(router.route("orders", "updated", null)).isEmpty();
        }

        @Test
        @DisplayName("Direct exchange should treat wildcards literally")
        void testDirectIgnoresWildcards() {
            exchange("orders", Exchange.Type.DIRECT);
            topology.bindQueue("q1", "orders", "a.*", null);

            assertThat(router.route("orders", "a.b", null)).isEmpty();
            assertThat(router.route("orders", "a.*", null)).containsExactly("q1");
        }

        @Test
        @DisplayName("Fanout exchange should ignore the key")
        void testFanout() {
            exchange("events", Exchange.Type.FANOUT);
            topology.bindQueue("q1", "events", "", null);
            topology.bindQueue("q3", "events", "ignored", null);

            assertThat(router.route("events", "whatever", null)).containsExactly("q1", "q3");
        }

        @Test
        @DisplayName("Topic exchange should apply wildcard patterns")
        void testTopic() {
            exchange("logs", Exchange.Type.TOPIC);
            topology.bindQueue("q1", "logs", "a.*", null);
            topology.bindQueue("q2", "logs", "a.#", null);

            assertThat(router.route("logs", "a.b", null)).containsExactly("q1", "q2");
            assertThat(router.route("logs", "a.b.c", null)).containsExactly("q2");
        }

        @Test
        @DisplayName("Headers exchange should match on message headers")
        void testHeaders() {
            exchange("docs", Exchange.Type.HEADERS);
            topology.bindQueue("q1", "docs", "", Map.of("x-match", "all", "format", "pdf"));
            topology.bindQueue("q2", "docs", "", Map.of("x-match", "any", "format", "zip", "size", "big"));

            assertThat(router.route("docs", "", Map.of("format", "pdf"))).containsExactly("q1");
            assertThat(router.route("docs", "", Map.of("size", "big"))).containsExactly("q2");
            assertThat(router.route("docs", "", null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Exchange To Exchange Tests")
    class ExchangeToExchangeTests {

        @Test
        @DisplayName("Should follow exchange bindings transitively")
        void testTransitive() {
            exchange("front", Exchange.Type.TOPIC);
            exchange("middle", Exchange.Type.DIRECT);
            exchange("back", Exchange.Type.FANOUT);
            topology.bindExchange("middle", "front", "orders.#", null);
            topology.bindExchange("back", "middle", "orders.eu", null);
            topology.bindQueue("q3", "back", "", null);

            assertThat(router.route("front", "orders.eu", null)).containsExactly("q3");
            assertThat(router.route("front", "orders.us", null)).isEmpty();
        }

        @Test
        @DisplayName("Should terminate on binding cycles")
        void testCycle() {
            exchange("x1", Exchange.Type.FANOUT);
            exchange("x2", Exchange.Type.FANOUT);
            topology.bindExchange("x2", "x1", "", null);
            topology.bindExchange("x1", "x2", "", null);
            topology.bindQueue("q1", "x2", "", null);

            assertThat(router.route("x1", "k", null)).containsExactly("q1");
        }

        @Test
        @DisplayName("Should deliver once per queue when several paths reach it")
        void testDeduplication() {
            exchange("x1", Exchange.Type.FANOUT);
            exchange("x2", Exchange.Type.FANOUT);
            topology.bindExchange("x2", "x1", "", null);
            topology.bindQueue("q1", "x1", "", null);
            topology.bindQueue("q1", "x2", "", null);

            assertThat(router.route("x1", "k", null)).containsExactly("q1");
        }
    }

    @Test
    @DisplayName("Should merge targets of several routing keys")
    void testMultipleKeys() {
        exchange("orders", Exchange.Type.DIRECT);
        topology.bindQueue("q1", "orders", "k1", null);
        topology.bindQueue("q2", "orders", "k2", null);
        topology.bindQueue("q3", "orders", "k3", null);

        assertThat(router.route("orders", List.of("k1", "k3", "k1"), null)).containsExactly("q1", "q3");
    }

    @Test
    @DisplayName("Should refuse publishes to internal exchanges")
    void testInternalExchange() {
        topology.declareExchange("hidden", Exchange.Type.FANOUT, ExchangeOptions.defaults().internal(true));

        assertThatThrownBy(() -> router.route("hidden", "k", null))
            .isInstanceOf(AccessRefusedException.class);
    }

    @Test
    @DisplayName("Should fail for unknown exchanges")
    void testMissingExchange() {
        assertThatThrownBy(() -> router.route("nope", "k", null))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("nope");
    }

    @Test
    @DisplayName("Predeclared exchanges should be routable")
    void testPredeclared() {
        topology.bindQueue("q2", AmqpConstants.AMQ_TOPIC, "#", null);

        assertThat(router.route(AmqpConstants.AMQ_TOPIC, "any.key", null)).containsExactly("q2");
    }
}
