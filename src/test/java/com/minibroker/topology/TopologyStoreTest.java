package com.minibroker.topology;

import com.minibroker.amqp.AmqpConstants;
import com.minibroker.config.BrokerConfig;
import com.minibroker.exception.AccessRefusedException;
import com.minibroker.exception.NotFoundException;
import com.minibroker.exception.PreconditionFailedException;
import com.minibroker.exception.ResourceLockedException;
import com.minibroker.model.Exchange;
import com.minibroker.model.ExchangeOptions;
import com.minibroker.model.Message;
import com.minibroker.model.MessageProperties;
import com.minibroker.model.Queue;
import com.minibroker.model.QueueOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Topology Store Tests")
class TopologyStoreTest {

    private BrokerConfig config;
    private TopologyStore store;

    @BeforeEach
    void setUp() {
        config = new BrokerConfig();
        config.setStrictRedeclare(false);
        store = new TopologyStore(config);
    }

    private static Message message() {
        return new Message(new byte[]{1}, "", "q", MessageProperties.EMPTY);
    }

    @Nested
    @DisplayName("Queue Tests")
    class QueueTests {

        @Test
        @DisplayName("Declaring twice should return the same queue")
        void testIdempotentDeclare() {
            Queue first = store.declareQueue("orders", QueueOptions.defaults(), "c1");
            Queue second = store.declareQueue("orders", QueueOptions.defaults().durable(false), "c1");

            assertThat(second).isSameAs(first);
        }

        @Test
        @DisplayName("Strict redeclare should reject different flags")
        void testStrictRedeclare() {
            config.setStrictRedeclare(true);
            store.declareQueue("orders", QueueOptions.defaults(), "c1");

            assertThatThrownBy(() -> store.declareQueue("orders", QueueOptions.defaults().autoDelete(true), "c1"))
                .isInstanceOf(PreconditionFailedException.class);
        }

        @Test
        @DisplayName("Default configuration should never drop the head message")
        void testUnboundedByDefault() {
            Queue queue = new TopologyStore(BrokerConfig.fromClasspath(BrokerConfig.DEFAULT_RESOURCE))
                    .declareQueue("big", QueueOptions.defaults(), "c1");
            Message head = message();
            queue.enqueue(head);
            for (int i = 0; i < 100_000; i++) {
                queue.enqueue(message());
            }

            assertThat(queue.getMaxLength()).isZero();
            assertThat(queue.size()).isEqualTo(100_001);
            assertThat(queue.poll()).isSameAs(head);
        }

        @Test
        @DisplayName("Empty name should generate a unique name")
        void testGeneratedName() {
            Queue a = store.declareQueue("", QueueOptions.defaults(), "c1");
            Queue b = store.declareQueue(null, QueueOptions.defaults(), "c1");

            assertThat(a.getName()).startsWith(AmqpConstants.GENERATED_QUEUE_PREFIX);
            assertThat(b.getName()).isNotEqualTo(a.getName());
        }

        @Test
        @DisplayName("Should validate queue names")
        void testNameValidation() {
            assertThatThrownBy(() -> store.declareQueue("bad name!", QueueOptions.defaults(), "c1"))
                .isInstanceOf(PreconditionFailedException.class);
            assertThatThrownBy(() -> store.declareQueue("x".repeat(256), QueueOptions.defaults(), "c1"))
                .isInstanceOf(PreconditionFailedException.class);
            assertThatThrownBy(() -> store.declareQueue("amq.mine", QueueOptions.defaults(), "c1"))
                .isInstanceOf(AccessRefusedException.class);
        }

        @Test
        @DisplayName("Delete should honour ifUnused and ifEmpty")
        void testDeleteConditions() {
            Queue queue = store.declareQueue("q", QueueOptions.defaults(), "c1");
            queue.enqueue(message());
            queue.incrementConsumerCount();

            assertThatThrownBy(() -> store.deleteQueue("q", true, false))
                .isInstanceOf(PreconditionFailedException.class);
            queue.decrementConsumerCount();
            assertThatThrownBy(() -> store.deleteQueue("q", false, true))
                .isInstanceOf(PreconditionFailedException.class);

            assertThat(store.deleteQueue("q", true, false)).isEqualTo(1);
            assertThat(store.getQueue("q")).isNull();
            assertThat(store.deleteQueue("q", false, false)).isZero();
        }

        @Test
        @DisplayName("Deleting a queue should remove its bindings")
        void testDeleteRemovesBindings() {
            store.declareQueue("q", QueueOptions.defaults(), "c1");
            store.bindQueue("q", AmqpConstants.AMQ_DIRECT, "k", null);

            store.deleteQueue("q", false, false);

            assertThat(store.bindingsFrom(AmqpConstants.AMQ_DIRECT)).isEmpty();
        }

        @Test
        @DisplayName("Exclusive queues should be locked to their owner")
        void testExclusiveAccess() {
            Queue queue = store.declareQueue("private", QueueOptions.defaults().exclusive(true), "c1");

            assertThatCode(() -> store.checkExclusiveAccess(queue, "c1")).doesNotThrowAnyException();
            assertThatThrownBy(() -> store.checkExclusiveAccess(queue, "c2"))
                .isInstanceOf(ResourceLockedException.class);
            assertThatThrownBy(() -> store.declareQueue("private", QueueOptions.defaults(), "c2"))
                .isInstanceOf(ResourceLockedException.class);
            assertThat(store.queuesOwnedBy("c1")).containsExactly("private");
            assertThat(store.queuesOwnedBy("c2")).isEmpty();
        }

        @Test
        @DisplayName("Missing queue lookups should fail with not found")
        void testMissingQueue() {
            assertThatThrownBy(() -> store.checkQueue("nope")).isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> store.purgeQueue("nope")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Queue info should report messages and consumers")
        void testQueueInfo() {
            Queue queue = store.declareQueue("q", QueueOptions.defaults(), "c1");
            queue.enqueue(message());
            queue.enqueue(message());

            assertThat(store.queueInfo("q").getMessageCount()).isEqualTo(2);
            assertThat(store.purgeQueue("q")).isEqualTo(2);
            assertThat(store.queueInfo("q").getMessageCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Exchange Tests")
    class ExchangeTests {

        @Test
        @DisplayName("Should predeclare the standard exchanges")
        void testPredeclared() {
            assertThat(store.getExchange("")).isNotNull();
            assertThat(store.checkExchange(AmqpConstants.AMQ_TOPIC).getType()).isEqualTo(Exchange.Type.TOPIC);
            assertThat(store.checkExchange(AmqpConstants.AMQ_MATCH).getType()).isEqualTo(Exchange.Type.HEADERS);
        }

        @Test
        @DisplayName("Redeclaring with another type should fail")
        void testTypeMismatch() {
            store.declareExchange("ex", Exchange.Type.TOPIC, ExchangeOptions.defaults());

            assertThat(store.declareExchange("ex", Exchange.Type.TOPIC, ExchangeOptions.defaults().durable(false)))
                .isNotNull();
            assertThatThrownBy(() -> store.declareExchange("ex", Exchange.Type.FANOUT, ExchangeOptions.defaults()))
                .isInstanceOf(PreconditionFailedException.class);
        }

        @Test
        @DisplayName("Reserved exchanges should not be deleted")
        void testReservedExchanges() {
            assertThatThrownBy(() -> store.deleteExchange("", false)).isInstanceOf(AccessRefusedException.class);
            assertThatThrownBy(() -> store.deleteExchange(AmqpConstants.AMQ_FANOUT, false))
                .isInstanceOf(AccessRefusedException.class);
            assertThatThrownBy(() -> store.declareExchange("", Exchange.Type.FANOUT, ExchangeOptions.defaults()))
                .isInstanceOf(PreconditionFailedException.class);
        }

        @Test
        @DisplayName("Delete ifUnused should fail while bindings exist")
        void testDeleteIfUnused() {
            store.declareExchange("ex", Exchange.Type.DIRECT, ExchangeOptions.defaults());
            store.declareQueue("q", QueueOptions.defaults(), "c1");
            store.bindQueue("q", "ex", "k", null);

            assertThatThrownBy(() -> store.deleteExchange("ex", true))
                .isInstanceOf(PreconditionFailedException.class);
            assertThat(store.deleteExchange("ex", false)).isTrue();
            assertThat(store.deleteExchange("ex", false)).isFalse();
        }

        @Test
        @DisplayName("Deleting an exchange should remove bindings pointing at it")
        void testDeleteRemovesIncomingBindings() {
            store.declareExchange("src", Exchange.Type.FANOUT, ExchangeOptions.defaults());
            store.declareExchange("dst", Exchange.Type.FANOUT, ExchangeOptions.defaults());
            store.bindExchange("dst", "src", "", null);

            store.deleteExchange("dst", false);

            assertThat(store.bindingsFrom("src")).isEmpty();
        }

        @Test
        @DisplayName("Auto-delete exchange should go with its last binding")
        void testAutoDelete() {
            store.declareExchange("temp", Exchange.Type.DIRECT, ExchangeOptions.defaults().autoDelete(true));
            store.declareQueue("q", QueueOptions.defaults(), "c1");
            store.bindQueue("q", "temp", "a", null);
            store.bindQueue("q", "temp", "b", null);

            store.unbindQueue("q", "temp", "a", null);
            assertThat(store.getExchange("temp")).isNotNull();

            store.unbindQueue("q", "temp", "b", null);
            assertThat(store.getExchange("temp")).isNull();
        }
    }

    @Nested
    @DisplayName("Binding Tests")
    class BindingTests {

        @Test
        @DisplayName("Binding twice should keep one binding")
        void testDuplicateBinding() {
            store.declareQueue("q", QueueOptions.defaults(), "c1");
            store.bindQueue("q", AmqpConstants.AMQ_DIRECT, "k", null);
            store.bindQueue("q", AmqpConstants.AMQ_DIRECT, "k", null);

            assertThat(store.bindingsFrom(AmqpConstants.AMQ_DIRECT)).hasSize(1);
        }

        @Test
        @DisplayName("Unbinding a missing binding should be a no-op")
        void testUnbindMissing() {
            store.declareQueue("q", QueueOptions.defaults(), "c1");

            assertThatCode(() -> store.unbindQueue("q", AmqpConstants.AMQ_DIRECT, "none", null))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should refuse bindings on the default exchange")
        void testDefaultExchangeBindings() {
            store.declareQueue("q", QueueOptions.defaults(), "c1");

            assertThatThrownBy(() -> store.bindQueue("q", "", "q", null))
                .isInstanceOf(AccessRefusedException.class);
            assertThatThrownBy(() -> store.bindExchange("", AmqpConstants.AMQ_DIRECT, "k", null))
                .isInstanceOf(AccessRefusedException.class);
        }

        @Test
        @DisplayName("Should fail when either end is missing")
        void testMissingEnds() {
            store.declareQueue("q", QueueOptions.defaults(), "c1");

            assertThatThrownBy(() -> store.bindQueue("q", "nope", "k", null))
                .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> store.bindQueue("nope", AmqpConstants.AMQ_DIRECT, "k", null))
                .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> store.bindExchange("nope", AmqpConstants.AMQ_DIRECT, "k", null))
                .isInstanceOf(NotFoundException.class);
        }
    }
}
