package com.minibroker.consumer;

import com.minibroker.consumer.UnackedMessages.UnackedMessage;
import com.minibroker.model.Message;
import com.minibroker.model.MessageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Unacked Messages Tests")
class UnackedMessagesTest {

    private UnackedMessages unacked;

    @BeforeEach
    void setUp() {
        unacked = new UnackedMessages();
    }

    private long trackNext() {
        long tag = unacked.nextDeliveryTag();
        Message message = new Message(new byte[]{(byte) tag}, "", "q", MessageProperties.EMPTY);
        unacked.track(new UnackedMessage(tag, message, "q", null, false));
        return tag;
    }

    private static List<Long> tags(List<UnackedMessage> entries) {
        return entries.stream().map(UnackedMessage::getDeliveryTag).toList();
    }

    @Test
    @DisplayName("Tags should start at 1 and increase")
    void testTagSequence() {
        assertThat(trackNext()).isEqualTo(1);
        assertThat(trackNext()).isEqualTo(2);
        assertThat(trackNext()).isEqualTo(3);
    }

    @Test
    @DisplayName("Single removal should only remove the given tag")
    void testSingleRemove() {
        trackNext();
        trackNext();

        assertThat(tags(unacked.remove(2, false))).containsExactly(2L);
        assertThat(unacked.remove(2, false)).isEmpty();
        assertThat(unacked.contains(1)).isTrue();
    }

    @Test
    @DisplayName("Multiple removal should remove everything up to the tag")
    void testMultipleRemove() {
        trackNext();
        trackNext();
        trackNext();

        assertThat(tags(unacked.remove(2, true))).containsExactly(1L, 2L);
        assertThat(unacked.size()).isEqualTo(1);
        assertThat(unacked.contains(3)).isTrue();
    }

    @Test
    @DisplayName("Multiple with tag 0 should match nothing")
    void testMultipleWithZero() {
        trackNext();
        trackNext();

        assertThat(unacked.remove(0, true)).isEmpty();
        assertThat(unacked.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Remove all should empty the set in tag order")
    void testRemoveAll() {
        trackNext();
        trackNext();

        assertThat(tags(unacked.removeAll())).containsExactly(1L, 2L);
        assertThat(unacked.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Tags should not be reused after removal")
    void testNoReuse() {
        trackNext();
        unacked.removeAll();

        assertThat(trackNext()).isEqualTo(2);
        assertThat(tags(unacked.snapshot())).containsExactly(2L);
    }
}
