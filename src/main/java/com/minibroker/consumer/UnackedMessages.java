package com.minibroker.consumer;

import com.minibroker.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Delivery tags and the messages delivered under them on one channel, for messages
 * delivered in explicit-ack mode and not yet settled.
 * <p>
 * Tags start at 1 and are never reused on the channel. Assigning a tag and tracking its
 * message happen under this object's monitor, so tags appear in the map in the order they
 * were issued.
 */
public class UnackedMessages {

    private long lastTag = 0;
    private final NavigableMap<Long, UnackedMessage> entries = new ConcurrentSkipListMap<>();

    public synchronized long nextDeliveryTag() {
        return ++lastTag;
    }

    public synchronized void track(UnackedMessage unacked) {
        entries.put(unacked.getDeliveryTag(), unacked);
    }

    /**
     * Remove the entry for {@code deliveryTag}, or with {@code multiple} every entry up to
     * and including it. Tags start at 1, so tag 0 matches nothing.
     *
     * @return removed entries in tag order, empty if none matched
     */
    public synchronized List<UnackedMessage> remove(long deliveryTag, boolean multiple) {
        if (multiple) {
            Map<Long, UnackedMessage> head = entries.headMap(deliveryTag, true);
            List<UnackedMessage> removed = new ArrayList<>(head.values());
            head.clear();
            return removed;
        }
        UnackedMessage unacked = entries.remove(deliveryTag);
        return unacked == null ? Collections.emptyList() : Collections.singletonList(unacked);
    }

    public synchronized List<UnackedMessage> removeAll() {
        List<UnackedMessage> removed = new ArrayList<>(entries.values());
        entries.clear();
        return removed;
    }

    public synchronized List<UnackedMessage> snapshot() {
        return new ArrayList<>(entries.values());
    }

    public boolean contains(long deliveryTag) {
        return entries.containsKey(deliveryTag);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public static class UnackedMessage {
        private final long deliveryTag;
        private final Message message;
        private final String queueName;
        private final Consumer consumer;
        private final boolean holdsGlobalCredit;

        public UnackedMessage(long deliveryTag, Message message, String queueName,
                              Consumer consumer, boolean holdsGlobalCredit) {
            this.deliveryTag = deliveryTag;
            this.message = message;
            this.queueName = queueName;
            this.consumer = consumer;
            this.holdsGlobalCredit = holdsGlobalCredit;
        }

        public long getDeliveryTag() {
            return deliveryTag;
        }

        public Message getMessage() {
            return message;
        }

        public String getQueueName() {
            return queueName;
        }

        /**
         * The consumer the message went to, or {@code null} for a get.
         */
        public Consumer getConsumer() {
            return consumer;
        }

        public boolean holdsGlobalCredit() {
            return holdsGlobalCredit;
        }
    }
}
