package com.tsdblink.subscription.kafka;

import com.tsdblink.client.core.subscribe.MessageOffset;
import com.tsdblink.client.core.subscribe.PollEvent;
import com.tsdblink.client.core.subscribe.SubscribedMessage;
import com.tsdblink.client.core.subscribe.SubscriptionConsumer;
import com.tsdblink.client.core.subscribe.SubscriptionException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubscriptionConsumer} over a Kafka {@link Consumer}. A Kafka poll may return many records; they are
 * buffered and handed out one per {@link #poll(long)}.
 */
public class KafkaSubscriptionConsumer implements SubscriptionConsumer {
    private static final Logger log = LoggerFactory.getLogger(KafkaSubscriptionConsumer.class);

    private final Consumer<String, byte[]> consumer;
    private final String database;
    private final Deque<ConsumerRecord<String, byte[]>> pending = new ArrayDeque<>();

    public KafkaSubscriptionConsumer(Consumer<String, byte[]> consumer, String database) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.database = database == null ? "" : database;
    }

    @Override
    public void subscribe(String topic) throws SubscriptionException {
        try {
            consumer.subscribe(List.of(topic));
        } catch (KafkaException | IllegalStateException e) {
            throw new SubscriptionException("subscribe to " + topic + " failed", e);
        }
    }

    @Override
    public PollEvent poll(long timeoutMs) {
        if (pending.isEmpty()) {
            try {
                ConsumerRecords<String, byte[]> records = consumer.poll(Duration.ofMillis(timeoutMs));
                records.forEach(pending::add);
            } catch (KafkaException | IllegalStateException e) {
                return PollEvent.failure(e);
            }
        }
        ConsumerRecord<String, byte[]> record = pending.poll();
        if (record == null) return PollEvent.idle();
        log.debug("Received record {}-{}@{}", record.topic(), record.partition(), record.offset());
        return PollEvent.message(new SubscribedMessage(
                record.topic(), database, record.value(), new MessageOffset(record.partition(), record.offset())));
    }

    @Override
    public void unsubscribe() throws SubscriptionException {
        pending.clear();
        try {
            consumer.unsubscribe();
        } catch (KafkaException | IllegalStateException e) {
            throw new SubscriptionException("unsubscribe failed", e);
        }
    }

    @Override
    public void close() {
        try {
            consumer.close();
        } catch (KafkaException e) {
            log.warn("Failed to close Kafka consumer", e);
        }
    }
}
