package com.tsdblink.subscription.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tsdblink.client.core.subscribe.BoundedChannel;
import com.tsdblink.client.core.subscribe.CancellationToken;
import com.tsdblink.client.core.subscribe.MessageOffset;
import com.tsdblink.client.core.subscribe.PollEvent;
import com.tsdblink.client.core.subscribe.SubscribedMessage;
import com.tsdblink.client.core.subscribe.SubscriptionBridge;
import com.tsdblink.client.core.subscribe.SubscriptionException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

class KafkaSubscriptionConsumerTest {

    private static final String TOPIC = "meters_topic";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private final MockConsumer<String, byte[]> mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);

    private void assign() {
        mock.rebalance(List.of(PARTITION));
        mock.updateBeginningOffsets(Map.of(PARTITION, 0L));
    }

    private void record(long offset, String value) {
        mock.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, "k", value.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void buffersBatchAndHandsOutOneMessagePerPoll() throws Exception {
        KafkaSubscriptionConsumer consumer = new KafkaSubscriptionConsumer(mock, "iot");
        consumer.subscribe(TOPIC);
        assign();
        record(0, "a");
        record(1, "b");

        PollEvent first = consumer.poll(10);
        PollEvent second = consumer.poll(10);
        PollEvent third = consumer.poll(10);

        assertThat(first).isInstanceOfSatisfying(PollEvent.Message.class, m -> {
            assertThat(m.message().topic()).isEqualTo(TOPIC);
            assertThat(m.message().database()).isEqualTo("iot");
            assertThat(m.message().offset()).isEqualTo(new MessageOffset(0, 0));
            assertThat(new String((byte[]) m.message().value(), StandardCharsets.UTF_8)).isEqualTo("a");
        });
        assertThat(second).isInstanceOfSatisfying(PollEvent.Message.class,
                m -> assertThat(m.message().offset().position()).isEqualTo(1));
        assertThat(third).isInstanceOf(PollEvent.Idle.class);
        assertThat(mock.subscription()).containsExactly(TOPIC);
    }

    @Test
    void kafkaErrorsBecomeFailureEvents() throws Exception {
        KafkaSubscriptionConsumer consumer = new KafkaSubscriptionConsumer(mock, "iot");
        consumer.subscribe(TOPIC);
        assign();
        KafkaException boom = new KafkaException("broker unavailable");
        mock.setPollException(boom);

        assertThat(consumer.poll(10)).isInstanceOfSatisfying(PollEvent.Failure.class,
                f -> assertThat(f.cause()).isSameAs(boom));
    }

    @Test
    void unsubscribeAfterCloseIsReported() {
        KafkaSubscriptionConsumer consumer = new KafkaSubscriptionConsumer(mock, "iot");
        consumer.close();

        assertThat(mock.closed()).isTrue();
        assertThatThrownBy(consumer::unsubscribe).isInstanceOf(SubscriptionException.class);
    }

    @Test
    void bridgeDrainsKafkaRecordsIntoChannel() throws Exception {
        CancellationToken token = new CancellationToken();
        mock.schedulePollTask(() -> {
            assign();
            record(0, "x");
        });
        mock.schedulePollTask(token::cancel);
        KafkaSubscriptionConsumerFactory factory =
                new KafkaSubscriptionConsumerFactory(new KafkaSubscriptionProperties(), config -> mock);
        BoundedChannel<SubscribedMessage> channel = new BoundedChannel<>(4);

        new SubscriptionBridge(factory).run(token, TOPIC, channel);

        List<SubscribedMessage> received = new ArrayList<>();
        channel.drainTo(received);
        assertThat(received).extracting(SubscribedMessage::offset).containsExactly(new MessageOffset(0, 0));
        assertThat(channel.isClosed()).isTrue();
        assertThat(mock.closed()).isTrue();
    }

    @Test
    void factoryGroupsConsumersByTopic() throws Exception {
        KafkaSubscriptionProperties props = new KafkaSubscriptionProperties();
        props.setBootstrapServers("kafka:9092");
        Map<String, Object> captured = new HashMap<>();
        KafkaSubscriptionConsumerFactory factory = new KafkaSubscriptionConsumerFactory(props, config -> {
            captured.putAll(config);
            return mock;
        });

        factory.create(TOPIC).close();

        assertThat(captured)
                .containsEntry(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, "kafka:9092")
                .containsEntry(ConsumerConfig.GROUP_ID_CONFIG, TOPIC)
                .containsEntry(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest")
                .containsEntry(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        assertThat((String) captured.get(ConsumerConfig.CLIENT_ID_CONFIG)).matches("tsdblink_.+-\\d+");
    }
}
