package com.tsdblink.subscription.kafka;

import com.tsdblink.client.core.subscribe.SubscriptionConsumer;
import com.tsdblink.client.core.subscribe.SubscriptionConsumerFactory;
import com.tsdblink.client.core.subscribe.SubscriptionException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;

/** One Kafka consumer per subscription, grouped by topic so each topic is consumed once per application. */
public class KafkaSubscriptionConsumerFactory implements SubscriptionConsumerFactory {
    private static final int CLIENT_ID_RANGE = 86400;

    private final KafkaSubscriptionProperties props;
    private final Function<Map<String, Object>, Consumer<String, byte[]>> consumers;

    public KafkaSubscriptionConsumerFactory(KafkaSubscriptionProperties props) {
        this(props, KafkaConsumer::new);
    }

    KafkaSubscriptionConsumerFactory(
            KafkaSubscriptionProperties props, Function<Map<String, Object>, Consumer<String, byte[]>> consumers) {
        this.props = Objects.requireNonNull(props, "props");
        this.consumers = Objects.requireNonNull(consumers, "consumers");
    }

    @Override
    public SubscriptionConsumer create(String topic) throws SubscriptionException {
        try {
            return new KafkaSubscriptionConsumer(consumers.apply(consumerConfig(topic)), props.getDatabase());
        } catch (KafkaException e) {
            throw new SubscriptionException("cannot create consumer for topic " + topic, e);
        }
    }

    Map<String, Object> consumerConfig(String topic) {
        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        config.put(ConsumerConfig.GROUP_ID_CONFIG, topic);
        config.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId());
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, props.getAutoOffsetReset());
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, props.isEnableAutoCommit());
        return config;
    }

    private String clientId() {
        return props.getClientIdPrefix() + "_" + hostname() + "-" + ThreadLocalRandom.current().nextInt(CLIENT_ID_RANGE);
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
