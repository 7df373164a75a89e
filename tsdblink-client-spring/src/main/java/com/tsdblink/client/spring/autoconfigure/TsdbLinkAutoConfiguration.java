package com.tsdblink.client.spring.autoconfigure;

import com.tsdblink.client.core.TsdbClient;
import com.tsdblink.client.core.subscribe.SubscriptionConsumerFactory;
import com.tsdblink.client.transport.TsdbTransport;
import com.tsdblink.client.transport.jdkhttp.JdkHttpTsdbTransport;
import com.tsdblink.client.transport.okhttp.OkHttpTsdbTransport;
import com.tsdblink.subscription.kafka.KafkaSubscriptionConsumerFactory;
import com.tsdblink.subscription.kafka.KafkaSubscriptionProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@AutoConfiguration
@EnableConfigurationProperties(TsdbLinkProperties.class)
@ConditionalOnProperty(prefix = "tsdblink.client", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TsdbLinkAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(OkHttpTsdbTransport.class)
    static class OkHttpTransportConfig {
        @Bean
        @ConditionalOnMissingBean(TsdbTransport.class)
        public TsdbTransport okHttpTsdbTransport(TsdbLinkProperties props) {
            return new OkHttpTsdbTransport(props.toHttpConfig());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(KafkaSubscriptionConsumerFactory.class)
    @ConditionalOnProperty(prefix = "tsdblink.client.kafka", name = "enabled", havingValue = "true")
    static class KafkaSubscriptionConfig {
        @Bean
        @ConditionalOnMissingBean(SubscriptionConsumerFactory.class)
        public SubscriptionConsumerFactory kafkaSubscriptionConsumerFactory(TsdbLinkProperties props) {
            KafkaSubscriptionProperties kafka = new KafkaSubscriptionProperties();
            kafka.setBootstrapServers(props.getKafka().getBootstrapServers());
            kafka.setDatabase(props.getDatabase());
            return new KafkaSubscriptionConsumerFactory(kafka);
        }
    }

    @Bean
    @ConditionalOnMissingBean(TsdbTransport.class)
    public TsdbTransport jdkHttpTsdbTransport(TsdbLinkProperties props) {
        return new JdkHttpTsdbTransport(props.toHttpConfig());
    }

    @Bean
    @ConditionalOnMissingBean
    public TsdbClient tsdbClient(
            TsdbTransport transport,
            TsdbLinkProperties props,
            ObjectProvider<SubscriptionConsumerFactory> consumerFactory) {
        return new TsdbClient(transport, props.toOptions(), consumerFactory.getIfAvailable());
    }
}
