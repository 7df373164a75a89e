package com.tsdblink.client.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tsdblink.client.core.TsdbClient;
import com.tsdblink.client.core.TsdbClientOptions;
import com.tsdblink.client.core.subscribe.BoundedChannel;
import com.tsdblink.client.core.subscribe.CancellationToken;
import com.tsdblink.client.core.subscribe.MessageOffset;
import com.tsdblink.client.core.subscribe.SubscribedMessage;
import com.tsdblink.client.core.subscribe.SubscriptionException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ScriptedSubscriptionConsumerTest {

    private final ScriptedSubscriptionConsumer consumer = new ScriptedSubscriptionConsumer();

    @Test
    void backgroundSubscriptionDeliversUntilCancelled() throws Exception {
        SubscribedMessage message = new SubscribedMessage("alerts", "iot", "{\"v\":1}", new MessageOffset(0, 3));
        BoundedChannel<SubscribedMessage> channel = new BoundedChannel<>(16);
        CancellationToken token = new CancellationToken();

        try (TsdbClient client = new TsdbClient(new InMemoryTsdbTransport(), TsdbClientOptions.defaults(), consumer)) {
            CompletableFuture<Void> done = client.subscribe(token, "alerts", channel);
            consumer.emit(message);

            assertThat(channel.poll(5, TimeUnit.SECONDS)).isSameAs(message);
            token.cancel();
            done.get(5, TimeUnit.SECONDS);
        }

        assertThat(channel.isClosed()).isTrue();
        assertThat(consumer.calls()).containsExactly("create:alerts", "subscribe:alerts", "unsubscribe", "close");
    }

    @Test
    void failedUnsubscribeSurfacesThroughFuture() throws Exception {
        consumer.failUnsubscribe(new SubscriptionException("unsubscribe rejected"));
        BoundedChannel<SubscribedMessage> channel = new BoundedChannel<>(1);
        CancellationToken token = new CancellationToken();
        token.cancel();

        try (TsdbClient client = new TsdbClient(new InMemoryTsdbTransport(), TsdbClientOptions.defaults(), consumer)) {
            CompletableFuture<Void> done = client.subscribe(token, "alerts", channel);
            assertThatThrownBy(() -> done.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasRootCauseMessage("unsubscribe rejected");
        }

        assertThat(channel.isClosed()).isFalse();
        assertThat(consumer.isClosed()).isTrue();
    }
}
