package com.tsdblink.client.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tsdblink.client.core.TsdbClient;
import com.tsdblink.client.core.TsdbClientOptions;
import com.tsdblink.client.transport.QueryResponse;
import com.tsdblink.point.BatchPoints;
import com.tsdblink.point.Point;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryTsdbTransportTest {

    @Test
    void recordsOneLinePerNonNullPoint() throws Exception {
        InMemoryTsdbTransport transport = new InMemoryTsdbTransport();
        BatchPoints batch = BatchPoints.builder().database("iot").precision("ms").build();
        batch.addPoint(null);
        batch.addPoint(Point.builder("cpu").tag("host", "a").field("load", 0.25).time(Instant.ofEpochMilli(7)).build());

        transport.write(batch);

        assertThat(transport.lines()).containsExactly("cpu,host=a load=0.25 7");
        assertThat(transport.points()).singleElement()
                .satisfies(p -> assertThat(p.fields()).containsEntry("load", 0.25));
    }

    @Test
    void clientRoundTripThroughInMemoryTransport() throws Exception {
        InMemoryTsdbTransport transport = new InMemoryTsdbTransport()
                .reply(new QueryResponse(0, null, List.of(List.of("v", "DOUBLE", 8)), List.of(List.of("1.5")), 1));

        try (TsdbClient client = new TsdbClient(transport, TsdbClientOptions.defaults())) {
            client.writeData("meters", Map.of("site", "north"), Map.of("v", 1.5));
            assertThat(client.queryData("select v from meters", true)).containsExactly(Map.of("v", 1.5d));
        }

        assertThat(transport.lines()).containsExactly("meters,site=north v=1.5");
        assertThat(transport.queries()).singleElement().satisfies(q -> assertThat(q.database()).isEqualTo("iot"));
        assertThat(transport.isClosed()).isTrue();
        assertThatThrownBy(() -> transport.write(BatchPoints.builder().build())).isInstanceOf(IOException.class);
    }
}
