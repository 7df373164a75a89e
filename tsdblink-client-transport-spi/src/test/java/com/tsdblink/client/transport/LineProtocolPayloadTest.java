package com.tsdblink.client.transport;

import static org.assertj.core.api.Assertions.assertThat;

import com.tsdblink.point.BatchPoints;
import com.tsdblink.point.Point;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;

class LineProtocolPayloadTest {

    @Test
    void skipsNullPoints() throws Exception {
        BatchPoints batch = BatchPoints.builder().precision("s").build();
        batch.addPoint(null);
        batch.addPoint(Point.builder("cpu").field("v", 1).time(Instant.ofEpochSecond(10)).build());

        byte[] body = LineProtocolPayload.encode(batch, ContentEncoding.IDENTITY);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("cpu v=1i 10\n");
    }

    @Test
    void gzipCompressesTheSameLines() throws Exception {
        BatchPoints batch = BatchPoints.builder().build();
        batch.addPoint(Point.builder("a").field("v", true).build());
        batch.addPoint(Point.builder("b").field("v", "x").build());

        byte[] body = LineProtocolPayload.encode(batch, ContentEncoding.GZIP);

        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("a v=true\nb v=\"x\"\n");
        }
    }
}
