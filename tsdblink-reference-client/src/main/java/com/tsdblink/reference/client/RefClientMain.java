package com.tsdblink.reference.client;

import com.tsdblink.client.core.PingResult;
import com.tsdblink.client.core.TsdbClient;
import com.tsdblink.client.core.TsdbClientOptions;
import com.tsdblink.client.transport.okhttp.OkHttpTsdbTransport;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes one demo point and reads it back, using settings from {@code tsdblink.*} / {@code TSDBLINK_*}. */
public class RefClientMain {
    private static final Logger log = LoggerFactory.getLogger(RefClientMain.class);

    public static void main(String[] args) throws Exception {
        TsdbClientOptions options = TsdbClientOptions.fromEnvironment();
        try (var client = new TsdbClient(new OkHttpTsdbTransport(options.toHttpConfig()), options)) {
            PingResult ping = client.ping();
            log.info("Connected to {} (server {}, {} ms)", options.address(), ping.version(), ping.roundTrip().toMillis());

            client.writeData("demo_meters", Map.of("site", "demo"), Map.of("current", 10.3, "voltage", 219));
            long rows = client.queryCount("current", "demo_meters", "");
            log.info("demo_meters now holds {} rows", rows);
        }
    }
}
