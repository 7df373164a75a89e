package com.tsdblink.client.spring.autoconfigure;

import com.tsdblink.client.core.TsdbClientOptions;
import com.tsdblink.client.transport.HttpConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the database client.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * tsdblink:
 *   client:
 *     address: http://tsdb:6041
 *     database: iot
 *     precision: ms
 *     convert-number: true
 *     default-number-value: 0
 *     write-encoding: gzip
 *     kafka:
 *       enabled: true
 *       bootstrap-servers: kafka:9092
 * }</pre>
 */
@ConfigurationProperties(prefix = "tsdblink.client")
public class TsdbLinkProperties {

    /** Master switch; when false no client beans are created. */
    private boolean enabled = true;

    private String address = HttpConfig.DEFAULT_ADDRESS;
    private String database = TsdbClientOptions.DEFAULT_DATABASE;
    private String user = TsdbClientOptions.DEFAULT_USER;
    private String password = TsdbClientOptions.DEFAULT_PASSWORD;
    private String precision = "ms";

    /** Coerce numeric and timestamp columns in {@code queryData}. */
    private boolean convertNumber;

    /** Stand-in for numeric cells that hold no number; integral or decimal text is bound as a number. */
    private String defaultNumberValue;

    /** {@code identity} or {@code gzip}. */
    private String writeEncoding = "identity";

    /** Whole-call HTTP timeout; zero disables it. */
    private Duration timeout = Duration.ZERO;

    private final Kafka kafka = new Kafka();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getPrecision() {
        return precision;
    }

    public void setPrecision(String precision) {
        this.precision = precision;
    }

    public boolean isConvertNumber() {
        return convertNumber;
    }

    public void setConvertNumber(boolean convertNumber) {
        this.convertNumber = convertNumber;
    }

    public String getDefaultNumberValue() {
        return defaultNumberValue;
    }

    public void setDefaultNumberValue(String defaultNumberValue) {
        this.defaultNumberValue = defaultNumberValue;
    }

    public String getWriteEncoding() {
        return writeEncoding;
    }

    public void setWriteEncoding(String writeEncoding) {
        this.writeEncoding = writeEncoding;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Kafka getKafka() {
        return kafka;
    }

    TsdbClientOptions toOptions() {
        return TsdbClientOptions.builder()
                .address(address)
                .database(database)
                .user(user)
                .password(password)
                .precision(precision)
                .convertNumber(convertNumber)
                .defaultNumberValue(TsdbClientOptions.parseNumberValue(defaultNumberValue))
                .build();
    }

    HttpConfig toHttpConfig() {
        return HttpConfig.builder()
                .address(address)
                .username(user)
                .password(password)
                .timeout(timeout)
                .writeEncoding(writeEncoding)
                .build();
    }

    /** Topic subscriptions through Kafka. */
    public static class Kafka {
        private boolean enabled;
        private String bootstrapServers = "localhost:9092";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }
    }
}
