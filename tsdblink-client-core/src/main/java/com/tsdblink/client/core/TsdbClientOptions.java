package com.tsdblink.client.core;

import com.tsdblink.client.transport.HttpConfig;
import com.tsdblink.point.Precision;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Connection and decoding settings for a {@link TsdbClient}.
 *
 * <p>{@link #fromEnvironment()} reads each setting from a system property ({@code tsdblink.host},
 * {@code tsdblink.port}, ...), then from the matching environment variable ({@code TSDBLINK_HOST}, ...),
 * then falls back to the local defaults.
 */
public final class TsdbClientOptions {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6041;
    public static final String DEFAULT_DATABASE = "iot";
    public static final String DEFAULT_USER = "root";
    public static final String DEFAULT_PASSWORD = "taosdata";

    private final String address;
    private final String database;
    private final String user;
    private final String password;
    private final Precision precision;
    private final boolean convertNumber;
    private final Object defaultNumberValue;

    private TsdbClientOptions(Builder b) {
        this.address = b.address;
        this.database = b.database;
        this.user = b.user;
        this.password = b.password;
        this.precision = b.precision;
        this.convertNumber = b.convertNumber;
        this.defaultNumberValue = b.defaultNumberValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TsdbClientOptions defaults() {
        return builder().build();
    }

    public static TsdbClientOptions fromEnvironment() {
        return fromEnvironment(System::getProperty, System::getenv);
    }

    static TsdbClientOptions fromEnvironment(UnaryOperator<String> properties, UnaryOperator<String> env) {
        String host = resolve(properties, env, "host", DEFAULT_HOST);
        String port = resolve(properties, env, "port", String.valueOf(DEFAULT_PORT));
        return builder()
                .address(host.contains("://") ? host : "http://" + host + ":" + port)
                .database(resolve(properties, env, "database", DEFAULT_DATABASE))
                .user(resolve(properties, env, "user", DEFAULT_USER))
                .password(resolve(properties, env, "password", DEFAULT_PASSWORD))
                .precision(resolve(properties, env, "precision", Precision.DEFAULT.unit()))
                .convertNumber(Boolean.parseBoolean(resolve(properties, env, "convertNumber", "false")))
                .defaultNumberValue(parseNumberValue(resolve(properties, env, "defaultNumberValue", null)))
                .build();
    }

    /**
     * Reads a configured stand-in for unreadable numeric cells: a {@code Long} for integral text, a
     * {@code Double} for decimal text, otherwise the text itself. Null or blank yields {@code null}.
     */
    public static Object parseNumberValue(String text) {
        if (text == null || text.isBlank()) return null;
        String value = text.trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException notIntegral) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException notNumeric) {
                return value;
            }
        }
    }

    private static String resolve(UnaryOperator<String> properties, UnaryOperator<String> env, String key, String fallback) {
        String sys = properties.apply("tsdblink." + key);
        if (sys != null && !sys.isBlank()) return sys.trim();
        // convertNumber -> TSDBLINK_CONVERT_NUMBER
        String envKey = key.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
        String envValue = env.apply("TSDBLINK_" + envKey);
        if (envValue != null && !envValue.isBlank()) return envValue.trim();
        return fallback;
    }

    public String address() {
        return address;
    }

    public String database() {
        return database;
    }

    public String user() {
        return user;
    }

    public String password() {
        return password;
    }

    public Precision precision() {
        return precision;
    }

    /** Whether {@link TsdbClient#queryData(String)} coerces numeric and timestamp columns; off by default. */
    public boolean convertNumber() {
        return convertNumber;
    }

    /** Substitute for numeric cells that cannot be read as numbers; may be {@code null}. */
    public Object defaultNumberValue() {
        return defaultNumberValue;
    }

    public HttpConfig toHttpConfig() {
        return HttpConfig.builder().address(address).username(user).password(password).build();
    }

    @Override
    public String toString() {
        return "TsdbClientOptions[" + address + " db=" + database + " user=" + user + " precision=" + precision
                + " convertNumber=" + convertNumber + "]";
    }

    public static final class Builder {
        private String address = "http://" + DEFAULT_HOST + ":" + DEFAULT_PORT;
        private String database = DEFAULT_DATABASE;
        private String user = DEFAULT_USER;
        private String password = DEFAULT_PASSWORD;
        private Precision precision = Precision.DEFAULT;
        private boolean convertNumber;
        private Object defaultNumberValue;

        public Builder address(String address) {
            this.address = Objects.requireNonNull(address, "address");
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        /**
         * @throws IllegalArgumentException for a unit other than ns, us, ms or s
         */
        public Builder precision(String unit) {
            this.precision = Precision.parse(unit);
            return this;
        }

        public Builder precision(Precision precision) {
            this.precision = Objects.requireNonNull(precision, "precision");
            return this;
        }

        public Builder convertNumber(boolean convertNumber) {
            this.convertNumber = convertNumber;
            return this;
        }

        public Builder defaultNumberValue(Object value) {
            this.defaultNumberValue = value;
            return this;
        }

        public TsdbClientOptions build() {
            return new TsdbClientOptions(this);
        }
    }
}
