package com.tsdblink.client.transport;

import java.net.Proxy;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Settings an HTTP transport is built from. Validated eagerly by {@link Builder#build()} so a transport
 * never starts with a half-applied configuration.
 */
public final class HttpConfig {
    public static final String DEFAULT_ADDRESS = "http://127.0.0.1:6041";
    public static final String DEFAULT_USER_AGENT = "tsdblink-client";

    private final URI address;
    private final String username;
    private final String password;
    private final String userAgent;
    private final Duration timeout;
    private final Proxy proxy;
    private final ContentEncoding writeEncoding;

    private HttpConfig(Builder b) {
        this.address = b.parsedAddress;
        this.username = b.username;
        this.password = b.password;
        this.userAgent = b.userAgent;
        this.timeout = b.timeout;
        this.proxy = b.proxy;
        this.writeEncoding = b.writeEncoding;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Base address, e.g. {@code http://host:6041}. */
    public URI address() {
        return address;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public String userAgent() {
        return userAgent;
    }

    /** Whole-call timeout; {@link Duration#ZERO} means none. */
    public Duration timeout() {
        return timeout;
    }

    /** Proxy to route through, or {@code null} for the system default. */
    public Proxy proxy() {
        return proxy;
    }

    public ContentEncoding writeEncoding() {
        return writeEncoding;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "HttpConfig[%s user=%s encoding=%s]", address, username, writeEncoding);
    }

    public static final class Builder {
        private String address = DEFAULT_ADDRESS;
        private URI parsedAddress;
        private String username;
        private String password;
        private String userAgent = DEFAULT_USER_AGENT;
        private Duration timeout = Duration.ZERO;
        private Proxy proxy;
        private ContentEncoding writeEncoding = ContentEncoding.IDENTITY;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder proxy(Proxy proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder writeEncoding(ContentEncoding encoding) {
            this.writeEncoding = Objects.requireNonNull(encoding, "encoding");
            return this;
        }

        /**
         * @throws IllegalArgumentException for an unsupported encoding name
         */
        public Builder writeEncoding(String encoding) {
            return writeEncoding(ContentEncoding.parse(encoding));
        }

        /**
         * @throws IllegalArgumentException when the address is missing, unparsable or not http/https
         */
        public HttpConfig build() {
            if (address == null || address.isBlank()) {
                throw new IllegalArgumentException("address is required");
            }
            URI uri;
            try {
                uri = new URI(address.trim());
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("invalid address " + address, e);
            }
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new IllegalArgumentException("Unsupported protocol scheme: " + uri.getScheme()
                        + ", your address must start with http:// or https://");
            }
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("invalid address " + address + ": missing host");
            }
            if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
            this.parsedAddress = uri;
            return new HttpConfig(this);
        }
    }
}
