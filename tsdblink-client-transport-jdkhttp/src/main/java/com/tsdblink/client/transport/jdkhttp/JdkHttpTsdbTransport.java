package com.tsdblink.client.transport.jdkhttp;

import com.tsdblink.client.transport.ContentEncoding;
import com.tsdblink.client.transport.HttpConfig;
import com.tsdblink.client.transport.LineProtocolPayload;
import com.tsdblink.client.transport.Query;
import com.tsdblink.client.transport.QueryReplyReader;
import com.tsdblink.client.transport.QueryResponse;
import com.tsdblink.client.transport.TsdbHttpException;
import com.tsdblink.client.transport.TsdbTransport;
import com.tsdblink.point.BatchPoints;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/** JDK11+ HttpClient transport (zero external deps). */
public class JdkHttpTsdbTransport implements TsdbTransport {
    private final HttpConfig config;
    private final HttpClient client;

    public JdkHttpTsdbTransport(HttpConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        HttpClient.Builder builder = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1);
        Proxy proxy = config.proxy();
        if (proxy != null && proxy.address() instanceof InetSocketAddress) {
            builder.proxy(ProxySelector.of((InetSocketAddress) proxy.address()));
        }
        this.client = builder.build();
    }

    @Override
    public void write(BatchPoints batch) throws IOException {
        byte[] body = LineProtocolPayload.encode(batch, config.writeEncoding());
        String db = batch.database() == null ? "" : batch.database();
        URI uri = resolve(WRITE_PATH + "?db=" + encode(db) + "&precision=" + encode(batch.precision().unit()));
        HttpRequest.Builder req = newRequest(uri, body);
        if (config.writeEncoding() != ContentEncoding.IDENTITY) {
            req.header("Content-Encoding", config.writeEncoding().headerValue());
        }
        HttpResponse<String> resp = send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200 && resp.statusCode() != 204) {
            throw new TsdbHttpException(resp.statusCode(), resp.body());
        }
    }

    @Override
    public QueryResponse query(Query query) throws IOException {
        String path = query.hasDatabase() ? QUERY_PATH + "/" + encode(query.database()) : QUERY_PATH;
        HttpRequest req = newRequest(resolve(path), query.command().getBytes(StandardCharsets.UTF_8))
                .build();
        HttpResponse<InputStream> resp = send(req, HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream in = resp.body()) {
            return QueryReplyReader.read(
                    resp.statusCode(), resp.headers().firstValue("Content-Type").orElse(null), in);
        }
    }

    private HttpRequest.Builder newRequest(URI uri, byte[] body) {
        // both endpoints expect an empty Content-Type
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .header("Content-Type", "")
                .header("User-Agent", config.userAgent())
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (!config.timeout().isZero()) req.timeout(config.timeout());
        if (config.hasCredentials()) {
            String password = config.password() == null ? "" : config.password();
            String token = Base64.getEncoder()
                    .encodeToString((config.username() + ":" + password).getBytes(StandardCharsets.UTF_8));
            req.header("Authorization", "Basic " + token);
        }
        return req;
    }

    private <T> HttpResponse<T> send(HttpRequest req, HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return client.send(req, handler);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ie);
        }
    }

    private URI resolve(String pathAndQuery) {
        String base = config.address().toString();
        return URI.create(base.endsWith("/") ? base + pathAndQuery : base + "/" + pathAndQuery);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
