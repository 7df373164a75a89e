package com.tsdblink.client.transport.okhttp;

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
import java.net.Inet4Address;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Objects;
import okhttp3.Credentials;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based transport. */
public class OkHttpTsdbTransport implements TsdbTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpTsdbTransport.class);
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final HttpConfig config;
    private final HttpUrl baseUrl;
    private final OkHttpClient client;

    public OkHttpTsdbTransport(HttpConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.baseUrl = HttpUrl.get(config.address().toString());
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .dns(PREFER_IPV4_DNS)
                .callTimeout(config.timeout());
        if (config.proxy() != null) builder.proxy(config.proxy());
        this.client = builder.build();
    }

    @Override
    public void write(BatchPoints batch) throws IOException {
        byte[] body = LineProtocolPayload.encode(batch, config.writeEncoding());
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments(WRITE_PATH)
                .addQueryParameter("db", batch.database() == null ? "" : batch.database())
                .addQueryParameter("precision", batch.precision().unit())
                .build();
        Request.Builder req = newRequest(url, body);
        if (config.writeEncoding() != ContentEncoding.IDENTITY) {
            req.header("Content-Encoding", config.writeEncoding().headerValue());
        }
        Request request = req.build();
        log.debug("Sending write request {} {} ({} bytes)", request.method(), url, body.length);
        try (Response r = client.newCall(request).execute()) {
            String responseBody = r.body() != null ? r.body().string() : "";
            if (r.code() != 200 && r.code() != 204) {
                log.warn("Write request {} failed with status {} and body: {}", url, r.code(), responseBody);
                throw new TsdbHttpException(r.code(), responseBody);
            }
        }
    }

    @Override
    public QueryResponse query(Query query) throws IOException {
        HttpUrl.Builder url = baseUrl.newBuilder().addPathSegments(QUERY_PATH);
        if (query.hasDatabase()) url.addPathSegment(query.database());
        Request request = newRequest(url.build(), query.command().getBytes(StandardCharsets.UTF_8)).build();
        if (log.isDebugEnabled()) {
            log.debug("Sending query request {} {}: {}", request.method(), request.url(), query.command());
        }
        try (Response r = client.newCall(request).execute()) {
            ResponseBody body = r.body();
            try (InputStream in = body != null ? body.byteStream() : InputStream.nullInputStream()) {
                return QueryReplyReader.read(r.code(), r.header("Content-Type"), in);
            }
        }
    }

    private Request.Builder newRequest(HttpUrl url, byte[] body) {
        Request.Builder req = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, (MediaType) null))
                .header("Content-Type", "")
                .header("User-Agent", config.userAgent());
        if (config.hasCredentials()) {
            req.header("Authorization", Credentials.basic(config.username(), nullToEmpty(config.password())));
        }
        return req;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void close() {
        client.connectionPool().evictAll();
    }

    @Override
    public String toString() {
        return "OkHttpTsdbTransport[" + baseUrl + "]";
    }
}
