package com.tsdblink.client.transport;

import com.tsdblink.point.BatchPoints;
import com.tsdblink.point.Point;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

/** Renders a batch as a newline-terminated line-protocol request body. */
public final class LineProtocolPayload {

    private LineProtocolPayload() {}

    /**
     * Every non-null point rendered at the batch precision, one per line, gzip-compressed when
     * {@code encoding} asks for it.
     */
    public static byte[] encode(BatchPoints batch, ContentEncoding encoding) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
        try (OutputStream out = encoding == ContentEncoding.GZIP ? new GZIPOutputStream(buffer) : buffer) {
            for (Point p : batch.points()) {
                if (p == null) continue;
                out.write(p.precisionString(batch.precision()).getBytes(StandardCharsets.UTF_8));
                out.write('\n');
            }
        }
        return buffer.toByteArray();
    }
}
