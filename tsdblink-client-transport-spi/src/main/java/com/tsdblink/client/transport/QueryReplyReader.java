package com.tsdblink.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Validates and decodes a query reply. Shared by the HTTP transports so they only differ in how the
 * exchange is performed.
 */
public final class QueryReplyReader {
    static final String JSON_MEDIA_TYPE = "application/json";
    static final int DIAGNOSTIC_BODY_LIMIT = 1024;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private QueryReplyReader() {}

    /**
     * Checks in order: server-side failure (status 500 and above), foreign content type, decode.
     * An empty body is accepted as an empty reply only when the status is not 200.
     *
     * @param status HTTP status code
     * @param contentType raw {@code Content-Type} header, may be null
     * @param body response body; read but not closed
     */
    public static QueryResponse read(int status, String contentType, InputStream body) throws IOException {
        if (status >= 500) {
            byte[] bytes = body == null ? new byte[0] : body.readAllBytes();
            if (bytes.length == 0) {
                throw new TsdbHttpException(status, "received status code " + status + " from downstream server");
            }
            throw new TsdbHttpException(
                    status,
                    "received status code " + status + " from downstream server, with response body: \""
                            + new String(bytes, StandardCharsets.UTF_8) + "\"");
        }

        String mediaType = mediaType(contentType);
        if (!JSON_MEDIA_TYPE.equals(mediaType)) {
            byte[] head = body == null ? new byte[0] : body.readNBytes(DIAGNOSTIC_BODY_LIMIT);
            if (head.length == 0) {
                throw new TsdbHttpException(status, "expected json response, got empty body, with status: " + status);
            }
            throw new TsdbHttpException(
                    status,
                    "expected json response, got \"" + mediaType + "\", with status: " + status
                            + " and response body: \"" + new String(head, StandardCharsets.UTF_8) + "\"");
        }

        byte[] bytes = body == null ? new byte[0] : body.readAllBytes();
        QueryResponse response;
        if (isBlank(bytes)) {
            // known looseness: an empty non-200 body is not distinguished from a truncated one
            if (status == 200) {
                throw new TsdbDecodeException("unable to decode json: received status code 200 err: empty body");
            }
            response = QueryResponse.EMPTY;
        } else {
            response = decode(status, bytes);
        }

        if (status != 200 && response.error().isEmpty()) {
            throw new TsdbHttpException(status, "received status code " + status + " from server", response);
        }
        return response;
    }

    /** Lower-cased {@code type/subtype} without parameters; empty when absent. */
    static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semicolon = contentType.indexOf(';');
        String type = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return type.trim().toLowerCase(Locale.ROOT);
    }

    private static QueryResponse decode(int status, byte[] bytes) throws TsdbDecodeException {
        try {
            QueryResponse response = MAPPER.readValue(bytes, QueryResponse.class);
            // a literal null body
            return response == null ? QueryResponse.EMPTY : response;
        } catch (JsonProcessingException e) {
            throw new TsdbDecodeException(
                    "unable to decode json: received status code " + status + " err: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TsdbDecodeException("unable to decode json: received status code " + status, e);
        }
    }

    private static boolean isBlank(byte[] bytes) {
        for (byte b : bytes) {
            if (!Character.isWhitespace((char) b)) return false;
        }
        return true;
    }
}
