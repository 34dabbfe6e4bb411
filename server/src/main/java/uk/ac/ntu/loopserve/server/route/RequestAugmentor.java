package uk.ac.ntu.loopserve.server.route;

import com.sun.net.httpserver.HttpExchange;
import uk.ac.ntu.loopserve.common.http.HttpMethod;
import uk.ac.ntu.loopserve.common.json.JsonCodec;
import uk.ac.ntu.loopserve.server.data.KeyedDataStore;
import uk.ac.ntu.loopserve.server.db.Database;
import uk.ac.ntu.loopserve.server.loopback.LoopbackClient;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Turns an exchange into a {@link RouteRequest}: reads and decodes the body, then
 * attaches the shared store, a caller-bound loopback client and the database (if any).
 */
public final class RequestAugmentor {
    private final KeyedDataStore data;
    private final LoopbackClient loopback;
    private final Database db;
    private final JsonCodec json;

    public RequestAugmentor(KeyedDataStore data, LoopbackClient loopback, Database db, JsonCodec json) {
        this.data = Objects.requireNonNull(data, "data");
        this.loopback = Objects.requireNonNull(loopback, "loopback");
        this.db = db;
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * @throws IOException when the body cannot be read or inflated
     * @throws uk.ac.ntu.loopserve.common.json.JsonException when a JSON body does not parse
     */
    public RouteRequest augment(HttpExchange ex, HttpMethod method) throws IOException {
        byte[] raw = readBody(ex);
        Object body = isJson(ex.getRequestHeaders().getFirst("Content-Type")) ? json.read(raw) : null;
        LoopbackClient caller = loopback.forCaller(ex.getRequestHeaders().getFirst(LoopbackClient.USER_AGENT));
        return new RouteRequest(ex, method, raw, body, json, data, caller, db);
    }

    static boolean isJson(String contentType) {
        if (contentType == null) return false;
        String type = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return type.equals("application/json") || type.endsWith("+json");
    }

    private static byte[] readBody(HttpExchange ex) throws IOException {
        String encoding = ex.getRequestHeaders().getFirst("Content-Encoding");
        try (InputStream in = inflate(ex.getRequestBody(), encoding)) {
            return in.readAllBytes();
        }
    }

    private static InputStream inflate(InputStream in, String encoding) throws IOException {
        if (encoding == null || encoding.isBlank()) return in;
        switch (encoding.trim().toLowerCase(Locale.ROOT)) {
            case "gzip":
                return new GZIPInputStream(in);
            case "deflate":
                return new InflaterInputStream(in);
            case "identity":
                return in;
            default:
                throw new IOException("Unsupported Content-Encoding: " + encoding);
        }
    }
}
