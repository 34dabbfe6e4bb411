package uk.ac.ntu.loopserve.server.route;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import uk.ac.ntu.loopserve.common.http.HttpMethod;
import uk.ac.ntu.loopserve.common.json.JsonCodec;
import uk.ac.ntu.loopserve.server.data.DataUpdate;
import uk.ac.ntu.loopserve.server.data.KeyedDataStore;
import uk.ac.ntu.loopserve.server.db.Database;
import uk.ac.ntu.loopserve.server.http.Exchanges;
import uk.ac.ntu.loopserve.server.loopback.LoopbackClient;

import java.net.URLDecoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An inbound request together with what handlers may use while serving it:
 * the shared data store, a loopback client carrying the caller's identity,
 * and the database when one is configured.
 * Built complete by {@link RequestAugmentor} before the handler runs.
 */
public final class RouteRequest {
    private final HttpExchange exchange;
    private final HttpMethod method;
    private final String path;
    private final Map<String, String> query;
    private final byte[] rawBody;
    private final Object body;
    private final JsonCodec json;

    private final KeyedDataStore data;
    private final LoopbackClient loopback;
    private final Database db;

    RouteRequest(HttpExchange exchange, HttpMethod method, byte[] rawBody, Object body, JsonCodec json,
                 KeyedDataStore data, LoopbackClient loopback, Database db) {
        this.exchange = exchange;
        this.method = method;
        this.path = Exchanges.path(exchange);
        this.query = parseQuery(exchange.getRequestURI().getRawQuery());
        this.rawBody = rawBody;
        this.body = body;
        this.json = json;
        this.data = data;
        this.loopback = loopback;
        this.db = db;
    }

    // ---- request ----

    public HttpMethod method() { return method; }
    public String path() { return path; }
    public Headers headers() { return exchange.getRequestHeaders(); }
    public String header(String name) { return exchange.getRequestHeaders().getFirst(name); }
    public String remote() { return Exchanges.remote(exchange); }
    public HttpExchange exchange() { return exchange; }

    public Map<String, String> query() {
        return query;
    }

    public String query(String name) {
        return query.get(name);
    }

    @SuppressWarnings("unchecked")
    public <T> T body() {
        return (T) body;
    }

    public <T> T body(Class<T> type) {
        return json.convert(body, type);
    }

    public String text() {
        return new String(rawBody, StandardCharsets.UTF_8);
    }

    public byte[] rawBody() {
        return rawBody.clone();
    }

    // ---- data ----

    public KeyedDataStore store() {
        return data;
    }

    public <T> T data(Object key) {
        return data.get(key);
    }

    public <T> T data(Object key, T def) {
        return data.getOrPut(key, def);
    }

    public <T> CompletableFuture<T> data(Object key, T def, DataUpdate<T> update) {
        return data.getOrPut(key, def, update);
    }

    // ---- loopback ----

    public LoopbackClient loopback() {
        return loopback;
    }

    public CompletableFuture<HttpResponse<String>> fetch(String path, Consumer<HttpRequest.Builder> init) {
        return loopback.fetch(path, init);
    }

    public <T> CompletableFuture<T> get(String path) { return loopback.get(path); }
    public <T> CompletableFuture<T> post(String path, Object body) { return loopback.post(path, body); }
    public <T> CompletableFuture<T> put(String path, Object body) { return loopback.put(path, body); }
    public <T> CompletableFuture<T> patch(String path, Object body) { return loopback.patch(path, body); }
    public <T> CompletableFuture<T> delete(String path) { return loopback.delete(path); }

    // ---- database ----

    public boolean hasDb() {
        return db != null;
    }

    /**
     * @throws IllegalStateException when the service was started without a database
     */
    public Database db() {
        if (db == null) throw new IllegalStateException("No database configured");
        return db;
    }

    private static Map<String, String> parseQuery(String raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : raw.split("&")) {
            if (part.isEmpty()) continue;
            String[] kv = part.split("=", 2);
            out.putIfAbsent(urlDecode(kv[0]), kv.length == 2 ? urlDecode(kv[1]) : "");
        }
        return Collections.unmodifiableMap(out);
    }

    private static String urlDecode(String s) {
        try { return URLDecoder.decode(s, StandardCharsets.UTF_8); }
        catch (IllegalArgumentException e) { return s; }
    }
}
