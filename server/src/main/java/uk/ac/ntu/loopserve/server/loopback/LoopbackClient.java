package uk.ac.ntu.loopserve.server.loopback;

import uk.ac.ntu.loopserve.common.http.HttpMethod;
import uk.ac.ntu.loopserve.common.json.JsonCodec;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static java.net.http.HttpRequest.BodyPublishers;
import static java.net.http.HttpResponse.BodyHandlers;

/**
 * Calls routes of the running service by path.
 * <p>
 * Responses are decoded as JSON when their content type says so and returned as text otherwise.
 * The status code is not inspected; only transport failures fail the returned future.
 */
public final class LoopbackClient {
    public static final String FALLBACK_AGENT = "Loopback";
    public static final String USER_AGENT = "User-Agent";

    private final HttpClient http;
    private final JsonCodec json;
    private final String baseUrl;
    private final String userAgent;

    private LoopbackClient(HttpClient http, JsonCodec json, String baseUrl, String userAgent) {
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.baseUrl = baseUrl;
        this.userAgent = userAgent;
    }

    /**
     * Client bound to {@code http://localhost:<port>}, identifying itself as {@link #FALLBACK_AGENT}.
     */
    public static LoopbackClient local(int port, JsonCodec json) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(3))
                .build();
        return new LoopbackClient(http, json, "http://localhost:" + port, FALLBACK_AGENT);
    }

    /**
     * Client with no base address: callers pass absolute URLs and no identity header is set.
     */
    public static LoopbackClient direct(JsonCodec json) {
        return new LoopbackClient(HttpClient.newHttpClient(), json, null, null);
    }

    /**
     * Same address and connection pool, forwarding {@code callerAgent}
     * (or {@link #FALLBACK_AGENT} when the caller sent none).
     */
    public LoopbackClient forCaller(String callerAgent) {
        String agent = callerAgent == null || callerAgent.isBlank() ? FALLBACK_AGENT : callerAgent;
        return new LoopbackClient(http, json, baseUrl, agent);
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String userAgent() {
        return userAgent;
    }

    /**
     * Raw request; {@code init} may set the method, headers and body.
     * The identity header is applied after {@code init}.
     */
    public CompletableFuture<HttpResponse<String>> fetch(String path, Consumer<HttpRequest.Builder> init) {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(resolve(path));
        if (init != null) init.accept(b);
        if (userAgent != null) b.setHeader(USER_AGENT, userAgent);
        return http.sendAsync(b.build(), BodyHandlers.ofString());
    }

    public <T> CompletableFuture<T> get(String path) {
        return call(HttpMethod.GET, path, null);
    }

    public <T> CompletableFuture<T> get(String path, Class<T> type) {
        return this.<Object>get(path).thenApply(v -> json.convert(v, type));
    }

    public <T> CompletableFuture<T> post(String path, Object body) {
        return call(HttpMethod.POST, path, body);
    }

    public <T> CompletableFuture<T> post(String path, Object body, Class<T> type) {
        return this.<Object>post(path, body).thenApply(v -> json.convert(v, type));
    }

    public <T> CompletableFuture<T> put(String path, Object body) {
        return call(HttpMethod.PUT, path, body);
    }

    public <T> CompletableFuture<T> patch(String path, Object body) {
        return call(HttpMethod.PATCH, path, body);
    }

    public <T> CompletableFuture<T> delete(String path) {
        return call(HttpMethod.DELETE, path, null);
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> call(HttpMethod method, String path, Object body) {
        HttpRequest.BodyPublisher publisher = method.hasBody()
                ? BodyPublishers.ofByteArray(json.writeBytes(body))
                : BodyPublishers.noBody();
        return fetch(path, b -> {
            b.method(method.name(), publisher);
            if (method.hasBody()) b.header("Content-Type", "application/json");
        }).thenApply(resp -> (T) decode(resp));
    }

    private Object decode(HttpResponse<String> resp) {
        String type = resp.headers().firstValue("Content-Type").orElse("");
        if (type.contains("application/json")) return json.read(resp.body());
        return resp.body() == null ? "" : resp.body();
    }

    private URI resolve(String path) {
        Objects.requireNonNull(path, "path");
        return URI.create(baseUrl == null ? path : baseUrl + path);
    }
}
