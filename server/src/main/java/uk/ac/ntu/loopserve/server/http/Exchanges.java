package uk.ac.ntu.loopserve.server.http;

import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public final class Exchanges {
    public static final String TEXT = "text/plain; charset=utf-8";
    public static final String JSON = "application/json; charset=utf-8";

    private Exchanges() {}

    public static void reply(HttpExchange ex, int code, String body) throws IOException {
        if (body == null) body = "";
        send(ex, code, TEXT, body.getBytes(StandardCharsets.UTF_8));
    }

    public static void send(HttpExchange ex, int code, String contentType, byte[] data) throws IOException {
        if (code < 100 || code > 599) throw new IllegalArgumentException("HTTP status out of range: " + code);
        if (contentType != null) ex.getResponseHeaders().set("Content-Type", contentType);
        ex.sendResponseHeaders(code, data.length == 0 ? -1 : data.length);
        try (OutputStream os = ex.getResponseBody()) {
            if (data.length > 0) os.write(data);
        }
    }

    public static String remote(HttpExchange ex) {
        try { return ex.getRemoteAddress().getAddress().getHostAddress(); }
        catch (Exception e) { return "unknown"; }
    }

    public static String path(HttpExchange ex) {
        return normalize(ex.getRequestURI().getPath());
    }

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) return "/";
        if (path.length() > 1 && path.endsWith("/")) return path.substring(0, path.length() - 1);
        return path;
    }
}
