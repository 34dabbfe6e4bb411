package uk.ac.ntu.loopserve.server.route;

import uk.ac.ntu.loopserve.common.http.HttpMethod;
import uk.ac.ntu.loopserve.server.http.Exchanges;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declared routes: path to {@link RouteConfig}.
 * Declaring a path twice merges the two configs; for the same method the later declaration wins.
 */
public final class RouteMap {
    private final Map<String, RouteConfig> routes;

    private RouteMap(Map<String, RouteConfig> routes) {
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RouteMap of(Map<String, RouteConfig> routes) {
        Builder b = builder();
        routes.forEach(b::path);
        return b.build();
    }

    public Map<String, RouteConfig> routes() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    public static final class Builder {
        private final Map<String, RouteConfig> routes = new LinkedHashMap<>();

        private Builder() {}

        public Builder path(String path, RouteConfig config) {
            Objects.requireNonNull(config, "config");
            routes.merge(checkPath(path), config, RouteConfig::merge);
            return this;
        }

        public Builder route(String path, HttpMethod method, RouteHandler handler) {
            return path(path, RouteConfig.builder().on(method, handler).build());
        }

        public Builder get(String path, RouteHandler handler) { return route(path, HttpMethod.GET, handler); }
        public Builder post(String path, RouteHandler handler) { return route(path, HttpMethod.POST, handler); }
        public Builder put(String path, RouteHandler handler) { return route(path, HttpMethod.PUT, handler); }
        public Builder patch(String path, RouteHandler handler) { return route(path, HttpMethod.PATCH, handler); }
        public Builder delete(String path, RouteHandler handler) { return route(path, HttpMethod.DELETE, handler); }

        public RouteMap build() {
            return new RouteMap(routes);
        }

        private static String checkPath(String path) {
            Objects.requireNonNull(path, "path");
            if (!path.startsWith("/")) throw new IllegalArgumentException("Route path must start with '/': " + path);
            return Exchanges.normalize(path);
        }
    }
}
