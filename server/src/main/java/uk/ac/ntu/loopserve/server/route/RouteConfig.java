package uk.ac.ntu.loopserve.server.route;

import uk.ac.ntu.loopserve.common.http.HttpMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class RouteConfig {
    private final Map<HttpMethod, RouteHandler> handlers;

    private RouteConfig(Map<HttpMethod, RouteHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RouteHandler> handler(HttpMethod method) {
        return Optional.ofNullable(handlers.get(method));
    }

    public Set<HttpMethod> methods() {
        return handlers.keySet();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    RouteConfig merge(RouteConfig later) {
        Map<HttpMethod, RouteHandler> merged = new EnumMap<>(HttpMethod.class);
        merged.putAll(handlers);
        merged.putAll(later.handlers);
        return new RouteConfig(merged);
    }

    public static final class Builder {
        private final Map<HttpMethod, RouteHandler> handlers = new EnumMap<>(HttpMethod.class);

        private Builder() {}

        public Builder on(HttpMethod method, RouteHandler handler) {
            handlers.put(Objects.requireNonNull(method, "method"), Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder get(RouteHandler handler) { return on(HttpMethod.GET, handler); }
        public Builder post(RouteHandler handler) { return on(HttpMethod.POST, handler); }
        public Builder put(RouteHandler handler) { return on(HttpMethod.PUT, handler); }
        public Builder patch(RouteHandler handler) { return on(HttpMethod.PATCH, handler); }
        public Builder delete(RouteHandler handler) { return on(HttpMethod.DELETE, handler); }

        public RouteConfig build() {
            return new RouteConfig(handlers);
        }
    }
}
