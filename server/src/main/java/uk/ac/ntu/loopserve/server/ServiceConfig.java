package uk.ac.ntu.loopserve.server;

import com.sun.net.httpserver.Filter;
import uk.ac.ntu.loopserve.common.json.JsonCodec;
import uk.ac.ntu.loopserve.server.data.KeyedDataStore;
import uk.ac.ntu.loopserve.server.db.DatabaseConfig;
import uk.ac.ntu.loopserve.server.route.RouteMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything {@link RouteApplication#apply(ServiceConfig)} needs. Only the routes are required.
 */
public final class ServiceConfig {
    public static final int DEFAULT_PORT = 8000;
    public static final int DEFAULT_WORKERS = 8;
    public static final int DEFAULT_QUEUE_CAP = 256;

    private final RouteMap routes;
    private final int port;
    private final DatabaseConfig db;
    private final List<Filter> middleware;
    private final KeyedDataStore store;
    private final int workers;
    private final int queueCapacity;
    private final JsonCodec json;

    private ServiceConfig(Builder b) {
        this.routes = Objects.requireNonNull(b.routes, "routes");
        this.port = b.port;
        this.db = b.db;
        this.middleware = List.copyOf(b.middleware);
        this.store = b.store != null ? b.store : new KeyedDataStore(b.data);
        this.workers = b.workers;
        this.queueCapacity = b.queueCapacity;
        this.json = b.json != null ? b.json : new JsonCodec();
    }

    public static Builder builder(RouteMap routes) {
        return new Builder().routes(routes);
    }

    public RouteMap routes() { return routes; }
    public int port() { return port; }
    public DatabaseConfig db() { return db; }
    public List<Filter> middleware() { return middleware; }
    public KeyedDataStore store() { return store; }
    public int workers() { return workers; }
    public int queueCapacity() { return queueCapacity; }
    public JsonCodec json() { return json; }

    public static final class Builder {
        private RouteMap routes;
        private int port = DEFAULT_PORT;
        private DatabaseConfig db;
        private final List<Filter> middleware = new ArrayList<>();
        private Map<?, ?> data = Map.of();
        private KeyedDataStore store;
        private int workers = DEFAULT_WORKERS;
        private int queueCapacity = DEFAULT_QUEUE_CAP;
        private JsonCodec json;

        private Builder() {}

        public Builder routes(RouteMap routes) {
            this.routes = Objects.requireNonNull(routes, "routes");
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder db(DatabaseConfig db) {
            this.db = db;
            return this;
        }

        public Builder db(String url, String migrations) {
            return db(new DatabaseConfig(url, migrations));
        }

        /**
         * Filters run after the access log and before route dispatch, in the order given.
         */
        public Builder middleware(Filter... filters) {
            for (Filter f : filters) middleware.add(Objects.requireNonNull(f, "filter"));
            return this;
        }

        /**
         * Initial store entries; ignored when {@link #store(KeyedDataStore)} is set.
         */
        public Builder data(Map<?, ?> data) {
            this.data = Objects.requireNonNull(data, "data");
            return this;
        }

        public Builder store(KeyedDataStore store) {
            this.store = store;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder json(JsonCodec json) {
            this.json = json;
            return this;
        }

        public ServiceConfig build() {
            return new ServiceConfig(this);
        }
    }
}
