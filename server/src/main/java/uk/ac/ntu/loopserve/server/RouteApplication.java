package uk.ac.ntu.loopserve.server;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.loopserve.common.Version;
import uk.ac.ntu.loopserve.common.http.HttpMethod;
import uk.ac.ntu.loopserve.common.json.JsonCodec;
import uk.ac.ntu.loopserve.common.json.JsonException;
import uk.ac.ntu.loopserve.server.db.Database;
import uk.ac.ntu.loopserve.server.db.MigrationException;
import uk.ac.ntu.loopserve.server.http.AccessLogFilter;
import uk.ac.ntu.loopserve.server.http.Exchanges;
import uk.ac.ntu.loopserve.server.http.WorkerPool;
import uk.ac.ntu.loopserve.server.loopback.LoopbackClient;
import uk.ac.ntu.loopserve.server.route.Reply;
import uk.ac.ntu.loopserve.server.route.RequestAugmentor;
import uk.ac.ntu.loopserve.server.route.RouteConfig;
import uk.ac.ntu.loopserve.server.route.RouteHandler;
import uk.ac.ntu.loopserve.server.route.RouteRequest;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Starts an HTTP service from a {@link ServiceConfig}.
 * <p>
 * Startup order: database and migrations, bind, register one context per declared path,
 * start. Any failure before the server starts is a {@link StartupException} and nothing
 * is left listening. Handler failures are answered with 500 and never reach the server.
 */
public final class RouteApplication {
    private static final Logger log = LoggerFactory.getLogger(RouteApplication.class);

    private RouteApplication() {}

    public static RunningService apply(ServiceConfig cfg) {
        Database db = cfg.db() == null ? null : openDatabase(cfg);

        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(cfg.port()), 0);
        } catch (IOException e) {
            closeQuietly(db);
            throw new StartupException("Cannot listen on port " + cfg.port() + ": " + e.getMessage(), e);
        }

        int port = server.getAddress().getPort();
        LoopbackClient loopback = LoopbackClient.local(port, cfg.json());
        RequestAugmentor augmentor = new RequestAugmentor(cfg.store(), loopback, db, cfg.json());

        List<Filter> filters = new ArrayList<>();
        filters.add(new AccessLogFilter());
        filters.addAll(cfg.middleware());

        Map<String, RouteConfig> routes = cfg.routes().routes();
        for (var e : routes.entrySet()) {
            HttpContext ctx = server.createContext(e.getKey(), new BoundRoute(e.getKey(), e.getValue(), augmentor, cfg.json()));
            ctx.getFilters().addAll(filters);
            log.debug("Registered {} {}", e.getValue().methods(), e.getKey());
        }
        if (!routes.containsKey("/")) {
            server.createContext("/", RouteApplication::notFound).getFilters().addAll(filters);
        }

        WorkerPool workers = new WorkerPool(cfg.workers(), cfg.queueCapacity());
        server.setExecutor(workers);
        server.start();

        log.info("{} {} serving {} paths", Version.NAME, Version.VERSION, routes.size());
        log.info("Server started! http://localhost:{}", port);
        return new RunningService(server, workers, cfg.store(), loopback, db);
    }

    private static Database openDatabase(ServiceConfig cfg) {
        try {
            return Database.open(cfg.db());
        } catch (SQLException | MigrationException e) {
            throw new StartupException("Database startup failed for " + cfg.db().url() + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Database db) {
        if (db == null) return;
        try {
            db.close();
        } catch (SQLException e) {
            log.warn("Closing database after failed startup: {}", e.getMessage());
        }
    }

    static void notFound(HttpExchange ex) throws IOException {
        try {
            ex.getRequestBody().readAllBytes();
            Exchanges.reply(ex, 404, "Cannot " + ex.getRequestMethod() + " " + ex.getRequestURI().getPath());
        } finally {
            ex.close();
        }
    }

    /**
     * Runs a handler and settles whatever it returns into a {@link Reply}.
     * The returned future never fails.
     */
    static CompletableFuture<Reply> invoke(RouteHandler handler, RouteRequest request) {
        Object out;
        try {
            out = handler.handle(request);
        } catch (Throwable t) {
            return CompletableFuture.completedFuture(Reply.failure(t));
        }
        return settle(out);
    }

    private static CompletableFuture<Reply> settle(Object out) {
        if (out instanceof CompletionStage<?> stage) {
            return stage.toCompletableFuture()
                    .handle((v, err) -> err != null
                            ? CompletableFuture.completedFuture(Reply.failure(err))
                            : settle(v))
                    .thenCompose(f -> f);
        }
        return CompletableFuture.completedFuture(Reply.of(out));
    }

    /**
     * The context handler for one declared path.
     */
    private static final class BoundRoute implements HttpHandler {
        private final String path;
        private final RouteConfig config;
        private final RequestAugmentor augmentor;
        private final JsonCodec json;

        BoundRoute(String path, RouteConfig config, RequestAugmentor augmentor, JsonCodec json) {
            this.path = path;
            this.config = config;
            this.augmentor = augmentor;
            this.json = json;
        }

        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (WorkerPool.shedding()) {
                tooBusy(ex);
                return;
            }
            Optional<HttpMethod> method = HttpMethod.parse(ex.getRequestMethod());
            Optional<RouteHandler> handler = path.equals(Exchanges.path(ex))
                    ? method.flatMap(config::handler)
                    : Optional.empty();
            if (handler.isEmpty()) {
                notFound(ex);
                return;
            }

            RouteRequest request;
            try {
                request = augmentor.augment(ex, method.get());
            } catch (JsonException | IOException e) {
                log.debug("Rejected body for {} {}: {}", ex.getRequestMethod(), path, e.getMessage());
                try {
                    Exchanges.reply(ex, 400, "Bad Request: " + e.getMessage());
                } finally {
                    ex.close();
                }
                return;
            }

            invoke(handler.get(), request)
                    .thenAccept(reply -> respond(ex, method.get(), reply))
                    .exceptionally(err -> {
                        log.error("Could not answer {} {}", method.get(), path, err);
                        ex.close();
                        return null;
                    });
        }

        private void respond(HttpExchange ex, HttpMethod method, Reply reply) {
            try {
                write(ex, method, reply);
            } catch (IOException e) {
                log.warn("Response to {} {} not delivered: {}", method, path, e.getMessage());
            } catch (RuntimeException e) {
                log.error("{} {} reply could not be written", method, path, e);
                if (ex.getResponseCode() == -1) sendFailure(ex, method, e);
            } finally {
                ex.close();
            }
        }

        private void write(HttpExchange ex, HttpMethod method, Reply reply) throws IOException {
            switch (reply.kind()) {
                case EMPTY:
                    Exchanges.send(ex, reply.status(), null, new byte[0]);
                    break;
                case TEXT:
                    Exchanges.reply(ex, reply.status(), (String) reply.value());
                    break;
                case STRUCTURED:
                    Exchanges.send(ex, reply.status(), Exchanges.JSON, json.writeBytes(reply.value()));
                    break;
                case FAILURE:
                    log.error("{} {} failed", method, path, reply.cause());
                    Exchanges.reply(ex, reply.status(), reply.describe());
                    break;
            }
        }

        private void sendFailure(HttpExchange ex, HttpMethod method, RuntimeException e) {
            Reply failed = Reply.failure(e);
            try {
                Exchanges.reply(ex, failed.status(), failed.describe());
            } catch (IOException io) {
                log.warn("Failure reply to {} {} not delivered: {}", method, path, io.getMessage());
            }
        }

        private void tooBusy(HttpExchange ex) throws IOException {
            try {
                ex.getRequestBody().readAllBytes();
                Exchanges.reply(ex, 503, "Too busy, try again later");
            } finally {
                ex.close();
            }
        }
    }
}
