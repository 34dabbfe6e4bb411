package uk.ac.ntu.loopserve.server;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.loopserve.server.data.KeyedDataStore;
import uk.ac.ntu.loopserve.server.db.Database;
import uk.ac.ntu.loopserve.server.http.WorkerPool;
import uk.ac.ntu.loopserve.server.loopback.LoopbackClient;

import java.sql.SQLException;
import java.util.Optional;

/**
 * A listening service. Closing it stops the server, the workers and the database;
 * the data store is left as it is.
 */
public final class RunningService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunningService.class);

    private final HttpServer server;
    private final WorkerPool workers;
    private final KeyedDataStore store;
    private final LoopbackClient loopback;
    private final Database db;
    private final int port;

    RunningService(HttpServer server, WorkerPool workers, KeyedDataStore store, LoopbackClient loopback, Database db) {
        this.server = server;
        this.workers = workers;
        this.store = store;
        this.loopback = loopback;
        this.db = db;
        this.port = server.getAddress().getPort();
    }

    public int port() {
        return port;
    }

    public String baseUrl() {
        return "http://localhost:" + port();
    }

    public int queuedRequests() {
        return workers.queued();
    }

    public long shedRequests() {
        return workers.shed();
    }

    public KeyedDataStore store() {
        return store;
    }

    public LoopbackClient loopback() {
        return loopback;
    }

    public Optional<Database> db() {
        return Optional.ofNullable(db);
    }

    @Override
    public void close() {
        server.stop(0);
        workers.close();
        if (db != null) {
            try {
                db.close();
            } catch (SQLException e) {
                log.warn("Closing database failed: {}", e.getMessage());
            }
        }
        log.info("Server stopped on port {}", port);
    }
}
