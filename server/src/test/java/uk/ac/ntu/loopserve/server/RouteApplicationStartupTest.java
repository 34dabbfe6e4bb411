package uk.ac.ntu.loopserve.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.ntu.loopserve.server.db.DatabaseConfig;
import uk.ac.ntu.loopserve.server.route.RouteMap;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteApplicationStartupTest {

    private static final RouteMap ROUTES = RouteMap.builder().get("/hello", req -> "Hello").build();

    @TempDir
    Path tmp;

    @Test
    void missingMigrationsDirectoryStopsStartup() throws Exception {
        int port = freePort();
        ServiceConfig cfg = ServiceConfig.builder(ROUTES)
                .port(port)
                .db(DatabaseConfig.MEMORY, tmp.resolve("absent").toString())
                .build();

        assertThatThrownBy(() -> RouteApplication.apply(cfg))
                .isInstanceOf(StartupException.class)
                .hasMessageContaining("Database startup failed")
                .hasMessageContaining("Migrations directory not found");
        assertNothingListening(port);
    }

    @Test
    void brokenMigrationStopsStartup() throws Exception {
        Path migrations = Files.createDirectories(tmp.resolve("migrations"));
        Files.writeString(migrations.resolve("001.broken.sql"), "-- Up\nCREATE TABLE (;\n-- Down\n");
        int port = freePort();
        ServiceConfig cfg = ServiceConfig.builder(ROUTES)
                .port(port)
                .db(DatabaseConfig.MEMORY, migrations.toString())
                .build();

        assertThatThrownBy(() -> RouteApplication.apply(cfg))
                .isInstanceOf(StartupException.class)
                .hasMessageContaining("Migration failed");
        assertNothingListening(port);
    }

    @Test
    void unopenableDatabaseStopsStartup() throws Exception {
        int port = freePort();
        String url = tmp.resolve("no-such-dir").resolve("db.sqlite").toString();
        ServiceConfig cfg = ServiceConfig.builder(ROUTES).port(port).db(DatabaseConfig.of(url)).build();

        assertThatThrownBy(() -> RouteApplication.apply(cfg)).isInstanceOf(StartupException.class);
        assertNothingListening(port);
    }

    @Test
    void busyPortStopsStartup() throws Exception {
        try (ServerSocket taken = new ServerSocket(0)) {
            ServiceConfig cfg = ServiceConfig.builder(ROUTES).port(taken.getLocalPort()).build();

            assertThatThrownBy(() -> RouteApplication.apply(cfg))
                    .isInstanceOf(StartupException.class)
                    .hasMessageContaining("Cannot listen on port " + taken.getLocalPort());
        }
    }

    @Test
    void ephemeralPortIsReportedAndReleasedOnClose() throws Exception {
        int port;
        try (RunningService service = RouteApplication.apply(ServiceConfig.builder(ROUTES).port(0).build())) {
            port = service.port();
            assertThat(port).isPositive();
            assertThat(service.baseUrl()).isEqualTo("http://localhost:" + port);
            assertThat(service.db()).isEmpty();
        }
        assertNothingListening(port);
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private static void assertNothingListening(int port) {
        assertThatThrownBy(() -> new Socket("localhost", port).close()).isInstanceOf(ConnectException.class);
    }
}
