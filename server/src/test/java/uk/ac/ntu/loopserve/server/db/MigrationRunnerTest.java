package uk.ac.ntu.loopserve.server.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationRunnerTest {

    @TempDir
    Path dir;

    @Test
    void appliesInNumericOrderExactlyOnce() throws Exception {
        Files.writeString(dir.resolve("10.seed.sql"), "-- Up\nINSERT INTO t(v) VALUES ('ten');\n-- Down\nDELETE FROM t;\n");
        Files.writeString(dir.resolve("2.create.sql"), "-- Up\nCREATE TABLE t (v TEXT);\n-- Down\nDROP TABLE t;\n");
        Files.writeString(dir.resolve("README.md"), "not a migration");
        MigrationRunner runner = new MigrationRunner(dir);

        try (Connection c = DriverManager.getConnection("jdbc:sqlite::memory:")) {
            List<Migration> first = runner.migrate(c);
            List<Migration> second = runner.migrate(c);

            assertThat(first).extracting(Migration::id).containsExactly(2, 10);
            assertThat(second).isEmpty();
            assertThat(count(c, "SELECT COUNT(*) FROM t")).isEqualTo(1);
            assertThat(count(c, "SELECT COUNT(*) FROM migrations")).isEqualTo(2);
        }
    }

    @Test
    void onlyNewScriptsRunOnLaterStarts() throws Exception {
        Files.writeString(dir.resolve("1.create.sql"), "CREATE TABLE t (v TEXT);");
        try (Connection c = DriverManager.getConnection("jdbc:sqlite::memory:")) {
            new MigrationRunner(dir).migrate(c);
            Files.writeString(dir.resolve("2.seed.sql"), "INSERT INTO t(v) VALUES ('a'); INSERT INTO t(v) VALUES ('b');");

            List<Migration> applied = new MigrationRunner(dir).migrate(c);

            assertThat(applied).extracting(Migration::name).containsExactly("seed");
            assertThat(count(c, "SELECT COUNT(*) FROM t")).isEqualTo(2);
        }
    }

    @Test
    void failingScriptRollsBackAndReportsIt() throws Exception {
        Files.writeString(dir.resolve("1.create.sql"), "CREATE TABLE t (v TEXT);");
        Files.writeString(dir.resolve("2.broken.sql"), "INSERT INTO t(v) VALUES ('x'); INSERT INTO nowhere VALUES (1);");

        try (Connection c = DriverManager.getConnection("jdbc:sqlite::memory:")) {
            assertThatThrownBy(() -> new MigrationRunner(dir).migrate(c))
                    .isInstanceOf(MigrationException.class)
                    .hasMessageContaining("2.broken");

            assertThat(count(c, "SELECT COUNT(*) FROM t")).isZero();
            assertThat(count(c, "SELECT COUNT(*) FROM migrations")).isEqualTo(1);
        }
    }

    @Test
    void missingDirectoryIsAnError() {
        MigrationRunner runner = new MigrationRunner(dir.resolve("absent"));

        assertThatThrownBy(runner::load)
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void duplicateIdsAreAnError() throws Exception {
        Files.writeString(dir.resolve("1.a.sql"), "SELECT 1;");
        Files.writeString(dir.resolve("01.b.sql"), "SELECT 1;");

        assertThatThrownBy(() -> new MigrationRunner(dir).load())
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("Duplicate migration id 1");
    }

    private static long count(Connection c, String sql) throws Exception {
        try (Statement s = c.createStatement(); ResultSet rs = s.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
