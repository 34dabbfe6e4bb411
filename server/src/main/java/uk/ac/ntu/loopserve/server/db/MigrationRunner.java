package uk.ac.ntu.loopserve.server.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

public final class MigrationRunner {
    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final Path dir;

    public MigrationRunner(Path dir) {
        this.dir = dir;
    }

    public List<Migration> migrate(Connection c) throws MigrationException {
        List<Migration> all = load();
        List<Migration> applied = new ArrayList<>();
        try {
            ensureTable(c);
            Set<Integer> done = appliedIds(c);
            for (Migration m : all) {
                if (done.contains(m.id())) continue;
                apply(c, m);
                applied.add(m);
                log.info("Applied migration {}.{}", m.id(), m.name());
            }
        } catch (SQLException e) {
            throw new MigrationException("Migration failed in " + dir + ": " + e.getMessage(), e);
        }
        return applied;
    }

    List<Migration> load() throws MigrationException {
        if (!Files.isDirectory(dir)) {
            throw new MigrationException("Migrations directory not found: " + dir.toAbsolutePath());
        }
        List<Migration> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files.sorted()::iterator) {
                String fileName = p.getFileName().toString();
                if (!Files.isRegularFile(p) || !Migration.isScript(fileName)) continue;
                out.add(Migration.parse(fileName, Files.readString(p, StandardCharsets.UTF_8)));
            }
        } catch (IOException e) {
            throw new MigrationException("Cannot read migrations from " + dir + ": " + e.getMessage(), e);
        }

        out.sort(Comparator.comparingInt(Migration::id));
        for (int i = 1; i < out.size(); i++) {
            if (out.get(i).id() == out.get(i - 1).id()) {
                throw new MigrationException("Duplicate migration id " + out.get(i).id() + " in " + dir);
            }
        }
        return out;
    }

    private static void ensureTable(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.executeUpdate("""
                CREATE TABLE IF NOT EXISTS migrations (
                  id   INTEGER PRIMARY KEY,
                  name TEXT NOT NULL,
                  up   TEXT NOT NULL,
                  down TEXT NOT NULL
                )
            """);
        }
    }

    private static Set<Integer> appliedIds(Connection c) throws SQLException {
        Set<Integer> ids = new HashSet<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT id FROM migrations");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) ids.add(rs.getInt(1));
        }
        return ids;
    }

    private static void apply(Connection c, Migration m) throws SQLException {
        boolean auto = c.getAutoCommit();
        c.setAutoCommit(false);
        try {
            if (!m.up().isEmpty()) {
                try (Statement s = c.createStatement()) {
                    s.executeUpdate(m.up());
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO migrations(id,name,up,down) VALUES(?,?,?,?)")) {
                ps.setInt(1, m.id());
                ps.setString(2, m.name());
                ps.setString(3, m.up());
                ps.setString(4, m.down());
                ps.executeUpdate();
            }
            c.commit();
        } catch (SQLException e) {
            c.rollback();
            throw new SQLException("migration " + m.id() + "." + m.name() + ": " + e.getMessage(), e);
        } finally {
            c.setAutoCommit(auto);
        }
    }
}
