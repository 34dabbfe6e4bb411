package uk.ac.ntu.loopserve.server.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The one SQLite connection shared by every request.
 * No pooling or transaction boundaries are added here; concurrent callers are
 * serialized by the driver.
 */
public final class Database implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    static {
        // Registers the driver in shaded jars where service loading is lost
        try {
            Class.forName("org.sqlite.JDBC");
        } catch (ClassNotFoundException e) {
            log.warn("SQLite JDBC driver not on the classpath: {}", e.getMessage());
        }
    }

    private final DatabaseConfig config;
    private final Connection connection;

    private Database(DatabaseConfig config, Connection connection) {
        this.config = config;
        this.connection = connection;
    }

    /**
     * Opens (creating if needed) the store and applies pending migrations.
     * The connection is closed again if a migration fails.
     */
    public static Database open(DatabaseConfig config) throws SQLException, MigrationException {
        Connection c = DriverManager.getConnection(config.jdbcUrl());
        try {
            if (config.migrations() != null) {
                List<Migration> applied = new MigrationRunner(Path.of(config.migrations())).migrate(c);
                log.info("Migrations up to date at {} ({} applied)", config.migrations(), applied.size());
            }
        } catch (MigrationException e) {
            closeQuietly(c, e);
            throw e;
        }
        log.info("SQLite ready at {}", config.url());
        return new Database(config, c);
    }

    public static Database open(String url, String migrations) throws SQLException, MigrationException {
        return open(new DatabaseConfig(url, migrations));
    }

    public DatabaseConfig config() {
        return config;
    }

    public Connection connection() {
        return connection;
    }

    public List<Map<String, Object>> all(String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(sql, params);
             ResultSet rs = ps.executeQuery()) {
            return rows(rs);
        }
    }

    public Map<String, Object> get(String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(sql, params);
             ResultSet rs = ps.executeQuery()) {
            ResultSetMetaData md = rs.getMetaData();
            return rs.next() ? row(rs, md) : null;
        }
    }

    public synchronized RunResult run(String sql, Object... params) throws SQLException {
        int changes;
        try (PreparedStatement ps = prepare(sql, params)) {
            changes = ps.executeUpdate();
        }
        long lastId;
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery("SELECT last_insert_rowid()")) {
            lastId = rs.next() ? rs.getLong(1) : 0L;
        }
        return new RunResult(changes, lastId);
    }

    public void exec(String script) throws SQLException {
        try (Statement s = connection.createStatement()) {
            s.executeUpdate(script);
        }
    }

    /**
     * Logs {@code SELECT * FROM name} as a table, optionally paged.
     * Null or non-positive {@code limit}/{@code offset} are left out.
     */
    public void dumpTable(String name, Integer limit, Integer offset) throws SQLException {
        List<Map<String, Object>> rows = all(dumpSql(name, limit, offset));
        log.info("{} ({} rows)\n{}", name, rows.size(), TableRenderer.render(rows));
    }

    public void dumpTable(String name) throws SQLException {
        dumpTable(name, null, null);
    }

    /**
     * SQLite only accepts OFFSET after LIMIT, so an offset alone is paired with {@code LIMIT -1}.
     */
    static String dumpSql(String name, Integer limit, Integer offset) {
        if (name == null || !TABLE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a table name: " + name);
        }
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(name);
        boolean paged = offset != null && offset > 0;
        if (limit != null && limit > 0) sql.append(" LIMIT ").append(limit);
        else if (paged) sql.append(" LIMIT -1");
        if (paged) sql.append(" OFFSET ").append(offset);
        return sql.toString();
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) ps.setObject(i + 1, params[i]);
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
        return ps;
    }

    private static List<Map<String, Object>> rows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) out.add(row(rs, md));
        return out;
    }

    private static Map<String, Object> row(ResultSet rs, ResultSetMetaData md) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) row.put(md.getColumnLabel(i), rs.getObject(i));
        return row;
    }

    private static void closeQuietly(Connection c, Exception cause) {
        try {
            c.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
