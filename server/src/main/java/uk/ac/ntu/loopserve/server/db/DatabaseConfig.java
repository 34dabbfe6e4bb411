package uk.ac.ntu.loopserve.server.db;

import java.util.Objects;

public record DatabaseConfig(String url, String migrations) {
    public static final String MEMORY = ":memory:";

    public DatabaseConfig {
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) throw new IllegalArgumentException("database url is blank");
    }

    public static DatabaseConfig of(String url) {
        return new DatabaseConfig(url, null);
    }

    public boolean inMemory() {
        return MEMORY.equals(url);
    }

    String jdbcUrl() {
        return "jdbc:sqlite:" + url;
    }
}
