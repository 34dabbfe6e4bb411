package uk.ac.ntu.loopserve.demo;

import uk.ac.ntu.loopserve.server.ServiceConfig;
import uk.ac.ntu.loopserve.server.db.DatabaseConfig;

public final class DemoConfig {
    private DemoConfig() {}

    public static int port() {
        return readIntEnv("LOOPSERVE_PORT", ServiceConfig.DEFAULT_PORT);
    }
    public static int workers() {
        return readIntEnv("LOOPSERVE_WORKERS", ServiceConfig.DEFAULT_WORKERS);
    }
    public static int queueCapacity() {
        return readIntEnv("LOOPSERVE_QUEUE_CAP", ServiceConfig.DEFAULT_QUEUE_CAP);
    }

    public static String dbUrl() {
        return System.getenv().getOrDefault("LOOPSERVE_DB_URL", "./db.sqlite");
    }
    public static String migrations() {
        return System.getenv().getOrDefault("LOOPSERVE_DB_MIGRATIONS", "migrations");
    }

    public static DatabaseConfig database() {
        return new DatabaseConfig(dbUrl(), migrations());
    }

    static int readIntEnv(String key, int fallback) {
        return parseInt(System.getenv(key), fallback);
    }

    static int parseInt(String v, int fallback) {
        if (v == null || v.isBlank()) return fallback;
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) { return fallback; }
    }
}
