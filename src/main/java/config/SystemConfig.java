package config;

import java.util.List;

/**
 * Centralized system configuration.
 * Modify values here to change deployment parameters.
 */
public final class SystemConfig {
    private SystemConfig() {}

    // Identity provider
    public static final String GOOGLE_CERTS_URL = "https://www.googleapis.com/oauth2/v3/certs";
    public static final List<String> ACCEPTED_ISSUERS = List.of("accounts.google.com", "https://accounts.google.com");

    // Networking (ms)
    public static final int CONNECTION_TIMEOUT_MS = 5000;
    public static final int REQUEST_TIMEOUT_MS = 10000;

    // Redis key set cache
    public static final String REDIS_HOST = "localhost";
    public static final int REDIS_PORT = 6379;
    public static final int REDIS_DATABASE = 0;
    public static final int REDIS_TIMEOUT_MS = 2000;
    public static final String KEY_SET_PREFIX = "key_set:";
    public static final String KEY_SET_NAME = "google";
    public static final long KEY_SET_CACHE_TTL_SECONDS = 3600;
    public static final long KEY_SET_MIN_REFRESH_INTERVAL_MS = 30_000;
}
