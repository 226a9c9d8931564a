package com.capturequeue.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Read-only pipeline settings.
 *
 * <p>{@link #load()} reads {@code capture-queue.properties} from the classpath
 * and overlays any system property with the same key, so a single value can be
 * changed with {@code -Dfetch.concurrency=8} without editing the file. Every
 * value is range-checked; an out-of-range value fails fast with
 * {@link IllegalArgumentException}.</p>
 *
 * <p>Tests build configs directly with {@link #builder()}.</p>
 *
 * <p><b>Thread Safety:</b> Instances are immutable.</p>
 *
 * @author Capture Queue Team
 */
public final class PipelineConfig {
    private static final Logger logger = Logger.getLogger(PipelineConfig.class.getName());

    public static final String RESOURCE_NAME = "capture-queue.properties";

    public static final String MAX_RETRIES = "queue.maxRetries";
    public static final String BASE_DELAY_MS = "queue.retry.baseDelayMs";
    public static final String MAX_DELAY_MS = "queue.retry.maxDelayMs";
    public static final String JITTER_RATIO = "queue.retry.jitterRatio";
    public static final String POLL_INTERVAL_MS = "queue.pollIntervalMs";
    public static final String FETCH_CONCURRENCY = "fetch.concurrency";
    public static final String FETCH_TIMEOUT_MS = "fetch.timeoutMs";
    public static final String FETCH_MAX_CONTENT_BYTES = "fetch.maxContentBytes";
    public static final String DB_URL = "db.url";
    public static final String DB_USER = "db.user";
    public static final String DB_PASSWORD = "db.password";
    public static final String DB_POOL_SIZE = "db.poolSize";
    public static final String STATUS_PORT = "status.port";

    private static final String[] KEYS = {
            MAX_RETRIES, BASE_DELAY_MS, MAX_DELAY_MS, JITTER_RATIO, POLL_INTERVAL_MS,
            FETCH_CONCURRENCY, FETCH_TIMEOUT_MS, FETCH_MAX_CONTENT_BYTES,
            DB_URL, DB_USER, DB_PASSWORD, DB_POOL_SIZE, STATUS_PORT
    };

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final long pollIntervalMs;
    private final int fetchConcurrency;
    private final long fetchTimeoutMs;
    private final int maxContentBytes;
    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final int dbPoolSize;
    private final int statusPort;

    private PipelineConfig(Builder b) {
        this.maxRetries = checkRange(MAX_RETRIES, b.maxRetries, 0, 20);
        this.baseDelayMs = checkRange(BASE_DELAY_MS, b.baseDelayMs, 0, Long.MAX_VALUE);
        this.maxDelayMs = checkRange(MAX_DELAY_MS, b.maxDelayMs, b.baseDelayMs, Long.MAX_VALUE);
        if (b.jitterRatio < 0.0 || b.jitterRatio > 1.0) {
            throw new IllegalArgumentException(JITTER_RATIO + " must be between 0 and 1: " + b.jitterRatio);
        }
        this.jitterRatio = b.jitterRatio;
        this.pollIntervalMs = checkRange(POLL_INTERVAL_MS, b.pollIntervalMs, 1, Long.MAX_VALUE);
        this.fetchConcurrency = checkRange(FETCH_CONCURRENCY, b.fetchConcurrency, 1, 50);
        this.fetchTimeoutMs = checkRange(FETCH_TIMEOUT_MS, b.fetchTimeoutMs, 1, Long.MAX_VALUE);
        this.maxContentBytes = checkRange(FETCH_MAX_CONTENT_BYTES, b.maxContentBytes, 1, Integer.MAX_VALUE);
        this.dbUrl = b.dbUrl;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword;
        this.dbPoolSize = checkRange(DB_POOL_SIZE, b.dbPoolSize, 1, 1000);
        this.statusPort = checkRange(STATUS_PORT, b.statusPort, 0, 65535);
    }

    /**
     * Load settings from the classpath resource, overlaid by system properties.
     *
     * @return the loaded config
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static PipelineConfig load() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warning(RESOURCE_NAME + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : KEYS) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    /**
     * Build a config from explicit properties; missing keys keep their defaults.
     */
    public static PipelineConfig fromProperties(Properties props) {
        Builder b = builder();
        b.maxRetries(intValue(props, MAX_RETRIES, b.maxRetries));
        b.baseDelayMs(longValue(props, BASE_DELAY_MS, b.baseDelayMs));
        b.maxDelayMs(longValue(props, MAX_DELAY_MS, b.maxDelayMs));
        b.jitterRatio(doubleValue(props, JITTER_RATIO, b.jitterRatio));
        b.pollIntervalMs(longValue(props, POLL_INTERVAL_MS, b.pollIntervalMs));
        b.fetchConcurrency(intValue(props, FETCH_CONCURRENCY, b.fetchConcurrency));
        b.fetchTimeoutMs(longValue(props, FETCH_TIMEOUT_MS, b.fetchTimeoutMs));
        b.maxContentBytes(intValue(props, FETCH_MAX_CONTENT_BYTES, b.maxContentBytes));
        b.dbUrl(props.getProperty(DB_URL, b.dbUrl));
        b.dbUser(props.getProperty(DB_USER, b.dbUser));
        b.dbPassword(props.getProperty(DB_PASSWORD, b.dbPassword));
        b.dbPoolSize(intValue(props, DB_POOL_SIZE, b.dbPoolSize));
        b.statusPort(intValue(props, STATUS_PORT, b.statusPort));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxRetries() { return maxRetries; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public double getJitterRatio() { return jitterRatio; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public int getFetchConcurrency() { return fetchConcurrency; }
    public long getFetchTimeoutMs() { return fetchTimeoutMs; }
    public int getMaxContentBytes() { return maxContentBytes; }
    public String getDbUrl() { return dbUrl; }
    public String getDbUser() { return dbUser; }
    public String getDbPassword() { return dbPassword; }
    public int getDbPoolSize() { return dbPoolSize; }
    public int getStatusPort() { return statusPort; }

    private static int intValue(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }

    private static long longValue(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }

    private static double doubleValue(Properties props, String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }

    private static int checkRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + value);
        }
        return value;
    }

    private static long checkRange(String key, long value, long min, long max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be at least " + min + ": " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "PipelineConfig{maxRetries=" + maxRetries
                + ", baseDelayMs=" + baseDelayMs
                + ", maxDelayMs=" + maxDelayMs
                + ", jitterRatio=" + jitterRatio
                + ", fetchConcurrency=" + fetchConcurrency
                + ", fetchTimeoutMs=" + fetchTimeoutMs
                + ", dbUrl='" + dbUrl + "'}";
    }

    /**
     * Builder holding the defaults.
     */
    public static final class Builder {
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 8000;
        private double jitterRatio = 0.25;
        private long pollIntervalMs = 60_000;
        private int fetchConcurrency = 5;
        private long fetchTimeoutMs = 30_000;
        private int maxContentBytes = 10 * 1024 * 1024;
        private String dbUrl = "jdbc:h2:./capture-queue";
        private String dbUser = "sa";
        private String dbPassword = "";
        private int dbPoolSize = 10;
        private int statusPort = 8080;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder baseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; return this; }
        public Builder maxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; return this; }
        public Builder jitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; return this; }
        public Builder pollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; return this; }
        public Builder fetchConcurrency(int fetchConcurrency) { this.fetchConcurrency = fetchConcurrency; return this; }
        public Builder fetchTimeoutMs(long fetchTimeoutMs) { this.fetchTimeoutMs = fetchTimeoutMs; return this; }
        public Builder maxContentBytes(int maxContentBytes) { this.maxContentBytes = maxContentBytes; return this; }
        public Builder dbUrl(String dbUrl) { this.dbUrl = dbUrl; return this; }
        public Builder dbUser(String dbUser) { this.dbUser = dbUser; return this; }
        public Builder dbPassword(String dbPassword) { this.dbPassword = dbPassword; return this; }
        public Builder dbPoolSize(int dbPoolSize) { this.dbPoolSize = dbPoolSize; return this; }
        public Builder statusPort(int statusPort) { this.statusPort = statusPort; return this; }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
