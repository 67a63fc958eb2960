package org.httpstub.config;

/**
 * Settings for one stub instance.
 *
 * @param host              host name placed in the bound URI and resolved for binding
 * @param minPort           lowest candidate port (inclusive)
 * @param maxPort           highest candidate port (inclusive)
 * @param maxBindAttempts   bind attempts before giving up
 * @param readTimeoutMs     socket read timeout for an accepted connection (0 = none)
 * @param shutdownTimeoutMs how long teardown waits for the worker to exit
 */
public record StubConfig(String host,
                         int minPort,
                         int maxPort,
                         int maxBindAttempts,
                         int readTimeoutMs,
                         long shutdownTimeoutMs) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int EPHEMERAL_MIN_PORT = 49152;
    public static final int EPHEMERAL_MAX_PORT = 65534;
    public static final int DEFAULT_BIND_ATTEMPTS = 5;
    public static final int DEFAULT_READ_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 2_000L;

    static final String PREFIX = "httpstub.";

    public StubConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (minPort < 1 || maxPort > 65535 || minPort > maxPort) {
            throw new IllegalArgumentException("invalid port range [" + minPort + ", " + maxPort + "]");
        }
        if (maxBindAttempts < 1) {
            throw new IllegalArgumentException("maxBindAttempts must be positive, was " + maxBindAttempts);
        }
        if (readTimeoutMs < 0 || shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException("timeouts must not be negative");
        }
    }

    public static StubConfig defaults() {
        return new StubConfig(DEFAULT_HOST, EPHEMERAL_MIN_PORT, EPHEMERAL_MAX_PORT,
                DEFAULT_BIND_ATTEMPTS, DEFAULT_READ_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Defaults overlaid with {@code httpstub.*} system properties
     * ({@code host}, {@code minPort}, {@code maxPort}, {@code bindAttempts},
     * {@code readTimeoutMs}, {@code shutdownTimeoutMs}). Unparseable numbers keep the default.
     */
    public static StubConfig fromSystemProperties() {
        String host = System.getProperty(PREFIX + "host", DEFAULT_HOST);
        return new StubConfig(
                host.isBlank() ? DEFAULT_HOST : host.trim(),
                intProperty("minPort", EPHEMERAL_MIN_PORT),
                intProperty("maxPort", EPHEMERAL_MAX_PORT),
                intProperty("bindAttempts", DEFAULT_BIND_ATTEMPTS),
                intProperty("readTimeoutMs", DEFAULT_READ_TIMEOUT_MS),
                longProperty("shutdownTimeoutMs", DEFAULT_SHUTDOWN_TIMEOUT_MS));
    }

    public StubConfig withPortRange(int min, int max) {
        return new StubConfig(host, min, max, maxBindAttempts, readTimeoutMs, shutdownTimeoutMs);
    }

    public StubConfig withMaxBindAttempts(int attempts) {
        return new StubConfig(host, minPort, maxPort, attempts, readTimeoutMs, shutdownTimeoutMs);
    }

    public StubConfig withReadTimeoutMs(int timeoutMs) {
        return new StubConfig(host, minPort, maxPort, maxBindAttempts, timeoutMs, shutdownTimeoutMs);
    }

    private static int intProperty(String name, int def) {
        String v = System.getProperty(PREFIX + name);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            System.err.println("[HttpStub] ignoring " + PREFIX + name + "=" + v + " (not a number)");
            return def;
        }
    }

    private static long longProperty(String name, long def) {
        String v = System.getProperty(PREFIX + name);
        if (v == null) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            System.err.println("[HttpStub] ignoring " + PREFIX + name + "=" + v + " (not a number)");
            return def;
        }
    }
}
