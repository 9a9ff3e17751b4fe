package com.spirecomm.bridge.config;

import com.google.gson.JsonObject;

/**
 * Configuration for the bridge client.
 */
public class ClientConfig {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_TIMEOUT_MS = 5000;
    public static final int DEFAULT_POLL_INTERVAL_MS = 50;
    public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 10;

    /**
     * Bridge host
     */
    public String host = DEFAULT_HOST;

    /**
     * Bridge port
     */
    public int port = DEFAULT_PORT;

    /**
     * HTTP request timeout in milliseconds
     */
    public int timeoutMs = DEFAULT_TIMEOUT_MS;

    /**
     * Recommended state polling interval in milliseconds (advisory only)
     */
    public int pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;

    /**
     * Consecutive failed requests before the client reports DISCONNECTED
     */
    public int maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;

    /**
     * Log request traffic at INFO instead of DEBUG
     */
    public boolean debug = false;

    public String baseUrl() {
        String authorityHost = host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
        return "http://" + authorityHost + ":" + port;
    }

    public void applyDefaults(JsonObject raw) {
        if (raw == null || !raw.has("host") || host == null || host.isBlank()) {
            host = DEFAULT_HOST;
        }
        host = host.trim();
        if (raw == null || !raw.has("port") || port < 1 || port > 65535) {
            port = DEFAULT_PORT;
        }
        if (raw == null || !raw.has("timeoutMs") || timeoutMs <= 0) {
            timeoutMs = DEFAULT_TIMEOUT_MS;
        }
        if (raw == null || !raw.has("pollIntervalMs") || pollIntervalMs <= 0) {
            pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
        }
        if (raw == null || !raw.has("maxConsecutiveFailures") || maxConsecutiveFailures <= 0) {
            maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;
        }
        if (raw == null || !raw.has("debug")) {
            debug = false;
        }
    }
}
