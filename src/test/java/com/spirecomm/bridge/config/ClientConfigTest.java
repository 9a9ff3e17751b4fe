package com.spirecomm.bridge.config;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClientConfig default values and repair.
 */
class ClientConfigTest {

    @Test
    void testDefaultValues() {
        ClientConfig config = new ClientConfig();

        assertEquals("127.0.0.1", config.host);
        assertEquals(8080, config.port);
        assertEquals(5000, config.timeoutMs);
        assertEquals(50, config.pollIntervalMs);
        assertEquals(10, config.maxConsecutiveFailures);
        assertFalse(config.debug);
        assertEquals("http://127.0.0.1:8080", config.baseUrl());
    }

    @Test
    void testApplyDefaultsRepairsInvalidValues() {
        ClientConfig config = new ClientConfig();
        config.host = "  ";
        config.port = 70000;
        config.timeoutMs = 0;
        config.pollIntervalMs = -5;
        config.maxConsecutiveFailures = 0;
        JsonObject raw = JsonParser.parseString(
                "{\"host\": \"  \", \"port\": 70000, \"timeoutMs\": 0, \"pollIntervalMs\": -5,"
                        + " \"maxConsecutiveFailures\": 0}").getAsJsonObject();

        config.applyDefaults(raw);

        assertEquals(ClientConfig.DEFAULT_HOST, config.host);
        assertEquals(ClientConfig.DEFAULT_PORT, config.port);
        assertEquals(ClientConfig.DEFAULT_TIMEOUT_MS, config.timeoutMs);
        assertEquals(ClientConfig.DEFAULT_POLL_INTERVAL_MS, config.pollIntervalMs);
        assertEquals(ClientConfig.DEFAULT_MAX_CONSECUTIVE_FAILURES, config.maxConsecutiveFailures);
    }

    @Test
    void testApplyDefaultsKeepsValidValues() {
        ClientConfig config = new ClientConfig();
        config.host = " bridge.local ";
        config.port = 9090;
        config.debug = true;
        JsonObject raw = JsonParser.parseString("{\"host\": \" bridge.local \", \"port\": 9090, \"debug\": true}")
                .getAsJsonObject();

        config.applyDefaults(raw);

        assertEquals("bridge.local", config.host);
        assertEquals(9090, config.port);
        assertTrue(config.debug);
    }

    @Test
    void testApplyDefaultsWithoutRawResetsEverything() {
        ClientConfig config = new ClientConfig();
        config.port = 9090;
        config.debug = true;

        config.applyDefaults(null);

        assertEquals(8080, config.port);
        assertFalse(config.debug);
    }

    @Test
    void testBaseUrlBracketsIpv6Literals() {
        ClientConfig config = new ClientConfig();

        // Bare IPv6 literal
        config.host = "::1";
        assertEquals("http://[::1]:8080", config.baseUrl());

        // Already bracketed
        config.host = "[fe80::1]";
        assertEquals("http://[fe80::1]:8080", config.baseUrl());

        // Hostnames are left alone
        config.host = "bridge.local";
        assertEquals("http://bridge.local:8080", config.baseUrl());
    }
}
