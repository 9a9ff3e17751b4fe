package com.spirecomm.bridge;

import com.spirecomm.bridge.client.SpireCommClient;
import com.spirecomm.bridge.config.ClientConfig;
import com.spirecomm.bridge.config.ConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class SpireComm {
    public static final String CLIENT_ID = "spirecomm";
    public static final Logger LOGGER = LoggerFactory.getLogger(CLIENT_ID);

    private SpireComm() {
    }

    /**
     * Loads configuration from the given file, applies SPIRECOMM_BRIDGE_* environment
     * overrides and builds a client from it.
     */
    public static SpireCommClient createClient(Path configPath) {
        ConfigManager configManager = new ConfigManager(configPath);
        configManager.load();
        ClientConfig config = configManager.applyEnvironment(System.getenv());
        LOGGER.info("Using bridge at {}:{}", config.host, config.port);
        return new SpireCommClient(config);
    }

    public static String getVersion() {
        String version = SpireComm.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    public static String getUserAgent() {
        return CLIENT_ID + "-client/" + getVersion();
    }
}
