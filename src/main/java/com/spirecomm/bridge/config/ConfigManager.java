package com.spirecomm.bridge.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.spirecomm.bridge.SpireComm;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Loads and saves {@link ClientConfig} as JSON.
 */
public class ConfigManager {
    public static final String DEFAULT_FILE_NAME = "spirecomm-client.json";
    public static final String ENV_HOST = "SPIRECOMM_BRIDGE_HOST";
    public static final String ENV_PORT = "SPIRECOMM_BRIDGE_PORT";
    public static final String ENV_DEBUG = "SPIRECOMM_BRIDGE_DEBUG";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final Path configPath;

    private ClientConfig config;

    public ConfigManager() {
        this(Path.of(DEFAULT_FILE_NAME));
    }

    public ConfigManager(Path configPath) {
        this.configPath = configPath;
    }

    public synchronized ClientConfig load() {
        if (Files.exists(configPath)) {
            config = readFromDisk();
        } else {
            config = new ClientConfig();
            writeToDisk(config);
        }
        return config;
    }

    public synchronized ClientConfig getConfig() {
        return config == null ? load() : config;
    }

    public synchronized void save() {
        writeToDisk(getConfig());
    }

    public synchronized void setHost(String host) {
        getConfig().host = host;
        save();
    }

    public synchronized void setPort(int port) {
        getConfig().port = port;
        save();
    }

    public synchronized void setDebug(boolean debug) {
        getConfig().debug = debug;
        save();
    }

    /**
     * Overrides host, port and debug from the environment variables the bridge itself reads.
     * Overrides are not persisted.
     */
    public synchronized ClientConfig applyEnvironment(Map<String, String> env) {
        ClientConfig current = getConfig();

        String host = env.get(ENV_HOST);
        if (host != null && !host.isBlank()) {
            current.host = host.trim();
        }

        String port = env.get(ENV_PORT);
        if (port != null && !port.isBlank()) {
            try {
                int parsed = Integer.parseInt(port.trim());
                if (parsed >= 1 && parsed <= 65535) {
                    current.port = parsed;
                } else {
                    SpireComm.LOGGER.warn("Ignoring {}={}: out of range", ENV_PORT, port);
                }
            } catch (NumberFormatException e) {
                SpireComm.LOGGER.warn("Ignoring {}={}: not a number", ENV_PORT, port);
            }
        }

        String debug = env.get(ENV_DEBUG);
        if (debug != null) {
            String normalized = debug.trim().toLowerCase(Locale.ROOT);
            current.debug = normalized.equals("1") || normalized.equals("true") || normalized.equals("yes");
        }
        return current;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ClientConfig readFromDisk() {
        try (Reader reader = Files.newBufferedReader(configPath)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                SpireComm.LOGGER.warn("Config at {} is not a JSON object, using defaults", configPath);
                return new ClientConfig();
            }
            JsonObject raw = parsed.getAsJsonObject();
            ClientConfig loaded = gson.fromJson(raw, ClientConfig.class);
            loaded.applyDefaults(raw);
            return loaded;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            SpireComm.LOGGER.warn("Failed to read config from {}, using defaults: {}", configPath, e.getMessage());
            return new ClientConfig();
        }
    }

    private void writeToDisk(ClientConfig value) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(configPath)) {
                gson.toJson(value, writer);
            }
        } catch (IOException e) {
            SpireComm.LOGGER.warn("Failed to write config to {}: {}", configPath, e.getMessage());
        }
    }
}
