package com.spirecomm.bridge.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.OptionalDouble;

/**
 * Decoded body of {@code GET /health}.
 */
public record HealthReport(
        String status,
        boolean hasState,
        boolean inGame,
        OptionalDouble lastUpdate,
        boolean readySent,
        boolean readyAcknowledged) {

    public static final String STATUS_READY = "ready";

    public boolean isReady() {
        return STATUS_READY.equals(status);
    }

    public static HealthReport decode(String body) throws BridgeProtocolException {
        JsonObject json;
        try {
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) {
                throw new BridgeProtocolException("Health response is not a JSON object");
            }
            json = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new BridgeProtocolException("Failed to parse health response: " + e.getMessage(), e);
        }

        return new HealthReport(
                getString(json, "status"),
                getBoolean(json, "has_state"),
                getBoolean(json, "in_game"),
                getDouble(json, "last_update"),
                getBoolean(json, "ready_sent"),
                getBoolean(json, "ready_acknowledged"));
    }

    private static String getString(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return "";
        }
        return element.getAsString();
    }

    private static boolean getBoolean(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        return element != null
                && element.isJsonPrimitive()
                && element.getAsJsonPrimitive().isBoolean()
                && element.getAsBoolean();
    }

    private static OptionalDouble getDouble(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(element.getAsDouble());
    }
}
