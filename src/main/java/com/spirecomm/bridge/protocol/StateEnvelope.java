package com.spirecomm.bridge.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.spirecomm.bridge.state.StateDocument;

/**
 * Decoded body of a 200 response from {@code GET /state}.
 *
 * <p>The bridge wraps the game state as {@code {"state": ..., "timestamp": ...}},
 * where {@code state} is CommunicationMod's raw line as a JSON string (or an
 * object). A body without a {@code state} key is taken as the payload itself and
 * carries no marker. Only the outer envelope is parsed by {@link #decode}; the
 * payload is parsed by {@link #toDocument()} so a caller holding an identical
 * marker can skip that work.
 */
public final class StateEnvelope {
    private static final String STATE_KEY = "state";
    private static final String TIMESTAMP_KEY = "timestamp";

    private final JsonPrimitive marker;
    private final JsonElement payload;

    private StateEnvelope(JsonPrimitive marker, JsonElement payload) {
        this.marker = marker;
        this.payload = payload;
    }

    public static StateEnvelope decode(String body) throws BridgeProtocolException {
        JsonObject json;
        try {
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) {
                throw new BridgeProtocolException("State response is not a JSON object");
            }
            json = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new BridgeProtocolException("Failed to parse state envelope: " + e.getMessage(), e);
        }

        if (!json.has(STATE_KEY)) {
            return new StateEnvelope(null, json);
        }

        JsonElement payload = json.get(STATE_KEY);
        if (payload.isJsonNull()) {
            throw new BridgeProtocolException("State envelope has a null state payload");
        }

        JsonPrimitive marker = null;
        JsonElement timestamp = json.get(TIMESTAMP_KEY);
        if (timestamp != null && timestamp.isJsonPrimitive()) {
            marker = timestamp.getAsJsonPrimitive();
        }
        return new StateEnvelope(marker, payload);
    }

    /**
     * Staleness marker, or null if the response carried none.
     */
    public JsonPrimitive marker() {
        return marker;
    }

    public boolean hasMarker() {
        return marker != null;
    }

    /**
     * True only when both markers are present and equal.
     */
    public boolean hasSameMarker(JsonPrimitive other) {
        return marker != null && marker.equals(other);
    }

    public StateDocument toDocument() throws BridgeProtocolException {
        JsonElement element = payload;
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            try {
                element = JsonParser.parseString(element.getAsString());
            } catch (JsonParseException e) {
                throw new BridgeProtocolException("Failed to parse state payload: " + e.getMessage(), e);
            }
        }
        if (!element.isJsonObject()) {
            throw new BridgeProtocolException("State payload is not a JSON object");
        }
        return new StateDocument(element.getAsJsonObject());
    }
}
