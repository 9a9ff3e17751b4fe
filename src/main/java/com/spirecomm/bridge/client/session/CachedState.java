package com.spirecomm.bridge.client.session;

import com.google.gson.JsonPrimitive;
import com.spirecomm.bridge.state.StateDocument;

import java.util.Objects;

/**
 * The last accepted state and the staleness marker it arrived with.
 * The marker is null when the bridge sent none.
 */
public record CachedState(StateDocument document, JsonPrimitive marker) {
    public CachedState {
        Objects.requireNonNull(document, "document");
    }
}
