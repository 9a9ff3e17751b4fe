package com.spirecomm.bridge.state;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable view of one game-state document received from the bridge.
 *
 * <p>The document is kept as an untyped JSON tree. Lookups take a dotted path
 * ({@code "game_state.current_hp"}) and return an empty result when any segment
 * is missing or the value has the wrong type; they never throw.
 */
public final class StateDocument {
    private final JsonObject root;

    public StateDocument(JsonObject root) {
        this.root = Objects.requireNonNull(root, "root").deepCopy();
    }

    public boolean isEmpty() {
        return root.size() == 0;
    }

    public boolean has(String path) {
        return find(path).isPresent();
    }

    public Optional<String> getString(String path) {
        return primitive(path)
                .filter(JsonPrimitive::isString)
                .map(JsonPrimitive::getAsString);
    }

    public OptionalInt getInt(String path) {
        Optional<JsonPrimitive> value = primitive(path).filter(JsonPrimitive::isNumber);
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            BigDecimal number = new BigDecimal(value.get().getAsString());
            return OptionalInt.of(number.intValueExact());
        } catch (ArithmeticException | NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public Optional<Boolean> getBoolean(String path) {
        return primitive(path)
                .filter(JsonPrimitive::isBoolean)
                .map(JsonPrimitive::getAsBoolean);
    }

    /**
     * Returns the string elements of an array. Non-string elements are skipped.
     */
    public List<String> getStringList(String path) {
        Optional<JsonElement> element = find(path).filter(JsonElement::isJsonArray);
        if (element.isEmpty()) {
            return List.of();
        }
        JsonArray array = element.get().getAsJsonArray();
        List<String> values = new ArrayList<>(array.size());
        for (JsonElement item : array) {
            if (item.isJsonPrimitive() && item.getAsJsonPrimitive().isString()) {
                values.add(item.getAsString());
            }
        }
        return Collections.unmodifiableList(values);
    }

    public Optional<StateDocument> getObject(String path) {
        return find(path)
                .filter(JsonElement::isJsonObject)
                .map(element -> new StateDocument(element.getAsJsonObject()));
    }

    /**
     * Returns a copy of the underlying tree.
     */
    public JsonObject toJsonObject() {
        return root.deepCopy();
    }

    public String toJson() {
        return root.toString();
    }

    private Optional<JsonPrimitive> primitive(String path) {
        return find(path)
                .filter(JsonElement::isJsonPrimitive)
                .map(JsonElement::getAsJsonPrimitive);
    }

    private Optional<JsonElement> find(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        JsonElement current = root;
        for (String segment : path.split("\\.")) {
            if (!current.isJsonObject()) {
                return Optional.empty();
            }
            current = current.getAsJsonObject().get(segment);
            if (current == null || current.isJsonNull()) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateDocument)) return false;
        return root.equals(((StateDocument) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
