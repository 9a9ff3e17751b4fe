package com.spirecomm.bridge.state;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class StateDocumentTest {

    private static StateDocument parse(String json) {
        return new StateDocument(JsonParser.parseString(json).getAsJsonObject());
    }

    @Test
    void testDottedLookup() {
        StateDocument document = parse("{\"game_state\": {\"combat_state\": {\"turn\": 2}, \"seed\": \"ABC\"}}");

        assertEquals(OptionalInt.of(2), document.getInt("game_state.combat_state.turn"));
        assertEquals(Optional.of("ABC"), document.getString("game_state.seed"));
        assertTrue(document.has("game_state.combat_state"));
        assertFalse(document.has("game_state.missing.turn"));
        assertTrue(document.getInt("game_state.seed.turn").isEmpty());
    }

    @Test
    void testTypeMismatchIsNotAvailable() {
        StateDocument document = parse("{\"hp\": \"60\", \"flag\": 1, \"name\": 3, \"big\": 3000000000, \"frac\": 1.5}");

        assertTrue(document.getInt("hp").isEmpty());
        assertTrue(document.getBoolean("flag").isEmpty());
        assertTrue(document.getString("name").isEmpty());
        assertTrue(document.getInt("big").isEmpty());
        assertTrue(document.getInt("frac").isEmpty());
    }

    @Test
    void testWholeDecimalIsAnInt() {
        assertEquals(OptionalInt.of(60), parse("{\"hp\": 60.0}").getInt("hp"));
    }

    @Test
    void testBlankPathIsNotAvailable() {
        StateDocument document = parse("{\"a\": 1}");
        assertFalse(document.has(""));
        assertFalse(document.has(null));
    }

    @Test
    void testStringListSkipsNonStrings() {
        StateDocument document = parse("{\"commands\": [\"play\", 1, null, \"end\"], \"scalar\": \"x\"}");

        assertEquals(List.of("play", "end"), document.getStringList("commands"));
        assertEquals(List.of(), document.getStringList("scalar"));
        assertEquals(List.of(), document.getStringList("missing"));
        assertThrows(UnsupportedOperationException.class, () -> document.getStringList("commands").add("x"));
    }

    @Test
    void testDocumentIsIsolatedFromSource() {
        JsonObject source = JsonParser.parseString("{\"floor\": 1}").getAsJsonObject();
        StateDocument document = new StateDocument(source);

        source.addProperty("floor", 2);
        assertEquals(OptionalInt.of(1), document.getInt("floor"));

        document.toJsonObject().addProperty("floor", 3);
        assertEquals(OptionalInt.of(1), document.getInt("floor"));
    }

    @Test
    void testNestedObject() {
        StateDocument document = parse("{\"game_state\": {\"act\": 2}}");

        assertEquals(OptionalInt.of(2), document.getObject("game_state").orElseThrow().getInt("act"));
        assertTrue(document.getObject("game_state.act").isEmpty());
    }

    @Test
    void testEmpty() {
        assertTrue(parse("{}").isEmpty());
        assertFalse(parse("{\"a\": null}").isEmpty());
        assertEquals("{}", parse("{}").toJson());
    }
}
