package com.spirecomm.bridge.state;

import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class GameViewTest {

    private static GameView view(String json) {
        return GameView.of(new StateDocument(JsonParser.parseString(json).getAsJsonObject()));
    }

    @Test
    void testEmptyViewReportsNothing() {
        GameView view = GameView.of(null);

        assertSame(GameView.empty(), view);
        assertFalse(view.isAvailable());
        assertFalse(view.isInGame());
        assertTrue(view.getAvailableCommands().isEmpty());
        assertTrue(view.getScreenType().isEmpty());
        assertTrue(view.getCurrentHp().isEmpty());
    }

    @Test
    void testGameStateTakesPrecedence() {
        GameView view = view("{\"floor\": 1, \"game_state\": {\"floor\": 7}}");

        assertEquals(OptionalInt.of(7), view.getFloor());
    }

    @Test
    void testFallsBackToTopLevelWhenNestedFieldIsMalformed() {
        GameView view = view("{\"current_hp\": 40, \"game_state\": {\"current_hp\": \"forty\"}}");

        assertEquals(OptionalInt.of(40), view.getCurrentHp());
    }

    @Test
    void testUnknownScreenType() {
        GameView view = view("{\"game_state\": {\"screen_type\": \"FTUE\"}}");

        assertEquals(Optional.of("FTUE"), view.getScreenType());
        assertTrue(view.getScreenTypeEnum().isEmpty());
    }

    @Test
    void testScreenTypeNames() {
        assertEquals(Optional.of(ScreenType.SHOP_SCREEN), ScreenType.fromName("shop_screen"));
        assertEquals(Optional.of(ScreenType.GAME_OVER), ScreenType.fromName(" GAME_OVER "));
        assertTrue(ScreenType.fromName(null).isEmpty());
        assertTrue(ScreenType.fromName("").isEmpty());
    }
}
