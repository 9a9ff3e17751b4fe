package com.spirecomm.bridge.state;

import java.util.Locale;
import java.util.Optional;

/**
 * Screen types reported by CommunicationMod in {@code game_state.screen_type}.
 */
public enum ScreenType {
    EVENT,
    CHEST,
    SHOP_ROOM,
    REST,
    CARD_REWARD,
    COMBAT_REWARD,
    MAP,
    BOSS_REWARD,
    SHOP_SCREEN,
    GRID,
    HAND_SELECT,
    GAME_OVER,
    COMPLETE,
    NONE;

    public static Optional<ScreenType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
