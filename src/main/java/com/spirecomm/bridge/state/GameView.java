package com.spirecomm.bridge.state;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Typed read-only projection over a cached {@link StateDocument}.
 *
 * <p>Game fields are looked up under {@code game_state} first and then at the top
 * level, so both the raw CommunicationMod message and a flattened document work.
 * Every accessor reports "not available" instead of throwing.
 */
public final class GameView {
    private static final GameView EMPTY = new GameView(null);
    private static final String GAME_STATE = "game_state";

    private final StateDocument document;

    private GameView(StateDocument document) {
        this.document = document;
    }

    public static GameView of(StateDocument document) {
        return document == null ? EMPTY : new GameView(document);
    }

    public static GameView empty() {
        return EMPTY;
    }

    public boolean isAvailable() {
        return document != null;
    }

    public boolean isInGame() {
        return document != null && document.getBoolean("in_game").orElse(false);
    }

    public boolean isReadyForCommand() {
        return document != null && document.getBoolean("ready_for_command").orElse(false);
    }

    public List<String> getAvailableCommands() {
        return document == null ? List.of() : document.getStringList("available_commands");
    }

    public boolean hasCommand(String command) {
        return command != null && getAvailableCommands().contains(command);
    }

    /**
     * Error message CommunicationMod attaches to a state when it rejected the last command.
     */
    public Optional<String> getBridgeError() {
        return document == null ? Optional.empty() : document.getString("error");
    }

    public Optional<String> getScreenType() {
        return gameString("screen_type");
    }

    public Optional<ScreenType> getScreenTypeEnum() {
        return getScreenType().flatMap(ScreenType::fromName);
    }

    public OptionalInt getCurrentHp() {
        return gameInt("current_hp");
    }

    public OptionalInt getMaxHp() {
        return gameInt("max_hp");
    }

    public OptionalInt getFloor() {
        return gameInt("floor");
    }

    public OptionalInt getAct() {
        return gameInt("act");
    }

    public OptionalInt getGold() {
        return gameInt("gold");
    }

    public OptionalInt getAscensionLevel() {
        return gameInt("ascension_level");
    }

    public Optional<String> getCharacterClass() {
        return gameString("class");
    }

    public Optional<String> getRoomPhase() {
        return gameString("room_phase");
    }

    private Optional<String> gameString(String field) {
        if (document == null) {
            return Optional.empty();
        }
        Optional<String> nested = document.getString(GAME_STATE + "." + field);
        return nested.isPresent() ? nested : document.getString(field);
    }

    private OptionalInt gameInt(String field) {
        if (document == null) {
            return OptionalInt.empty();
        }
        OptionalInt nested = document.getInt(GAME_STATE + "." + field);
        return nested.isPresent() ? nested : document.getInt(field);
    }
}
