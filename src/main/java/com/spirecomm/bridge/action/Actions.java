package com.spirecomm.bridge.action;

import java.util.Locale;

/**
 * Factory for the CommunicationMod command vocabulary.
 */
public final class Actions {
    public static final String PLAY = "play";
    public static final String END = "end";
    public static final String POTION = "potion";
    public static final String CHOOSE = "choose";
    public static final String PROCEED = "proceed";
    public static final String CONFIRM = "confirm";
    public static final String SKIP = "skip";
    public static final String CANCEL = "cancel";
    public static final String LEAVE = "leave";
    public static final String RETURN = "return";
    public static final String START = "start";
    public static final String WAIT = "wait";
    public static final String STATE = "state";
    public static final String KEY = "key";
    public static final String CLICK = "click";

    private Actions() {
    }

    /**
     * Plays the card in the given hand slot. Slots are 1-based, as CommunicationMod expects.
     */
    public static Action playCard(int handSlot) {
        requirePositive(handSlot, "hand slot");
        return Action.of(PLAY, handSlot);
    }

    public static Action playCard(int handSlot, int targetIndex) {
        requirePositive(handSlot, "hand slot");
        requireNonNegative(targetIndex, "target index");
        return Action.of(PLAY, handSlot, targetIndex);
    }

    public static Action endTurn() {
        return Action.of(END);
    }

    public static Action usePotion(int potionSlot) {
        requireNonNegative(potionSlot, "potion slot");
        return Action.of(POTION, "use", potionSlot);
    }

    public static Action usePotion(int potionSlot, int targetIndex) {
        requireNonNegative(potionSlot, "potion slot");
        requireNonNegative(targetIndex, "target index");
        return Action.of(POTION, "use", potionSlot, targetIndex);
    }

    public static Action discardPotion(int potionSlot) {
        requireNonNegative(potionSlot, "potion slot");
        return Action.of(POTION, "discard", potionSlot);
    }

    public static Action choose(int choiceIndex) {
        requireNonNegative(choiceIndex, "choice index");
        return Action.of(CHOOSE, choiceIndex);
    }

    /**
     * Chooses by name. CommunicationMod matches the lowercase choice name; names
     * containing spaces must be chosen by index.
     */
    public static Action choose(String choiceName) {
        return Action.of(CHOOSE, choiceName.toLowerCase(Locale.ROOT));
    }

    public static Action proceed() {
        return Action.of(PROCEED);
    }

    public static Action confirm() {
        return Action.of(CONFIRM);
    }

    public static Action skip() {
        return Action.of(SKIP);
    }

    public static Action cancel() {
        return Action.of(CANCEL);
    }

    public static Action leave() {
        return Action.of(LEAVE);
    }

    public static Action goBack() {
        return Action.of(RETURN);
    }

    public static Action startGame(String characterClass, int ascension) {
        requireNonNegative(ascension, "ascension");
        return Action.of(START, characterClass.toLowerCase(Locale.ROOT), ascension);
    }

    public static Action startGame(String characterClass, int ascension, String seed) {
        requireNonNegative(ascension, "ascension");
        return Action.of(START, characterClass.toLowerCase(Locale.ROOT), ascension, seed.toUpperCase(Locale.ROOT));
    }

    public static Action waitFrames(int frames) {
        requirePositive(frames, "frame count");
        return Action.of(WAIT, frames);
    }

    /**
     * Asks CommunicationMod to resend the current state.
     */
    public static Action requestState() {
        return Action.of(STATE);
    }

    public static Action key(String keyName) {
        return Action.of(KEY, keyName.toLowerCase(Locale.ROOT));
    }

    public static Action click(String button, int x, int y) {
        return Action.of(CLICK, button.toLowerCase(Locale.ROOT), x, y);
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got " + value);
        }
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }
}
