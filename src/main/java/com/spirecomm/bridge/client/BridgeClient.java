package com.spirecomm.bridge.client;

import com.spirecomm.bridge.action.Action;
import com.spirecomm.bridge.client.session.ConnectionStatus;
import com.spirecomm.bridge.state.ScreenType;
import com.spirecomm.bridge.state.StateDocument;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Session with a SpireComm HTTP bridge.
 *
 * <p>All calls are synchronous and issue at most one request, except
 * {@link #waitForReady(long)}. None of them throw on bridge or network errors:
 * they return false or an empty result and record the reason in
 * {@link #getLastError()}. Implementations are not thread-safe.
 *
 * <pre>{@code
 * try (SpireCommClient client = new SpireCommClient(config)) {
 *     if (client.connect() && client.waitForReady(30_000)) {
 *         while (running) {
 *             client.getState();
 *             if (client.isReadyForCommand() && client.hasCommand("end")) {
 *                 client.sendAction(Actions.endTurn());
 *             }
 *             Thread.sleep(client.getPollInterval().toMillis());
 *         }
 *     }
 * }
 * }</pre>
 */
public interface BridgeClient extends AutoCloseable {
    /**
     * Checks that the bridge is reachable and reports itself ready.
     */
    boolean connect();

    /**
     * Asks the bridge to send CommunicationMod its ready handshake.
     */
    boolean sendReadyHandshake();

    /**
     * Polls until the session is READY or the timeout elapses. Each poll's request
     * timeout is capped by the time left. A DISCONNECTED session never becomes READY
     * here, so call {@link #connect()} first.
     */
    boolean waitForReady(long timeoutMs);

    /**
     * Polls the latest state. Returns the cached instance when the bridge reports
     * the same timestamp as last time.
     *
     * <p>A non-empty state moves a CONNECTED or WAITING_FOR_STATE session to READY.
     * Once the failure threshold has forced DISCONNECTED, states are still returned
     * and cached but the status stays DISCONNECTED until {@link #connect()} succeeds.
     */
    Optional<StateDocument> getState();

    /**
     * Whether the bridge holds a state newer than the cached one. Leaves the cache,
     * the failure count, the status and the last error untouched.
     */
    boolean hasNewState();

    Optional<StateDocument> getCachedState();

    boolean sendAction(Action action);

    boolean sendAction(String command);

    boolean sendAction(String command, int arg);

    boolean sendAction(String command, int arg1, int arg2);

    ConnectionStatus getStatus();

    int getConsecutiveFailures();

    String getLastError();

    Duration getPollInterval();

    boolean isInGame();

    boolean isReadyForCommand();

    List<String> getAvailableCommands();

    boolean hasCommand(String command);

    Optional<String> getScreenType();

    Optional<ScreenType> getScreenTypeEnum();

    OptionalInt getCurrentHp();

    OptionalInt getMaxHp();

    OptionalInt getFloor();

    OptionalInt getAct();

    OptionalInt getGold();

    OptionalInt getAscensionLevel();

    Optional<String> getCharacterClass();

    Optional<String> getRoomPhase();

    Optional<String> getBridgeError();

    @Override
    void close();
}
