package com.spirecomm.bridge.client;

import com.google.gson.Gson;
import com.spirecomm.bridge.SpireComm;
import com.spirecomm.bridge.action.Action;
import com.spirecomm.bridge.client.session.CachedState;
import com.spirecomm.bridge.client.session.ConnectionStatus;
import com.spirecomm.bridge.client.session.ConnectionStatusMachine;
import com.spirecomm.bridge.client.session.FailureTracker;
import com.spirecomm.bridge.client.transport.BridgeTransport;
import com.spirecomm.bridge.client.transport.HttpBridgeTransport;
import com.spirecomm.bridge.client.transport.TransportResponse;
import com.spirecomm.bridge.config.ClientConfig;
import com.spirecomm.bridge.protocol.BridgePaths;
import com.spirecomm.bridge.protocol.BridgeProtocolException;
import com.spirecomm.bridge.protocol.HealthReport;
import com.spirecomm.bridge.protocol.StateEnvelope;
import com.spirecomm.bridge.state.GameView;
import com.spirecomm.bridge.state.ScreenType;
import com.spirecomm.bridge.state.StateDocument;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link BridgeClient} for the SpireComm HTTP bridge.
 *
 * <p>Every request made by {@link #connect()}, {@link #sendReadyHandshake()},
 * {@link #getState()} and {@link #sendAction(Action)} is counted by one
 * {@link FailureTracker}; {@link #hasNewState()} is a side probe and is not.
 */
public class SpireCommClient implements BridgeClient {
    static final long WAIT_BACKOFF_MS = 100;

    private final Gson gson = new Gson();
    private final String host;
    private final int port;
    private final Duration requestTimeout;
    private final Duration pollInterval;
    private final boolean debug;
    private final BridgeTransport transport;
    private final ConnectionStatusMachine statusMachine = new ConnectionStatusMachine();
    private final FailureTracker failures;

    private CachedState cache;
    private HealthReport lastHealth;

    public SpireCommClient(ClientConfig config) {
        this(config, new HttpBridgeTransport(validated(config).baseUrl(), Duration.ofMillis(config.timeoutMs)));
    }

    public SpireCommClient(ClientConfig config, BridgeTransport transport) {
        validated(config);
        this.host = config.host;
        this.port = config.port;
        this.requestTimeout = Duration.ofMillis(config.timeoutMs);
        this.pollInterval = Duration.ofMillis(config.pollIntervalMs);
        this.debug = config.debug;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.failures = new FailureTracker(config.maxConsecutiveFailures, statusMachine);
    }

    private static ClientConfig validated(ClientConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.host == null || config.host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (config.port < 1 || config.port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, got " + config.port);
        }
        if (config.timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got " + config.timeoutMs);
        }
        if (config.pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive, got " + config.pollIntervalMs);
        }
        if (config.maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException(
                    "maxConsecutiveFailures must be at least 1, got " + config.maxConsecutiveFailures);
        }
        URI uri;
        try {
            uri = URI.create(config.baseUrl());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("host is not a valid URL host: '" + config.host + "'", e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("host is not a valid URL host: '" + config.host + "'");
        }
        return config;
    }

    @Override
    public boolean connect() {
        trace("Connecting to bridge at {}:{}", host, port);

        TransportResponse response;
        try {
            response = transport.get(BridgePaths.HEALTH, requestTimeout);
        } catch (IOException e) {
            return probeFailed("Failed to connect to bridge (no response): " + describe(e));
        }

        if (!response.isOk()) {
            return probeFailed("Health check failed (status " + response.statusCode() + ")");
        }

        HealthReport report;
        try {
            report = HealthReport.decode(response.body());
        } catch (BridgeProtocolException e) {
            return probeFailed(e.getMessage());
        }

        if (!report.isReady()) {
            return probeFailed("Bridge not ready (status: " + report.status() + ")");
        }

        lastHealth = report;
        failures.recordSuccess();
        statusMachine.onProbeSucceeded();
        SpireComm.LOGGER.info("Connected to bridge at {}:{} (has_state={})", host, port, report.hasState());
        return true;
    }

    private boolean probeFailed(String reason) {
        failures.recordFailure(reason);
        statusMachine.disconnect();
        return false;
    }

    @Override
    public boolean sendReadyHandshake() {
        TransportResponse response;
        try {
            response = transport.get(BridgePaths.READY, requestTimeout);
        } catch (IOException e) {
            failures.recordFailure("Failed to send ready handshake (no response): " + describe(e));
            return false;
        }

        if (!response.isOk()) {
            failures.recordFailure("Ready handshake failed (status " + response.statusCode() + ")");
            return false;
        }

        failures.recordSuccess();
        trace("Ready handshake sent");
        return true;
    }

    @Override
    public boolean waitForReady(long timeoutMs) {
        if (statusMachine.getStatus() == ConnectionStatus.READY) {
            return true;
        }
        statusMachine.onAwaitingState();

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            long budgetMs = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            pollState(budgetMs < requestTimeout.toMillis() ? Duration.ofMillis(budgetMs) : requestTimeout);
            if (statusMachine.getStatus() == ConnectionStatus.READY) {
                return true;
            }

            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.min(WAIT_BACKOFF_MS, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.recordCondition("Interrupted while waiting for game state");
                return false;
            }
        }

        failures.recordCondition("Timed out waiting for game state after " + timeoutMs + " ms");
        SpireComm.LOGGER.warn("No game state from bridge within {} ms (status {})",
                timeoutMs, statusMachine.getStatus());
        return false;
    }

    @Override
    public Optional<StateDocument> getState() {
        return pollState(requestTimeout);
    }

    private Optional<StateDocument> pollState(Duration timeout) {
        TransportResponse response;
        try {
            response = transport.get(BridgePaths.STATE, timeout);
        } catch (IOException e) {
            failures.recordFailure("Failed to get state (no response): " + describe(e));
            return Optional.empty();
        }

        if (response.statusCode() == BridgePaths.STATUS_NO_CONTENT) {
            trace("No state available yet (204)");
            return Optional.empty();
        }

        if (!response.isOk()) {
            failures.recordFailure("Get state failed (status " + response.statusCode() + ")");
            return Optional.empty();
        }

        StateEnvelope envelope;
        try {
            envelope = StateEnvelope.decode(response.body());
        } catch (BridgeProtocolException e) {
            failures.recordFailure(e.getMessage());
            return Optional.empty();
        }

        if (cache != null && envelope.hasSameMarker(cache.marker())) {
            failures.recordSuccess();
            accepted(cache.document());
            return Optional.of(cache.document());
        }

        StateDocument document;
        try {
            document = envelope.toDocument();
        } catch (BridgeProtocolException e) {
            failures.recordFailure(e.getMessage());
            return Optional.empty();
        }

        cache = new CachedState(document, envelope.marker());
        failures.recordSuccess();
        trace("State updated (timestamp {})", envelope.marker());
        accepted(document);
        return Optional.of(document);
    }

    private void accepted(StateDocument document) {
        if (!document.isEmpty()) {
            statusMachine.onStateAvailable();
        }
    }

    @Override
    public boolean hasNewState() {
        try {
            TransportResponse response = transport.get(BridgePaths.STATE, requestTimeout);
            if (!response.isOk()) {
                trace("State probe returned status {}", response.statusCode());
                return false;
            }
            StateEnvelope envelope = StateEnvelope.decode(response.body());
            return cache == null || !envelope.hasSameMarker(cache.marker());
        } catch (IOException | BridgeProtocolException e) {
            trace("State probe failed: {}", describe(e));
            return false;
        }
    }

    @Override
    public Optional<StateDocument> getCachedState() {
        return cache == null ? Optional.empty() : Optional.of(cache.document());
    }

    @Override
    public boolean sendAction(Action action) {
        Objects.requireNonNull(action, "action");
        String body = gson.toJson(action.toJson());
        trace("Sending action: {}", body);

        TransportResponse response;
        try {
            response = transport.post(BridgePaths.ACTION, body, requestTimeout);
        } catch (IOException e) {
            failures.recordFailure("Failed to send action '" + action + "' (no response): " + describe(e));
            return false;
        }

        if (!response.isOk()) {
            failures.recordFailure("Send action '" + action + "' failed (status " + response.statusCode() + ")");
            if (!response.body().isEmpty()) {
                trace("Response body: {}", response.body());
            }
            return false;
        }

        failures.recordSuccess();
        trace("Action sent successfully");
        return true;
    }

    @Override
    public boolean sendAction(String command) {
        return sendAction(Action.of(command));
    }

    @Override
    public boolean sendAction(String command, int arg) {
        return sendAction(Action.of(command, arg));
    }

    @Override
    public boolean sendAction(String command, int arg1, int arg2) {
        return sendAction(Action.of(command, arg1, arg2));
    }

    @Override
    public ConnectionStatus getStatus() {
        return statusMachine.getStatus();
    }

    @Override
    public int getConsecutiveFailures() {
        return failures.getConsecutiveFailures();
    }

    @Override
    public String getLastError() {
        return failures.getLastError();
    }

    @Override
    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * The last successful health report, or empty before the first successful {@link #connect()}.
     */
    public Optional<HealthReport> getLastHealth() {
        return Optional.ofNullable(lastHealth);
    }

    private GameView view() {
        return GameView.of(cache == null ? null : cache.document());
    }

    @Override
    public boolean isInGame() {
        return view().isInGame();
    }

    @Override
    public boolean isReadyForCommand() {
        return view().isReadyForCommand();
    }

    @Override
    public List<String> getAvailableCommands() {
        return view().getAvailableCommands();
    }

    @Override
    public boolean hasCommand(String command) {
        return view().hasCommand(command);
    }

    @Override
    public Optional<String> getScreenType() {
        return view().getScreenType();
    }

    @Override
    public Optional<ScreenType> getScreenTypeEnum() {
        return view().getScreenTypeEnum();
    }

    @Override
    public OptionalInt getCurrentHp() {
        return view().getCurrentHp();
    }

    @Override
    public OptionalInt getMaxHp() {
        return view().getMaxHp();
    }

    @Override
    public OptionalInt getFloor() {
        return view().getFloor();
    }

    @Override
    public OptionalInt getAct() {
        return view().getAct();
    }

    @Override
    public OptionalInt getGold() {
        return view().getGold();
    }

    @Override
    public OptionalInt getAscensionLevel() {
        return view().getAscensionLevel();
    }

    @Override
    public Optional<String> getCharacterClass() {
        return view().getCharacterClass();
    }

    @Override
    public Optional<String> getRoomPhase() {
        return view().getRoomPhase();
    }

    @Override
    public Optional<String> getBridgeError() {
        return view().getBridgeError();
    }

    @Override
    public void close() {
        transport.close();
    }

    private void trace(String format, Object... args) {
        if (debug) {
            SpireComm.LOGGER.info(format, args);
        } else {
            SpireComm.LOGGER.debug(format, args);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
