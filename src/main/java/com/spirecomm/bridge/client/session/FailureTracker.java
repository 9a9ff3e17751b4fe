package com.spirecomm.bridge.client.session;

import com.spirecomm.bridge.SpireComm;

/**
 * Counts consecutive failed requests across all request types and disconnects the
 * session once the configured threshold is reached. Any success resets the count.
 */
public class FailureTracker {
    private final int maxConsecutiveFailures;
    private final ConnectionStatusMachine statusMachine;

    private int consecutiveFailures;
    private String lastError = "";

    public FailureTracker(int maxConsecutiveFailures, ConnectionStatusMachine statusMachine) {
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be at least 1, got " + maxConsecutiveFailures);
        }
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.statusMachine = statusMachine;
    }

    public void recordFailure(String reason) {
        consecutiveFailures++;
        lastError = reason;
        SpireComm.LOGGER.warn("Bridge request failed ({}/{}): {}",
                consecutiveFailures, maxConsecutiveFailures, reason);

        if (consecutiveFailures >= maxConsecutiveFailures
                && statusMachine.getStatus() != ConnectionStatus.DISCONNECTED) {
            SpireComm.LOGGER.warn("{} consecutive failures, marking bridge as disconnected", consecutiveFailures);
            statusMachine.disconnect();
        }
    }

    /**
     * Sets the last error without counting a failed request.
     */
    public void recordCondition(String reason) {
        lastError = reason;
    }

    public void recordSuccess() {
        consecutiveFailures = 0;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public String getLastError() {
        return lastError;
    }
}
