package com.spirecomm.bridge.client.session;

import com.spirecomm.bridge.SpireComm;

/**
 * Owns the connection status and the transitions between its values.
 */
public class ConnectionStatusMachine {
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;

    public ConnectionStatus getStatus() {
        return status;
    }

    /**
     * Health probe succeeded. A session that is already past CONNECTED keeps its status.
     */
    public void onProbeSucceeded() {
        if (status == ConnectionStatus.DISCONNECTED) {
            setStatus(ConnectionStatus.CONNECTED);
        }
    }

    public void onAwaitingState() {
        if (status == ConnectionStatus.CONNECTED) {
            setStatus(ConnectionStatus.WAITING_FOR_STATE);
        }
    }

    /**
     * A non-empty state is cached. Only a connected session becomes READY.
     */
    public void onStateAvailable() {
        if (status == ConnectionStatus.CONNECTED || status == ConnectionStatus.WAITING_FOR_STATE) {
            setStatus(ConnectionStatus.READY);
        }
    }

    public void disconnect() {
        setStatus(ConnectionStatus.DISCONNECTED);
    }

    private void setStatus(ConnectionStatus newStatus) {
        if (status != newStatus) {
            SpireComm.LOGGER.debug("Connection status {} -> {}", status, newStatus);
            status = newStatus;
        }
    }
}
