package com.spirecomm.bridge.client.session;

public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTED,
    WAITING_FOR_STATE,
    READY;

    public boolean isConnected() {
        return this != DISCONNECTED;
    }
}
