package com.spirecomm.bridge.protocol;

public final class BridgePaths {
    public static final String HEALTH = "/health";
    public static final String STATE = "/state";
    public static final String READY = "/ready";
    public static final String ACTION = "/action";

    public static final int STATUS_OK = 200;
    public static final int STATUS_NO_CONTENT = 204;

    private BridgePaths() {
    }
}
