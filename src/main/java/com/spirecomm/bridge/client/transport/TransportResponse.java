package com.spirecomm.bridge.client.transport;

import com.spirecomm.bridge.protocol.BridgePaths;

/**
 * Status code and body of one bridge response. The body is never null.
 */
public record TransportResponse(int statusCode, String body) {
    public TransportResponse {
        body = body == null ? "" : body;
    }

    public boolean isOk() {
        return statusCode == BridgePaths.STATUS_OK;
    }
}
