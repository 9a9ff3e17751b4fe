package com.spirecomm.bridge.client.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * Synchronous request/response channel to the bridge.
 * An {@link IOException} means no response was received.
 */
public interface BridgeTransport extends AutoCloseable {
    TransportResponse get(String path, Duration timeout) throws IOException;

    TransportResponse post(String path, String jsonBody, Duration timeout) throws IOException;

    @Override
    default void close() {
    }
}
