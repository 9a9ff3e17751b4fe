package com.spirecomm.bridge.client.transport;

import com.spirecomm.bridge.SpireComm;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link BridgeTransport} backed by {@link HttpClient}.
 */
public class HttpBridgeTransport implements BridgeTransport {
    private final String baseUrl;
    private final HttpClient httpClient;

    public HttpBridgeTransport(String baseUrl, Duration connectTimeout) {
        this(baseUrl, HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    HttpBridgeTransport(String baseUrl, HttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
    }

    @Override
    public TransportResponse get(String path, Duration timeout) throws IOException {
        HttpRequest request = newRequest(path, timeout)
                .GET()
                .build();
        return send(request);
    }

    @Override
    public TransportResponse post(String path, String jsonBody, Duration timeout) throws IOException {
        HttpRequest request = newRequest(path, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        return send(request);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private HttpRequest.Builder newRequest(String path, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", SpireComm.getUserAgent());
    }

    private TransportResponse send(HttpRequest request) throws IOException {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return new TransportResponse(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + request.uri());
        }
    }
}
