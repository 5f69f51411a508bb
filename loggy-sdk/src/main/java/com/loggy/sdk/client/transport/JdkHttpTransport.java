package com.loggy.sdk.client.transport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * POSTs requests with {@link HttpClient}. Connections are kept alive by the client.
 */
public final class JdkHttpTransport implements LogTransport {
    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<LogResponse> sendAsync(LogRequest request) {
        HttpRequest httpRequest = buildRequest(request);
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new LogResponse(response.statusCode(), response.body()));
    }

    HttpRequest buildRequest(LogRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.getUri())
                .POST(HttpRequest.BodyPublishers.ofString(request.getBody()));

        if (request.getTimeout() != null) {
            builder.timeout(request.getTimeout());
        }
        request.getHeaders().forEach(builder::header);

        return builder.build();
    }
}
