package com.loggy.sdk.autoconfigure.transport;

import com.loggy.sdk.client.transport.LogRequest;
import com.loggy.sdk.client.transport.LogResponse;
import com.loggy.sdk.client.transport.LogTransport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * POSTs log requests with Spring's blocking {@link RestClient}, off the caller
 * thread. Error statuses come back as responses; I/O failures complete the
 * future exceptionally.
 */
public final class RestClientTransport implements LogTransport {
    private final RestClient restClient;
    private final Executor asyncExecutor;

    public RestClientTransport(RestClient restClient, Executor asyncExecutor) {
        this.restClient = restClient;
        this.asyncExecutor = asyncExecutor;
    }

    LogResponse send(LogRequest request) {
        try {
            RestClient.RequestBodySpec spec = restClient.post().uri(request.getUri());
            request.getHeaders().forEach(spec::header);
            ResponseEntity<String> response = spec.body(request.getBody()).retrieve().toEntity(String.class);
            return new LogResponse(response.getStatusCode().value(), response.getBody());
        } catch (RestClientResponseException ex) {
            return new LogResponse(ex.getStatusCode().value(), ex.getResponseBodyAsString());
        }
    }

    @Override
    public CompletableFuture<LogResponse> sendAsync(LogRequest request) {
        if (asyncExecutor != null) {
            return CompletableFuture.supplyAsync(() -> send(request), asyncExecutor);
        }
        return CompletableFuture.supplyAsync(() -> send(request));
    }
}
