package com.loggy.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loggy.sdk.client.transport.LogRequest;
import com.loggy.sdk.client.transport.LogResponse;
import com.loggy.sdk.client.transport.LogTransport;
import com.loggy.sdk.exception.LoggyException;
import com.loggy.sdk.model.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Encodes events as JSON and POSTs them to {@code <remote>/log/<app>}.
 *
 * <p>Sends are fire-and-forget. The outcome is only observed to report failures
 * to the {@link DeliveryFailureCallback} and, when {@code maxRetries > 0}, to
 * retry transport errors, 5xx and 429 responses with a linear backoff.</p>
 */
public class HttpLogSender implements LogSender {

    private static final Logger log = LoggerFactory.getLogger(HttpLogSender.class);

    private static final Map<String, String> HEADERS = Map.of("Content-Type", "application/json");

    private final URI endpoint;
    private final LogTransport transport;
    private final ObjectMapper objectMapper;
    private final DeliveryFailureCallback failureCallback;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration requestTimeout;

    public HttpLogSender(URI endpoint,
                         LogTransport transport,
                         ObjectMapper objectMapper,
                         DeliveryFailureCallback failureCallback,
                         int maxRetries,
                         Duration retryDelay,
                         Duration requestTimeout) {
        this.endpoint = endpoint;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.failureCallback = failureCallback;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Collector URL for {@code app}: {@code remote}, a separating slash when
     * {@code remote} lacks one, then {@code log/<app>}.
     *
     * @throws IllegalArgumentException if the result is not a valid URI
     */
    public static URI endpointFor(String remote, String app) {
        String base = remote.endsWith("/") ? remote : remote + "/";
        String segment = URLEncoder.encode(app, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(base + "log/" + segment);
    }

    @Override
    public void send(LogEvent event) {
        send(event, Collections.singletonList(event));
    }

    @Override
    public void send(List<LogEvent> batch) {
        send(batch, batch);
    }

    public URI getEndpoint() {
        return endpoint;
    }

    private void send(Object payload, List<LogEvent> events) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            notifyFailure(events, new LoggyException("Failed to serialize " + events.size() + " event(s)", e));
            return;
        }
        dispatch(new LogRequest(endpoint, json, HEADERS, requestTimeout), events, 0);
    }

    private void dispatch(LogRequest request, List<LogEvent> events, int attempt) {
        CompletableFuture<LogResponse> future;
        try {
            future = transport.sendAsync(request);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((response, ex) -> {
            if (ex == null && response.isSuccessful()) {
                log.trace("Delivered {} event(s) to {}", events.size(), endpoint);
                return;
            }

            Throwable cause = ex != null ? unwrapCompletionException(ex) : null;
            int status = response != null ? response.getStatusCode() : 0;
            if (attempt < maxRetries && (cause != null || isRetryableStatus(status))) {
                scheduleRetry(request, events, attempt + 1, cause != null ? cause.getClass().getSimpleName() : "status " + status);
                return;
            }

            LoggyException failure = cause != null
                    ? new LoggyException("Delivery to " + endpoint + " failed", cause)
                    : new LoggyException("Collector responded with status " + status, status);
            notifyFailure(events, failure);
        });
    }

    private void scheduleRetry(LogRequest request, List<LogEvent> events, int attempt, String reason) {
        long delayMs = retryDelay.toMillis() * attempt;
        log.debug("Retry attempt {} for {} in {}ms ({})", attempt, endpoint, delayMs, reason);
        CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS)
                .execute(() -> dispatch(request, events, attempt));
    }

    private boolean isRetryableStatus(int status) {
        return status >= 500 || status == 429;
    }

    private Throwable unwrapCompletionException(Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }

    private void notifyFailure(List<LogEvent> events, LoggyException failure) {
        try {
            failureCallback.onDeliveryFailure(events, failure);
        } catch (RuntimeException e) {
            log.warn("DeliveryFailureCallback threw for {} event(s): {}", events.size(), e.getMessage());
        }
    }
}
