package com.loggy.sdk.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Moves one encoded request to the collector.
 *
 * <p>Implementations must not block the caller of {@link #sendAsync}.</p>
 */
public interface LogTransport {
    CompletableFuture<LogResponse> sendAsync(LogRequest request);
}
