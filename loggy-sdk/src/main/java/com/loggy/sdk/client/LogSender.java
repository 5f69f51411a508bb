package com.loggy.sdk.client;

import com.loggy.sdk.model.LogEvent;

import java.util.List;

/**
 * Hands events to the collector without waiting for the outcome.
 *
 * <p>Neither method may block on the network or throw.</p>
 */
public interface LogSender {

    /**
     * Send one event, encoded as a single object.
     */
    void send(LogEvent event);

    /**
     * Send an ordered batch, encoded as an array.
     */
    void send(List<LogEvent> batch);
}
