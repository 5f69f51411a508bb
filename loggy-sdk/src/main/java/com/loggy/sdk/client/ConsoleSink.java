package com.loggy.sdk.client;

import com.loggy.sdk.model.LogEvent;

/**
 * Local echo of every logged event, used when {@code printToConsole} is on.
 */
@FunctionalInterface
public interface ConsoleSink {
    void print(LogEvent event);
}
