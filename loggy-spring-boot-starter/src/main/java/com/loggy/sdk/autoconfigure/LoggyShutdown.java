package com.loggy.sdk.autoconfigure;

import com.loggy.sdk.client.Loggy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Drains the buffer in the last lifecycle phase, after every other lifecycle
 * bean has stopped. The logger stays usable for destroy callbacks; the bean
 * itself is closed when the context destroys it.
 */
final class LoggyShutdown implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(LoggyShutdown.class);

    private final Loggy loggy;
    private volatile boolean running = false;

    LoggyShutdown(Loggy loggy) {
        this.loggy = loggy;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.debug("Context stopping, flushing buffered events for app {}", loggy.getApp());
        loggy.flush();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
