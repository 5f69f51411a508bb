package com.loggy.sdk.client;

/**
 * Terminates the host process after a fatal-class event has been queued.
 */
@FunctionalInterface
public interface ProcessTerminator {
    void exit(int status);
}
