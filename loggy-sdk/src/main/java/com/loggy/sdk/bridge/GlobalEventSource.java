package com.loggy.sdk.bridge;

import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Process-level events a host environment can surface to a logger.
 *
 * <p>Implementations adapt a concrete runtime (see {@link JvmProcessHooks}) or a
 * container's lifecycle. Handlers may be invoked from any thread.</p>
 */
public interface GlobalEventSource {

    /** An exception escaped a thread. */
    void onUncaughtException(Consumer<Throwable> handler);

    /** An asynchronous task failed and nobody observed the failure. */
    void onUnhandledRejection(Consumer<Object> handler);

    /** A non-fatal warning was raised by the host. */
    void onWarning(Consumer<Object> handler);

    /** The process is stopping with the given status. */
    void onExit(IntConsumer handler);
}
