package com.loggy.sdk.bridge;

import com.loggy.sdk.client.ProcessTerminator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * {@link GlobalEventSource} and {@link ProcessTerminator} for the running JVM.
 *
 * <p>Uncaught exceptions are observed through the default uncaught exception
 * handler, chaining to whichever handler was installed before. Exit is observed
 * through a shutdown hook; the JVM does not expose the exit status to hooks,
 * so the status reported is the one last requested through {@link #exit(int)},
 * or {@code 0}. The JVM has no notion of unhandled rejections or process
 * warnings, so host code reports them with {@link #reportRejection(Object)} and
 * {@link #reportWarning(Object)}.</p>
 *
 * <p>Hooks are installed lazily, once, on first subscription.</p>
 */
public final class JvmProcessHooks implements GlobalEventSource, ProcessTerminator {

    private static final Logger log = LoggerFactory.getLogger(JvmProcessHooks.class);

    private static final JvmProcessHooks INSTANCE = new JvmProcessHooks(
            System::exit, hook -> Runtime.getRuntime().addShutdownHook(hook));

    private final IntConsumer exitFunction;
    private final Consumer<Thread> shutdownHookRegistrar;

    private final List<Consumer<Throwable>> exceptionHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Object>> rejectionHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Object>> warningHandlers = new CopyOnWriteArrayList<>();
    private final List<IntConsumer> exitHandlers = new CopyOnWriteArrayList<>();

    private final AtomicBoolean uncaughtHandlerInstalled = new AtomicBoolean(false);
    private final AtomicBoolean shutdownHookInstalled = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicInteger exitStatus = new AtomicInteger(0);

    JvmProcessHooks(IntConsumer exitFunction, Consumer<Thread> shutdownHookRegistrar) {
        this.exitFunction = exitFunction;
        this.shutdownHookRegistrar = shutdownHookRegistrar;
    }

    public static JvmProcessHooks getInstance() {
        return INSTANCE;
    }

    @Override
    public void onUncaughtException(Consumer<Throwable> handler) {
        exceptionHandlers.add(handler);
        if (uncaughtHandlerInstalled.compareAndSet(false, true)) {
            Thread.UncaughtExceptionHandler previous = Thread.getDefaultUncaughtExceptionHandler();
            Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
                publish(exceptionHandlers, error, "uncaught exception");
                if (previous != null) {
                    previous.uncaughtException(thread, error);
                }
            });
        }
    }

    @Override
    public void onUnhandledRejection(Consumer<Object> handler) {
        rejectionHandlers.add(handler);
    }

    @Override
    public void onWarning(Consumer<Object> handler) {
        warningHandlers.add(handler);
    }

    @Override
    public void onExit(IntConsumer handler) {
        exitHandlers.add(handler);
        if (shutdownHookInstalled.compareAndSet(false, true)) {
            shutdownHookRegistrar.accept(new Thread(this::runExitHandlers, "loggy-exit"));
        }
    }

    /**
     * Report an asynchronous failure nobody handled, e.g. from
     * {@code ThreadPoolExecutor.afterExecute}.
     */
    public void reportRejection(Object reason) {
        publish(rejectionHandlers, reason, "unhandled rejection");
    }

    /**
     * Report a non-fatal host warning, e.g. a deprecation notice.
     */
    public void reportWarning(Object warning) {
        publish(warningHandlers, warning, "warning");
    }

    /**
     * Exit the JVM with {@code status}. Ignored once shutdown has begun, since
     * exiting from inside a shutdown hook would block forever.
     */
    @Override
    public void exit(int status) {
        if (shuttingDown.get()) {
            log.warn("Ignoring exit({}) requested while the JVM is already shutting down", status);
            return;
        }
        exitStatus.set(status);
        exitFunction.accept(status);
    }

    boolean isShuttingDown() {
        return shuttingDown.get();
    }

    void runExitHandlers() {
        shuttingDown.set(true);
        int status = exitStatus.get();
        for (IntConsumer handler : exitHandlers) {
            try {
                handler.accept(status);
            } catch (RuntimeException e) {
                log.warn("Exit handler failed: {}", e.getMessage(), e);
            }
        }
    }

    private static <T> void publish(List<Consumer<T>> handlers, T value, String source) {
        for (Consumer<T> handler : handlers) {
            try {
                handler.accept(value);
            } catch (RuntimeException e) {
                log.warn("Handler for {} failed: {}", source, e.getMessage(), e);
            }
        }
    }
}
