package com.loggy.sdk.bridge;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Global event source driven by the test.
 */
public class FakeGlobalEventSource implements GlobalEventSource {

    public final List<Consumer<Throwable>> exceptionHandlers = new CopyOnWriteArrayList<>();
    public final List<Consumer<Object>> rejectionHandlers = new CopyOnWriteArrayList<>();
    public final List<Consumer<Object>> warningHandlers = new CopyOnWriteArrayList<>();
    public final List<IntConsumer> exitHandlers = new CopyOnWriteArrayList<>();

    @Override
    public void onUncaughtException(Consumer<Throwable> handler) {
        exceptionHandlers.add(handler);
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
    }

    public void throwUncaught(Throwable error) {
        exceptionHandlers.forEach(h -> h.accept(error));
    }

    public void reject(Object reason) {
        rejectionHandlers.forEach(h -> h.accept(reason));
    }

    public void warn(Object warning) {
        warningHandlers.forEach(h -> h.accept(warning));
    }

    public void exit(int code) {
        exitHandlers.forEach(h -> h.accept(code));
    }

    public int registrations() {
        return exceptionHandlers.size() + rejectionHandlers.size() + warningHandlers.size() + exitHandlers.size();
    }
}
