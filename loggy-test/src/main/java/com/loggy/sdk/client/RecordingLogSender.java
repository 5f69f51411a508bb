package com.loggy.sdk.client;

import com.loggy.sdk.model.LogEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory LogSender for tests.
 *
 * <pre>{@code
 * RecordingLogSender recorder = new RecordingLogSender();
 * Loggy loggy = recorder.loggyBuilder("billing").build();
 *
 * loggy.warn("low stock");
 *
 * recorder.assertEventLogged("warn", "low stock");
 * }</pre>
 */
public class RecordingLogSender implements LogSender, ProcessTerminator {

    private final CopyOnWriteArrayList<LogEvent> events = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<List<LogEvent>> batches = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Integer> exitRequests = new CopyOnWriteArrayList<>();

    @Override
    public void send(LogEvent event) {
        events.add(event);
        batches.add(Collections.singletonList(event));
    }

    @Override
    public void send(List<LogEvent> batch) {
        if (batch == null) {
            return;
        }
        events.addAll(batch);
        batches.add(Collections.unmodifiableList(new ArrayList<>(batch)));
    }

    /**
     * Records the request instead of terminating the JVM.
     */
    @Override
    public void exit(int status) {
        exitRequests.add(status);
    }

    /**
     * A builder wired to this recorder: unbuffered, silent, and never
     * terminating the process.
     */
    public Loggy.Builder loggyBuilder(String app) {
        return Loggy.builder()
                .app(app)
                .sender(this)
                .processTerminator(this)
                .throttleInterval(0)
                .exitOnFatal(false)
                .printToConsole(false);
    }

    /**
     * Every event sent, in order, whether alone or in a batch.
     */
    public List<LogEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * One entry per send call; a single-event send is a batch of one.
     */
    public List<List<LogEvent>> getBatches() {
        return Collections.unmodifiableList(batches);
    }

    public List<Integer> getExitRequests() {
        return Collections.unmodifiableList(exitRequests);
    }

    public List<LogEvent> eventsWithLevel(String level) {
        List<LogEvent> matches = new ArrayList<>();
        for (LogEvent event : events) {
            if (Objects.equals(level, event.getLevel())) {
                matches.add(event);
            }
        }
        return matches;
    }

    public void reset() {
        events.clear();
        batches.clear();
        exitRequests.clear();
    }

    public void assertEventCount(int expected) {
        int actual = events.size();
        if (actual != expected) {
            throw new AssertionError("Expected " + expected + " events but found " + actual);
        }
    }

    public void assertEventLogged(String level, Object message) {
        for (LogEvent event : events) {
            if (Objects.equals(level, event.getLevel()) && Objects.equals(message, event.getMessage())) {
                return;
            }
        }
        throw new AssertionError("Expected event with level '" + level + "' and message '" + message + "'");
    }
}
