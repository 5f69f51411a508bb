package com.loggy.sdk.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Named timers started by {@code time()} and read by {@code timeLog()}/{@code timeEnd()}.
 */
public class TimerRegistry {

    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final LongSupplier ticker;

    /**
     * @param ticker monotonic nanosecond source, normally {@code System::nanoTime}
     */
    public TimerRegistry(LongSupplier ticker) {
        this.ticker = ticker;
    }

    /**
     * Start or restart {@code label}.
     */
    public void start(String label, Map<String, ?> fields) {
        timers.put(label, new Timer(ticker.getAsLong(), fields));
    }

    public Optional<Timer> get(String label) {
        return Optional.ofNullable(timers.get(label));
    }

    public void remove(String label) {
        timers.remove(label);
    }

    public boolean contains(String label) {
        return timers.containsKey(label);
    }

    /**
     * Seconds elapsed since {@code timer} was started.
     */
    public double elapsedSeconds(Timer timer) {
        return (ticker.getAsLong() - timer.startNanos) / 1_000_000_000.0;
    }

    public static final class Timer {
        private final long startNanos;
        private final Map<String, Object> fields;

        Timer(long startNanos, Map<String, ?> fields) {
            this.startNanos = startNanos;
            this.fields = fields != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
                    : Collections.emptyMap();
        }

        public long getStartNanos() {
            return startNanos;
        }

        public Map<String, Object> getFields() {
            return fields;
        }
    }
}
