package com.loggy.sdk.client;

import com.loggy.sdk.model.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers normalized events and decides when they are flushed to the sender.
 *
 * <p>An event is flushed with the whole buffer immediately when the caller asks
 * for it, when the process is about to exit, or when the buffer reaches
 * {@code throttleLimit}. Otherwise a single delayed flush is armed for
 * {@code throttleInterval} milliseconds. A non-positive interval disables
 * buffering and every event is sent on its own.</p>
 *
 * <p>The buffer and the pending flush are guarded by one lock. Swapping the
 * buffer and handing the batch to the sender happen in the same locked step,
 * so every event is sent exactly once.</p>
 */
public class FlushScheduler {

    private static final Logger log = LoggerFactory.getLogger(FlushScheduler.class);

    private final LogSender sender;
    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();

    private volatile long throttleIntervalMs;
    private volatile int throttleLimit;

    // guarded by lock
    private List<LogEvent> buffer = new ArrayList<>();
    private ScheduledFuture<?> pendingFlush;
    private long generation;

    private final AtomicLong batchesFlushed = new AtomicLong(0);
    private final AtomicLong eventsFlushed = new AtomicLong(0);

    public FlushScheduler(LogSender sender, ScheduledExecutorService scheduler,
                          long throttleIntervalMs, int throttleLimit) {
        this.sender = sender;
        this.scheduler = scheduler;
        this.throttleIntervalMs = throttleIntervalMs;
        this.throttleLimit = throttleLimit;
    }

    /**
     * Queue one event.
     *
     * @param event          the normalized event
     * @param forceImmediate flush the buffer now
     * @param willExit       the process terminates after this call; flush now
     */
    public void enqueue(LogEvent event, boolean forceImmediate, boolean willExit) {
        long interval = throttleIntervalMs;
        synchronized (lock) {
            if (interval <= 0) {
                // Buffering was switched off at runtime; drain leftovers first to keep order.
                flushLocked();
                sendSingle(event);
                return;
            }

            buffer.add(event);
            if (willExit || forceImmediate || buffer.size() >= throttleLimit) {
                flushLocked();
            } else if (pendingFlush == null) {
                arm(interval);
            }
        }
    }

    /**
     * Flush whatever is buffered now. No-op when the buffer is empty.
     */
    public void flush() {
        synchronized (lock) {
            flushLocked();
        }
    }

    public int getBufferDepth() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    public boolean isFlushPending() {
        synchronized (lock) {
            return pendingFlush != null;
        }
    }

    public long getBatchesFlushed() {
        return batchesFlushed.get();
    }

    public long getEventsFlushed() {
        return eventsFlushed.get();
    }

    public long getThrottleInterval() {
        return throttleIntervalMs;
    }

    public void setThrottleInterval(long throttleIntervalMs) {
        this.throttleIntervalMs = throttleIntervalMs;
    }

    public int getThrottleLimit() {
        return throttleLimit;
    }

    public void setThrottleLimit(int throttleLimit) {
        this.throttleLimit = throttleLimit;
    }

    private void arm(long interval) {
        long armed = ++generation;
        try {
            pendingFlush = scheduler.schedule(() -> onTimer(armed), interval, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Delayed flush rejected by scheduler, flushing {} buffered events now", buffer.size());
            flushLocked();
        }
    }

    private void onTimer(long armed) {
        synchronized (lock) {
            if (armed != generation || pendingFlush == null) {
                return; // superseded by an immediate flush
            }
            pendingFlush = null;
            flushLocked();
        }
    }

    private void flushLocked() {
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
        generation++;
        if (buffer.isEmpty()) {
            return;
        }

        List<LogEvent> batch = buffer;
        buffer = new ArrayList<>();
        batchesFlushed.incrementAndGet();
        eventsFlushed.addAndGet(batch.size());
        try {
            sender.send(batch);
        } catch (RuntimeException e) {
            log.warn("Sender threw while flushing {} events: {}", batch.size(), e.getMessage(), e);
        }
    }

    private void sendSingle(LogEvent event) {
        eventsFlushed.incrementAndGet();
        try {
            sender.send(event);
        } catch (RuntimeException e) {
            log.warn("Sender threw while sending event: {}", e.getMessage(), e);
        }
    }
}
