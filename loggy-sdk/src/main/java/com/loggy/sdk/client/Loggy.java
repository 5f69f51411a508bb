package com.loggy.sdk.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.loggy.sdk.bridge.GlobalEventBridge;
import com.loggy.sdk.bridge.GlobalEventOptions;
import com.loggy.sdk.bridge.GlobalEventSource;
import com.loggy.sdk.bridge.JvmProcessHooks;
import com.loggy.sdk.client.transport.JdkHttpTransport;
import com.loggy.sdk.client.transport.LogTransport;
import com.loggy.sdk.model.LogEvent;
import com.loggy.sdk.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Loggy - structured event logger that batches events to a remote collector
 *
 * <p>Events are normalized into flat field maps, buffered, and flushed as JSON
 * batches to {@code <remote>/log/<app>}. A flush happens {@code throttleInterval}
 * milliseconds after the first buffered event, as soon as {@code throttleLimit}
 * events are buffered, or immediately when asked for or when a fatal-class event
 * is about to terminate the process.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * Loggy loggy = Loggy.builder()
 *     .app("billing")
 *     .remote("http://collector.internal:1065/")
 *     .build();
 *
 * loggy.info("Invoice created", Map.of("invoiceId", id));
 * loggy.log("Queue depth", 42);
 * loggy.log(exception, Map.of("orderId", orderId));
 *
 * Loggy requestLog = loggy.user("alice").module("checkout");
 * requestLog.time("charge");
 * ...
 * requestLog.timeEnd("charge");
 * }</pre>
 *
 * <p>Logging calls never throw and never block on the network. Delivery
 * failures go to the {@link DeliveryFailureCallback}.</p>
 */
public class Loggy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Loggy.class);

    public static final String DEFAULT_REMOTE = "http://127.0.0.1:1065/";
    public static final String DEFAULT_TIMER = "default";
    public static final long DEFAULT_THROTTLE_INTERVAL_MS = 100;
    public static final int DEFAULT_THROTTLE_LIMIT = 1000;

    private static final DeliveryFailureCallback DEFAULT_FAILURE_CALLBACK = (events, cause) ->
            log.debug("Dropped {} event(s): {}", events.size(), cause.getMessage());

    private final Shared shared;
    private final boolean root;
    private final EventNormalizer normalizer;
    private final FlushScheduler flushScheduler;
    private final TimerRegistry timers;

    private volatile boolean exitOnFatal;
    private volatile boolean printToConsole;

    private final AtomicBoolean globalEventsRegistered = new AtomicBoolean(false);
    private final AtomicLong eventsLogged = new AtomicLong(0);

    private Loggy(Shared shared, boolean root, Map<String, ?> defaults,
                  boolean exitOnFatal, boolean printToConsole, long throttleIntervalMs, int throttleLimit) {
        this.shared = shared;
        this.root = root;
        this.normalizer = new EventNormalizer(defaults, shared.clock);
        this.flushScheduler = new FlushScheduler(shared.sender, shared.scheduler, throttleIntervalMs, throttleLimit);
        this.timers = new TimerRegistry(shared.ticker);
        this.exitOnFatal = exitOnFatal;
        this.printToConsole = printToConsole;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Log entry points
    // ========================================================================

    /**
     * Log one call. Every other logging method funnels through here.
     *
     * @param message   the message slot
     * @param fields    the fields slot, {@code null} for none
     * @param immediate flush now; {@code null} when not supplied, in which case a
     *                  {@link LogFields#flag(boolean)} fields argument is used instead
     */
    public void log(LogInput message, LogFields fields, Boolean immediate) {
        for (EventNormalizer.NormalizedEvent normalized : normalizer.normalize(message, fields, immediate)) {
            dispatch(normalized.getEvent(), normalized.isImmediate());
        }
    }

    /**
     * Log a message, a field map, an error or a list of any of these.
     */
    public void log(Object message) {
        log(LogInput.of(message), LogFields.none(), null);
    }

    public void log(Object message, Map<String, ?> fields) {
        log(LogInput.of(message), LogFields.of(fields), null);
    }

    /**
     * Log a message with a numeric {@code value} field.
     */
    public void log(Object message, Number value) {
        log(LogInput.of(message), value != null ? LogFields.number(value) : LogFields.none(), null);
    }

    public void log(Object message, boolean immediate) {
        log(LogInput.of(message), LogFields.flag(immediate), null);
    }

    public void log(Object message, Map<String, ?> fields, boolean immediate) {
        log(LogInput.of(message), LogFields.of(fields), immediate);
    }

    /**
     * Log at {@code severity}. Equivalent to {@code log(message, {level, ...fields}, immediate)},
     * so a {@code level} in {@code fields} or in a map message takes precedence.
     */
    public void log(Severity severity, Object message, Map<String, ?> fields, Boolean immediate) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put(LogEvent.LEVEL, severity.getLabel());
        if (fields != null) {
            merged.putAll(fields);
        }
        log(LogInput.of(message), LogFields.map(merged), immediate);
    }

    private void dispatch(LogEvent event, boolean immediate) {
        boolean willExit = exitOnFatal && event.isFatal();
        eventsLogged.incrementAndGet();

        flushScheduler.enqueue(event, immediate, willExit);

        if (printToConsole) {
            try {
                shared.consoleSink.print(event);
            } catch (RuntimeException e) {
                log.warn("Console sink failed: {}", e.getMessage());
            }
        }

        if (willExit) {
            log.debug("Fatal event logged by app {}, terminating", shared.app);
            shared.terminator.exit(1);
        }
    }

    // ========================================================================
    // Severity shortcuts
    // ========================================================================

    public void trace(Object message) { log(Severity.TRACE, message, null, null); }
    public void trace(Object message, Map<String, ?> fields) { log(Severity.TRACE, message, fields, null); }
    public void trace(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.TRACE, message, fields, immediate); }

    public void verbose(Object message) { log(Severity.VERBOSE, message, null, null); }
    public void verbose(Object message, Map<String, ?> fields) { log(Severity.VERBOSE, message, fields, null); }
    public void verbose(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.VERBOSE, message, fields, immediate); }

    public void silly(Object message) { log(Severity.SILLY, message, null, null); }
    public void silly(Object message, Map<String, ?> fields) { log(Severity.SILLY, message, fields, null); }
    public void silly(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.SILLY, message, fields, immediate); }

    public void debug(Object message) { log(Severity.DEBUG, message, null, null); }
    public void debug(Object message, Map<String, ?> fields) { log(Severity.DEBUG, message, fields, null); }
    public void debug(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.DEBUG, message, fields, immediate); }

    public void info(Object message) { log(Severity.INFO, message, null, null); }
    public void info(Object message, Map<String, ?> fields) { log(Severity.INFO, message, fields, null); }
    public void info(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.INFO, message, fields, immediate); }

    public void notice(Object message) { log(Severity.NOTICE, message, null, null); }
    public void notice(Object message, Map<String, ?> fields) { log(Severity.NOTICE, message, fields, null); }
    public void notice(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.NOTICE, message, fields, immediate); }

    public void success(Object message) { log(Severity.SUCCESS, message, null, null); }
    public void success(Object message, Map<String, ?> fields) { log(Severity.SUCCESS, message, fields, null); }
    public void success(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.SUCCESS, message, fields, immediate); }

    public void http(Object message) { log(Severity.HTTP, message, null, null); }
    public void http(Object message, Map<String, ?> fields) { log(Severity.HTTP, message, fields, null); }
    public void http(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.HTTP, message, fields, immediate); }

    public void timing(Object message) { log(Severity.TIMING, message, null, null); }
    public void timing(Object message, Map<String, ?> fields) { log(Severity.TIMING, message, fields, null); }
    public void timing(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.TIMING, message, fields, immediate); }

    public void redirect(Object message) { log(Severity.REDIRECT, message, null, null); }
    public void redirect(Object message, Map<String, ?> fields) { log(Severity.REDIRECT, message, fields, null); }
    public void redirect(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.REDIRECT, message, fields, immediate); }

    public void warn(Object message) { log(Severity.WARN, message, null, null); }
    public void warn(Object message, Map<String, ?> fields) { log(Severity.WARN, message, fields, null); }
    public void warn(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.WARN, message, fields, immediate); }

    public void warning(Object message) { log(Severity.WARNING, message, null, null); }
    public void warning(Object message, Map<String, ?> fields) { log(Severity.WARNING, message, fields, null); }
    public void warning(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.WARNING, message, fields, immediate); }

    public void error(Object message) { log(Severity.ERROR, message, null, null); }
    public void error(Object message, Map<String, ?> fields) { log(Severity.ERROR, message, fields, null); }
    public void error(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.ERROR, message, fields, immediate); }

    public void crit(Object message) { log(Severity.CRIT, message, null, null); }
    public void crit(Object message, Map<String, ?> fields) { log(Severity.CRIT, message, fields, null); }
    public void crit(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.CRIT, message, fields, immediate); }

    public void critical(Object message) { log(Severity.CRITICAL, message, null, null); }
    public void critical(Object message, Map<String, ?> fields) { log(Severity.CRITICAL, message, fields, null); }
    public void critical(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.CRITICAL, message, fields, immediate); }

    public void fatal(Object message) { log(Severity.FATAL, message, null, null); }
    public void fatal(Object message, Map<String, ?> fields) { log(Severity.FATAL, message, fields, null); }
    public void fatal(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.FATAL, message, fields, immediate); }

    public void alert(Object message) { log(Severity.ALERT, message, null, null); }
    public void alert(Object message, Map<String, ?> fields) { log(Severity.ALERT, message, fields, null); }
    public void alert(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.ALERT, message, fields, immediate); }

    public void emerg(Object message) { log(Severity.EMERG, message, null, null); }
    public void emerg(Object message, Map<String, ?> fields) { log(Severity.EMERG, message, fields, null); }
    public void emerg(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.EMERG, message, fields, immediate); }

    public void emergency(Object message) { log(Severity.EMERGENCY, message, null, null); }
    public void emergency(Object message, Map<String, ?> fields) { log(Severity.EMERGENCY, message, fields, null); }
    public void emergency(Object message, Map<String, ?> fields, boolean immediate) { log(Severity.EMERGENCY, message, fields, immediate); }

    // ========================================================================
    // Timers
    // ========================================================================

    public void time() {
        time(DEFAULT_TIMER, null);
    }

    public void time(String label) {
        time(label, null);
    }

    /**
     * Start (or restart) the timer {@code label}. {@code fields} are attached to
     * every timing event the timer produces.
     */
    public void time(String label, Map<String, ?> fields) {
        timers.start(label != null ? label : DEFAULT_TIMER, fields);
    }

    public void timeLog() {
        timeLog(DEFAULT_TIMER, null);
    }

    public void timeLog(String label) {
        timeLog(label, null);
    }

    /**
     * Log the seconds elapsed on {@code label} as a {@code timing} event without
     * stopping the timer. A missing timer produces a warning event instead.
     */
    public void timeLog(String label, Map<String, ?> fields) {
        String name = label != null ? label : DEFAULT_TIMER;
        TimerRegistry.Timer timer = timers.get(name).orElse(null);
        if (timer == null) {
            warn("Timer '" + name + "' does not exist");
            return;
        }

        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put(LogEvent.LEVEL, Severity.TIMING.getLabel());
        timing.put(LogEvent.VALUE, timers.elapsedSeconds(timer));
        timing.putAll(timer.getFields());
        if (fields != null) {
            timing.putAll(fields);
        }
        log(LogInput.text(name), LogFields.map(timing), null);
    }

    public void timeEnd() {
        timeEnd(DEFAULT_TIMER, null);
    }

    public void timeEnd(String label) {
        timeEnd(label, null);
    }

    /**
     * {@link #timeLog(String, Map)} then remove the timer.
     */
    public void timeEnd(String label, Map<String, ?> fields) {
        String name = label != null ? label : DEFAULT_TIMER;
        timeLog(name, fields);
        timers.remove(name);
    }

    public boolean hasTimer(String label) {
        return timers.contains(label);
    }

    // ========================================================================
    // Context derivation
    // ========================================================================

    /**
     * A logger tagging every event with {@code module}.
     */
    public Loggy module(Object value) {
        return withField("module", value);
    }

    /**
     * A logger tagging every event with {@code user}.
     */
    public Loggy user(Object value) {
        return withField("user", value);
    }

    /**
     * A new logger whose defaults are this logger's plus {@code {name: value}}.
     *
     * <p>The child shares app, remote, sender and scheduler and starts from this
     * logger's current configuration, but owns its own buffer and timers.
     * This logger's defaults are not modified.</p>
     */
    public Loggy withField(String name, Object value) {
        Map<String, Object> defaults = new LinkedHashMap<>(normalizer.getDefaults());
        defaults.put(name, value);
        return new Loggy(shared, false, defaults, exitOnFatal, printToConsole,
                flushScheduler.getThrottleInterval(), flushScheduler.getThrottleLimit());
    }

    // ========================================================================
    // Global events
    // ========================================================================

    public void handleGlobalEvents() {
        handleGlobalEvents(GlobalEventOptions.defaults());
    }

    /**
     * Forward process-level events into this logger. Only the first call
     * registers handlers.
     */
    public void handleGlobalEvents(GlobalEventOptions options) {
        if (!globalEventsRegistered.compareAndSet(false, true)) {
            log.debug("Global event handlers already registered for app {}", shared.app);
            return;
        }
        GlobalEventBridge.register(this, shared.globalEventSource, options);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Send everything buffered now.
     */
    public void flush() {
        flushScheduler.flush();
    }

    /**
     * Flush, and stop the flush scheduler if this logger created it. Loggers
     * derived from this one should not be used afterwards.
     */
    @Override
    public void close() {
        flush();
        if (root && shared.ownsScheduler) {
            shared.scheduler.shutdown();
            try {
                if (!shared.scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                    shared.scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shared.scheduler.shutdownNow();
            }
        }
    }

    public Metrics getMetrics() {
        return new Metrics(
                eventsLogged.get(),
                flushScheduler.getEventsFlushed(),
                flushScheduler.getBatchesFlushed(),
                shared.deliveryFailures.get(),
                flushScheduler.getBufferDepth());
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    public String getApp() {
        return shared.app;
    }

    public String getRemote() {
        return shared.remote;
    }

    public Map<String, Object> getDefaults() {
        return normalizer.getDefaults();
    }

    public boolean isExitOnFatal() {
        return exitOnFatal;
    }

    public void setExitOnFatal(boolean exitOnFatal) {
        this.exitOnFatal = exitOnFatal;
    }

    public boolean isPrintToConsole() {
        return printToConsole;
    }

    public void setPrintToConsole(boolean printToConsole) {
        this.printToConsole = printToConsole;
    }

    public long getThrottleInterval() {
        return flushScheduler.getThrottleInterval();
    }

    /**
     * Delay in milliseconds before buffered events are flushed. Zero or less
     * disables buffering.
     */
    public void setThrottleInterval(long throttleIntervalMs) {
        flushScheduler.setThrottleInterval(throttleIntervalMs);
    }

    public int getThrottleLimit() {
        return flushScheduler.getThrottleLimit();
    }

    public void setThrottleLimit(int throttleLimit) {
        requireThrottleLimit(throttleLimit);
        flushScheduler.setThrottleLimit(throttleLimit);
    }

    private static void requireThrottleLimit(int throttleLimit) {
        if (throttleLimit < 1) {
            throw new IllegalArgumentException("throttleLimit must be >= 1, got: " + throttleLimit);
        }
    }

    // ========================================================================
    // Supporting Classes
    // ========================================================================

    /**
     * Collaborators shared by a logger and everything derived from it.
     */
    private static final class Shared {
        final String app;
        final String remote;
        final LogSender sender;
        final ConsoleSink consoleSink;
        final ScheduledExecutorService scheduler;
        final boolean ownsScheduler;
        final ProcessTerminator terminator;
        final GlobalEventSource globalEventSource;
        final Clock clock;
        final LongSupplier ticker;
        final AtomicLong deliveryFailures;

        Shared(String app, String remote, LogSender sender, ConsoleSink consoleSink,
               ScheduledExecutorService scheduler, boolean ownsScheduler, ProcessTerminator terminator,
               GlobalEventSource globalEventSource, Clock clock, LongSupplier ticker, AtomicLong deliveryFailures) {
            this.app = app;
            this.remote = remote;
            this.sender = sender;
            this.consoleSink = consoleSink;
            this.scheduler = scheduler;
            this.ownsScheduler = ownsScheduler;
            this.terminator = terminator;
            this.globalEventSource = globalEventSource;
            this.clock = clock;
            this.ticker = ticker;
            this.deliveryFailures = deliveryFailures;
        }
    }

    /**
     * Metrics snapshot
     */
    public static class Metrics {
        public final long eventsLogged;
        public final long eventsFlushed;
        public final long batchesFlushed;
        public final long deliveryFailures;
        public final int bufferDepth;

        Metrics(long eventsLogged, long eventsFlushed, long batchesFlushed, long deliveryFailures, int bufferDepth) {
            this.eventsLogged = eventsLogged;
            this.eventsFlushed = eventsFlushed;
            this.batchesFlushed = batchesFlushed;
            this.deliveryFailures = deliveryFailures;
            this.bufferDepth = bufferDepth;
        }

        @Override
        public String toString() {
            return String.format("Metrics{logged=%d, flushed=%d, batches=%d, failures=%d, depth=%d}",
                    eventsLogged, eventsFlushed, batchesFlushed, deliveryFailures, bufferDepth);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String app;
        private String remote = DEFAULT_REMOTE;
        private Map<String, ?> defaults = Collections.emptyMap();
        private boolean exitOnFatal = true;
        private boolean printToConsole = true;
        private long throttleIntervalMs = DEFAULT_THROTTLE_INTERVAL_MS;
        private int throttleLimit = DEFAULT_THROTTLE_LIMIT;
        private LogTransport transport;
        private LogSender sender;
        private HttpClient httpClient;
        private ConsoleSink consoleSink;
        private ScheduledExecutorService scheduler;
        private ProcessTerminator processTerminator;
        private GlobalEventSource globalEventSource;
        private Clock clock = Clock.systemUTC();
        private LongSupplier ticker = System::nanoTime;
        private ObjectMapper objectMapper;
        private DeliveryFailureCallback deliveryFailureCallback;
        private int maxRetries = 0;
        private Duration retryDelay = Duration.ofMillis(500);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        /**
         * Application identifier, used in the collector path (required)
         */
        public Builder app(String app) {
            this.app = app;
            return this;
        }

        /**
         * Collector base URL (default: http://127.0.0.1:1065/)
         */
        public Builder remote(String remote) {
            this.remote = remote;
            return this;
        }

        /**
         * Fields merged into every event, below everything else
         */
        public Builder defaults(Map<String, ?> defaults) {
            this.defaults = defaults != null ? defaults : Collections.emptyMap();
            return this;
        }

        /**
         * Terminate the process after a fatal-class event (default: true)
         */
        public Builder exitOnFatal(boolean exitOnFatal) {
            this.exitOnFatal = exitOnFatal;
            return this;
        }

        /**
         * Echo every event to the console sink (default: true)
         */
        public Builder printToConsole(boolean printToConsole) {
            this.printToConsole = printToConsole;
            return this;
        }

        /**
         * Flush delay in milliseconds; zero or less disables buffering (default: 100)
         */
        public Builder throttleInterval(long throttleIntervalMs) {
            this.throttleIntervalMs = throttleIntervalMs;
            return this;
        }

        public Builder throttleInterval(Duration throttleInterval) {
            return throttleInterval(throttleInterval.toMillis());
        }

        /**
         * Buffered events that force a flush (default: 1000)
         */
        public Builder throttleLimit(int throttleLimit) {
            this.throttleLimit = throttleLimit;
            return this;
        }

        /**
         * Provide a custom transport (default: JDK HttpClient)
         */
        public Builder transport(LogTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Replace the whole send path (overrides transport and retry settings)
         */
        public Builder sender(LogSender sender) {
            this.sender = sender;
            return this;
        }

        /**
         * Provide a pre-configured HttpClient for the default transport
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Where events are echoed when printToConsole is on (default: JSON lines on stdout)
         */
        public Builder consoleSink(ConsoleSink consoleSink) {
            this.consoleSink = consoleSink;
            return this;
        }

        /**
         * Scheduler for delayed flushes. A caller-provided scheduler is not shut down by {@link #close()}.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * How the process is terminated after a fatal event (default: {@link JvmProcessHooks})
         */
        public Builder processTerminator(ProcessTerminator processTerminator) {
            this.processTerminator = processTerminator;
            return this;
        }

        /**
         * Source of process-level events for handleGlobalEvents (default: {@link JvmProcessHooks})
         */
        public Builder globalEventSource(GlobalEventSource globalEventSource) {
            this.globalEventSource = globalEventSource;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Monotonic nanosecond source for timers (default: System.nanoTime)
         */
        public Builder ticker(LongSupplier ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Provide a pre-configured ObjectMapper (recommended for Spring Boot integration)
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Called when a send fails. Defaults to an SLF4J debug line.
         */
        public Builder onDeliveryFailure(DeliveryFailureCallback callback) {
            this.deliveryFailureCallback = callback;
            return this;
        }

        /**
         * Retries per failed send (default: 0, no retry)
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Delay before the first retry; attempt n waits n times this (default: 500ms)
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Loggy build() {
            if (app == null || app.isBlank()) {
                throw new IllegalStateException("app is required");
            }
            if (remote == null || remote.isBlank()) {
                throw new IllegalStateException("remote is required");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            requireThrottleLimit(throttleLimit);

            ObjectMapper mapper = objectMapper != null
                    ? objectMapper
                    : new ObjectMapper()
                        .registerModule(new JavaTimeModule())
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

            AtomicLong deliveryFailures = new AtomicLong(0);
            DeliveryFailureCallback userCallback = deliveryFailureCallback != null
                    ? deliveryFailureCallback
                    : DEFAULT_FAILURE_CALLBACK;
            DeliveryFailureCallback countingCallback = (events, cause) -> {
                deliveryFailures.incrementAndGet();
                userCallback.onDeliveryFailure(events, cause);
            };

            LogSender resolvedSender = sender;
            if (resolvedSender == null) {
                LogTransport resolvedTransport = transport;
                if (resolvedTransport == null) {
                    HttpClient client = httpClient != null
                            ? httpClient
                            : HttpClient.newBuilder().connectTimeout(connectTimeout).build();
                    resolvedTransport = new JdkHttpTransport(client);
                }
                resolvedSender = new HttpLogSender(HttpLogSender.endpointFor(remote, app), resolvedTransport,
                        mapper, countingCallback, maxRetries, retryDelay, requestTimeout);
            }

            boolean ownsScheduler = scheduler == null;
            ScheduledExecutorService resolvedScheduler = ownsScheduler ? newFlushScheduler() : scheduler;

            Shared shared = new Shared(
                    app,
                    remote,
                    resolvedSender,
                    consoleSink != null ? consoleSink : new JsonConsoleSink(System.out, mapper),
                    resolvedScheduler,
                    ownsScheduler,
                    processTerminator != null ? processTerminator : JvmProcessHooks.getInstance(),
                    globalEventSource != null ? globalEventSource : JvmProcessHooks.getInstance(),
                    clock,
                    ticker,
                    deliveryFailures);

            log.debug("Loggy created - app: {}, remote: {}, throttle: {}ms/{} events",
                    app, remote, throttleIntervalMs, throttleLimit);
            return new Loggy(shared, true, defaults, exitOnFatal, printToConsole, throttleIntervalMs, throttleLimit);
        }

        private static ScheduledExecutorService newFlushScheduler() {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, "loggy-flush");
                t.setDaemon(true);
                return t;
            });
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }
}
