package com.loggy.sdk.autoconfigure;

import com.loggy.sdk.client.Loggy;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "loggy")
@Validated
public class LoggyProperties {

    private static final Duration DEFAULT_THROTTLE_INTERVAL = Duration.ofMillis(Loggy.DEFAULT_THROTTLE_INTERVAL_MS);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(500);

    private final boolean enabled;
    private final String app;
    private final String remote;
    private final Map<String, String> defaults;
    private final boolean exitOnFatal;
    private final boolean printToConsole;
    private final Duration throttleInterval;
    private final int throttleLimit;
    private final String transport;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration connectTimeout;
    private final Duration requestTimeout;

    @NestedConfigurationProperty
    private final GlobalEvents globalEvents;

    @NestedConfigurationProperty
    private final Metrics metrics;

    public LoggyProperties(
            Boolean enabled,
            String app,
            String remote,
            Map<String, String> defaults,
            Boolean exitOnFatal,
            Boolean printToConsole,
            Duration throttleInterval,
            Integer throttleLimit,
            String transport,
            Integer maxRetries,
            Duration retryDelay,
            Duration connectTimeout,
            Duration requestTimeout,
            GlobalEvents globalEvents,
            Metrics metrics) {
        this.enabled = enabled != null && enabled;
        this.app = hasText(app) ? app.trim() : null;
        this.remote = hasText(remote) ? remote.trim() : Loggy.DEFAULT_REMOTE;
        this.defaults = defaults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults))
                : Collections.emptyMap();
        this.exitOnFatal = exitOnFatal == null || exitOnFatal;
        this.printToConsole = printToConsole == null || printToConsole;
        this.throttleInterval = throttleInterval != null ? throttleInterval : DEFAULT_THROTTLE_INTERVAL;
        this.throttleLimit = throttleLimit != null ? throttleLimit : Loggy.DEFAULT_THROTTLE_LIMIT;
        this.transport = normalizeTransport(transport);
        this.maxRetries = maxRetries != null ? maxRetries : 0;
        this.retryDelay = retryDelay != null ? retryDelay : DEFAULT_RETRY_DELAY;
        this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.globalEvents = globalEvents != null ? globalEvents : new GlobalEvents(null, null, null, null, null);
        this.metrics = metrics != null ? metrics : new Metrics(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApp() {
        return app;
    }

    public String getRemote() {
        return remote;
    }

    public Map<String, String> getDefaults() {
        return defaults;
    }

    public boolean isExitOnFatal() {
        return exitOnFatal;
    }

    public boolean isPrintToConsole() {
        return printToConsole;
    }

    public Duration getThrottleInterval() {
        return throttleInterval;
    }

    public int getThrottleLimit() {
        return throttleLimit;
    }

    public String getTransport() {
        return transport;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public GlobalEvents getGlobalEvents() {
        return globalEvents;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    @AssertTrue(message = "loggy.remote must be an absolute http or https URL")
    public boolean isRemoteValid() {
        if (!enabled) {
            return true;
        }
        try {
            URI uri = URI.create(remote);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @AssertTrue(message = "loggy.throttle-limit must be at least 1")
    public boolean isThrottleLimitValid() {
        return throttleLimit >= 1;
    }

    @AssertTrue(message = "loggy.max-retries must not be negative")
    public boolean isMaxRetriesValid() {
        return maxRetries >= 0;
    }

    @AssertTrue(message = "loggy.transport must be one of: jdk, restclient")
    public boolean isTransportValid() {
        if (!hasText(transport)) {
            return true;
        }
        return transport.equals("jdk") || transport.equals("restclient");
    }

    public static class GlobalEvents {
        private final boolean enabled;
        private final boolean exceptions;
        private final boolean rejections;
        private final boolean warnings;
        private final boolean exits;

        public GlobalEvents(
                Boolean enabled,
                Boolean exceptions,
                Boolean rejections,
                Boolean warnings,
                Boolean exits) {
            this.enabled = enabled != null && enabled;
            this.exceptions = exceptions == null || exceptions;
            this.rejections = rejections == null || rejections;
            this.warnings = warnings == null || warnings;
            this.exits = exits == null || exits;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public boolean isExceptions() {
            return exceptions;
        }

        public boolean isRejections() {
            return rejections;
        }

        public boolean isWarnings() {
            return warnings;
        }

        public boolean isExits() {
            return exits;
        }
    }

    public static class Metrics {
        private final boolean enabled;

        public Metrics(Boolean enabled) {
            this.enabled = enabled == null || enabled;
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalizeTransport(String transport) {
        if (!hasText(transport)) {
            return null;
        }
        return transport.trim().toLowerCase(Locale.ROOT);
    }
}
