package com.loggy.sdk.bridge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which global event sources to forward, and the extra fields merged into each.
 *
 * <pre>{@code
 * loggy.handleGlobalEvents(GlobalEventOptions.builder()
 *     .warnings(false)
 *     .exceptions(Map.of("component", "worker"))
 *     .build());
 * }</pre>
 */
public final class GlobalEventOptions {

    private final Toggle exceptions;
    private final Toggle rejections;
    private final Toggle warnings;
    private final Toggle exits;

    private GlobalEventOptions(Builder builder) {
        this.exceptions = builder.exceptions;
        this.rejections = builder.rejections;
        this.warnings = builder.warnings;
        this.exits = builder.exits;
    }

    /**
     * All four sources enabled with no extra fields.
     */
    public static GlobalEventOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Toggle getExceptions() {
        return exceptions;
    }

    public Toggle getRejections() {
        return rejections;
    }

    public Toggle getWarnings() {
        return warnings;
    }

    public Toggle getExits() {
        return exits;
    }

    /**
     * One source: off, on, or on with extra fields.
     */
    public static final class Toggle {
        public static final Toggle DISABLED = new Toggle(false, Collections.emptyMap());
        public static final Toggle ENABLED = new Toggle(true, Collections.emptyMap());

        private final boolean enabled;
        private final Map<String, Object> extraFields;

        private Toggle(boolean enabled, Map<String, Object> extraFields) {
            this.enabled = enabled;
            this.extraFields = extraFields;
        }

        public static Toggle of(boolean enabled) {
            return enabled ? ENABLED : DISABLED;
        }

        public static Toggle withFields(Map<String, ?> extraFields) {
            return new Toggle(true, Collections.unmodifiableMap(new LinkedHashMap<>(extraFields)));
        }

        public boolean isEnabled() {
            return enabled;
        }

        public Map<String, Object> getExtraFields() {
            return extraFields;
        }
    }

    public static class Builder {
        private Toggle exceptions = Toggle.ENABLED;
        private Toggle rejections = Toggle.ENABLED;
        private Toggle warnings = Toggle.ENABLED;
        private Toggle exits = Toggle.ENABLED;

        public Builder exceptions(boolean enabled) {
            this.exceptions = Toggle.of(enabled);
            return this;
        }

        public Builder exceptions(Map<String, ?> extraFields) {
            this.exceptions = Toggle.withFields(extraFields);
            return this;
        }

        public Builder rejections(boolean enabled) {
            this.rejections = Toggle.of(enabled);
            return this;
        }

        public Builder rejections(Map<String, ?> extraFields) {
            this.rejections = Toggle.withFields(extraFields);
            return this;
        }

        public Builder warnings(boolean enabled) {
            this.warnings = Toggle.of(enabled);
            return this;
        }

        public Builder warnings(Map<String, ?> extraFields) {
            this.warnings = Toggle.withFields(extraFields);
            return this;
        }

        public Builder exits(boolean enabled) {
            this.exits = Toggle.of(enabled);
            return this;
        }

        public Builder exits(Map<String, ?> extraFields) {
            this.exits = Toggle.withFields(extraFields);
            return this;
        }

        public GlobalEventOptions build() {
            return new GlobalEventOptions(this);
        }
    }
}
