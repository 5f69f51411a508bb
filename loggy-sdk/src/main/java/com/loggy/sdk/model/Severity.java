package com.loggy.sdk.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Recognized severity labels, in ascending order.
 *
 * <p>The table is only used for membership tests. Events may carry any
 * {@code level} value, recognized or not.</p>
 */
public enum Severity {
    TRACE("trace"),
    VERBOSE("verbose"),
    SILLY("silly"),
    DEBUG("debug"),
    INFO("info"),
    NOTICE("notice"),
    SUCCESS("success"),
    HTTP("http"),
    TIMING("timing"),
    REDIRECT("redirect"),
    WARN("warn"),
    WARNING("warning"),
    ERROR("error"),
    CRIT("crit"),
    CRITICAL("critical"),
    FATAL("fatal"),
    ALERT("alert"),
    EMERG("emerg"),
    EMERGENCY("emergency");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Whether this severity terminates the process when exit-on-fatal is enabled.
     */
    public boolean isFatal() {
        return this == FATAL || this == EMERG || this == EMERGENCY;
    }

    /**
     * Case-sensitive fatal-class test on a raw {@code level} value.
     *
     * @param level the level field of an event, may be null or a non-string
     */
    public static boolean isFatalLevel(Object level) {
        if (!(level instanceof String)) {
            return false;
        }
        return fromLabel((String) level).map(Severity::isFatal).orElse(false);
    }

    /**
     * Resolve a label (case-sensitive).
     */
    public static Optional<Severity> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (Severity severity : values()) {
            if (severity.label.equals(label)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
