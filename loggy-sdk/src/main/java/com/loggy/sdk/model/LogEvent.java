package com.loggy.sdk.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One normalized, timestamped structured log record.
 *
 * <p>An event is a flat mapping from field name to value and serializes to a
 * single JSON object. Field order is the order in which fields were first
 * merged, so defaults come first and {@code ts} follows them.</p>
 *
 * <p>Instances are immutable; build them with
 * {@link com.loggy.sdk.client.EventNormalizer} or {@link #of(Map)}.</p>
 */
public final class LogEvent {

    public static final String TIMESTAMP = "ts";
    public static final String LEVEL = "level";
    public static final String MESSAGE = "message";
    public static final String VALUE = "value";

    private final Map<String, Object> fields;

    private LogEvent(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LogEvent of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        return new LogEvent(new LinkedHashMap<>(fields));
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    @JsonIgnore
    public Object getLevel() {
        return fields.get(LEVEL);
    }

    @JsonIgnore
    public Object getMessage() {
        return fields.get(MESSAGE);
    }

    @JsonIgnore
    public String getTimestamp() {
        Object ts = fields.get(TIMESTAMP);
        return ts != null ? ts.toString() : null;
    }

    /**
     * Whether the {@code level} field names a fatal-class severity.
     */
    @JsonIgnore
    public boolean isFatal() {
        return Severity.isFatalLevel(getLevel());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((LogEvent) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "LogEvent" + fields;
    }
}
