package com.loggy.sdk.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fields slot of a log call.
 *
 * <p>A map is merged as-is, a number becomes {@code {value: n}}, a flag stands in
 * for the {@code immediate} argument when that argument is absent, and anything
 * else is dropped from the merge.</p>
 */
public final class LogFields {

    public enum Kind { NONE, MAP, NUMBER, FLAG, OTHER }

    private static final LogFields NONE = new LogFields(Kind.NONE, null, null);

    private final Kind kind;
    private final Map<String, Object> map;
    private final Object value;

    private LogFields(Kind kind, Map<String, Object> map, Object value) {
        this.kind = kind;
        this.map = map;
        this.value = value;
    }

    public static LogFields none() {
        return NONE;
    }

    public static LogFields map(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        return new LogFields(Kind.MAP, Collections.unmodifiableMap(copy), null);
    }

    public static LogFields number(Number value) {
        return new LogFields(Kind.NUMBER, null, value);
    }

    public static LogFields flag(boolean immediate) {
        return new LogFields(Kind.FLAG, null, immediate);
    }

    /**
     * Classify a plain value. {@code null} means no fields.
     */
    public static LogFields of(Object fields) {
        if (fields == null) {
            return NONE;
        }
        if (fields instanceof LogFields) {
            return (LogFields) fields;
        }
        if (fields instanceof Map) {
            return map(LogInput.stringKeys((Map<?, ?>) fields));
        }
        if (fields instanceof Number) {
            return number((Number) fields);
        }
        if (fields instanceof Boolean) {
            return flag((Boolean) fields);
        }
        return new LogFields(Kind.OTHER, null, fields);
    }

    public Kind getKind() {
        return kind;
    }

    public Map<String, Object> asMap() {
        return kind == Kind.MAP ? map : Collections.emptyMap();
    }

    public Number asNumber() {
        return kind == Kind.NUMBER ? (Number) value : null;
    }

    public boolean asFlag() {
        return kind == Kind.FLAG && (Boolean) value;
    }

    @Override
    public String toString() {
        Object shown = kind == Kind.MAP ? map : value;
        return "LogFields{" + kind + (shown != null ? ": " + shown : "") + "}";
    }
}
