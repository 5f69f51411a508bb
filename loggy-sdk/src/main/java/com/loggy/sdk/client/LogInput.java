package com.loggy.sdk.client;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The message slot of a log call.
 *
 * <p>Each instance carries an explicit {@link Kind}; the normalizer dispatches on
 * it in the order error, batch, object, text. Use the factory methods to build
 * a specific variant, or {@link #of(Object)} to classify a plain value.</p>
 */
public final class LogInput {

    public enum Kind {
        /** An error-like value with a name, a message and a stack trace. */
        ERROR,
        /** A sequence of messages, each logged independently. */
        BATCH,
        /** A field map merged over everything else. */
        OBJECT,
        /** A scalar, logged as {@code {message: value}}. */
        TEXT
    }

    private final Kind kind;
    private final Object text;
    private final Map<String, Object> object;
    private final ErrorDetails error;
    private final List<LogInput> batch;

    private LogInput(Kind kind, Object text, Map<String, Object> object, ErrorDetails error, List<LogInput> batch) {
        this.kind = kind;
        this.text = text;
        this.object = object;
        this.error = error;
        this.batch = batch;
    }

    public static LogInput text(Object message) {
        return new LogInput(Kind.TEXT, message, null, null, null);
    }

    public static LogInput object(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        return new LogInput(Kind.OBJECT, null, Collections.unmodifiableMap(copy), null, null);
    }

    public static LogInput error(Throwable error) {
        return new LogInput(Kind.ERROR, null, null, ErrorDetails.from(error), null);
    }

    public static LogInput error(String name, String message, String stack) {
        return new LogInput(Kind.ERROR, null, null, new ErrorDetails(name, message, stack), null);
    }

    public static LogInput batch(Collection<?> messages) {
        List<LogInput> elements = new ArrayList<>(messages.size());
        for (Object message : messages) {
            elements.add(of(message));
        }
        return new LogInput(Kind.BATCH, null, null, null, Collections.unmodifiableList(elements));
    }

    /**
     * Classify a plain value: throwables are errors, maps are objects,
     * collections are batches and anything else is text.
     */
    public static LogInput of(Object message) {
        if (message instanceof LogInput) {
            return (LogInput) message;
        }
        if (message instanceof Throwable) {
            return error((Throwable) message);
        }
        if (message instanceof Map) {
            return object(stringKeys((Map<?, ?>) message));
        }
        if (message instanceof Collection) {
            return batch((Collection<?>) message);
        }
        return text(message);
    }

    public Kind getKind() {
        return kind;
    }

    public Object asText() {
        requireKind(Kind.TEXT);
        return text;
    }

    public Map<String, Object> asObject() {
        requireKind(Kind.OBJECT);
        return object;
    }

    public ErrorDetails asError() {
        requireKind(Kind.ERROR);
        return error;
    }

    public List<LogInput> asBatch() {
        requireKind(Kind.BATCH);
        return batch;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("LogInput is " + kind + ", not " + expected);
        }
    }

    static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, val) -> copy.put(String.valueOf(key), val));
        return copy;
    }

    @Override
    public String toString() {
        switch (kind) {
            case OBJECT:
                return "LogInput{" + kind + ": " + object + "}";
            case ERROR:
                return "LogInput{" + kind + ": " + error + "}";
            case BATCH:
                return "LogInput{" + kind + ": " + batch + "}";
            default:
                return "LogInput{" + kind + ": " + text + "}";
        }
    }

    /**
     * Name, message and stack trace of an error-like value.
     */
    public static final class ErrorDetails {
        private final String name;
        private final String message;
        private final String stack;

        public ErrorDetails(String name, String message, String stack) {
            this.name = name;
            this.message = message;
            this.stack = stack;
        }

        static ErrorDetails from(Throwable error) {
            StringWriter stack = new StringWriter();
            error.printStackTrace(new PrintWriter(stack));
            return new ErrorDetails(error.getClass().getSimpleName(), error.getMessage(), stack.toString());
        }

        public String getName() {
            return name;
        }

        public String getMessage() {
            return message;
        }

        public String getStack() {
            return stack;
        }

        @Override
        public String toString() {
            return name + ": " + message;
        }
    }
}
