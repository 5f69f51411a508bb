package com.loggy.sdk.client;

import com.loggy.sdk.model.LogEvent;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the arguments of a log call into canonical events.
 *
 * <p>Fields are layered lowest to highest priority: instance defaults,
 * {@code ts}, the fields argument, the message argument. Malformed input is
 * dropped from the merge rather than rejected.</p>
 */
public class EventNormalizer {

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Map<String, Object> defaults;
    private final Clock clock;

    public EventNormalizer(Map<String, ?> defaults, Clock clock) {
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        this.clock = clock;
    }

    /**
     * Normalize one call.
     *
     * @param message   the message slot
     * @param fields    the fields slot, {@code null} for none
     * @param immediate the explicit immediate flag, {@code null} when not supplied
     * @return the events to dispatch, in order; a batch yields one per element
     */
    public List<NormalizedEvent> normalize(LogInput message, LogFields fields, Boolean immediate) {
        List<NormalizedEvent> out = new ArrayList<>(1);
        normalizeInto(message, fields != null ? fields : LogFields.none(), immediate, out);
        return out;
    }

    private void normalizeInto(LogInput message, LogFields fields, Boolean immediate, List<NormalizedEvent> out) {
        switch (message.getKind()) {
            case ERROR:
                normalizeInto(LogInput.object(fromError(message.asError(), fields)), LogFields.none(), immediate, out);
                return;
            case BATCH:
                for (LogInput element : message.asBatch()) {
                    normalizeInto(element, fields, immediate, out);
                }
                return;
            default:
                break;
        }

        if (fields.getKind() == LogFields.Kind.FLAG && immediate == null) {
            immediate = fields.asFlag();
            fields = message.getKind() == LogInput.Kind.OBJECT
                    ? LogFields.map(message.asObject())
                    : LogFields.none();
        }

        Map<String, Object> event = new LinkedHashMap<>(defaults);
        event.put(LogEvent.TIMESTAMP, TIMESTAMP_FORMAT.format(clock.instant()));
        if (fields.getKind() == LogFields.Kind.MAP) {
            event.putAll(fields.asMap());
        } else if (fields.getKind() == LogFields.Kind.NUMBER) {
            event.put(LogEvent.VALUE, fields.asNumber());
        }
        if (message.getKind() == LogInput.Kind.OBJECT) {
            event.putAll(message.asObject());
        } else {
            event.put(LogEvent.MESSAGE, message.asText());
        }

        out.add(new NormalizedEvent(LogEvent.of(event), Boolean.TRUE.equals(immediate)));
    }

    private static Map<String, Object> fromError(LogInput.ErrorDetails error, LogFields fields) {
        Map<String, Object> synthesized = new LinkedHashMap<>();
        synthesized.put(LogEvent.LEVEL, "error");
        synthesized.put("code", error.getName());
        synthesized.put(LogEvent.MESSAGE, error.getMessage());
        synthesized.put("details", error.getStack());
        synthesized.putAll(fields.asMap());
        return synthesized;
    }

    public Map<String, Object> getDefaults() {
        return defaults;
    }

    /**
     * A normalized event together with its resolved immediate flag.
     */
    public static final class NormalizedEvent {
        private final LogEvent event;
        private final boolean immediate;

        NormalizedEvent(LogEvent event, boolean immediate) {
            this.event = event;
            this.immediate = immediate;
        }

        public LogEvent getEvent() {
            return event;
        }

        public boolean isImmediate() {
            return immediate;
        }
    }
}
