package org.wikimedia.eventbus.common;

import static java.util.stream.Collectors.toList;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Turns events into the JSON bodies posted to the event intake service.
 *
 * Serialization never throws: failures are logged and reported as an empty
 * result so that the caller can skip the send.
 */
public class EventSerializer {
    /**
     * Log entries whose context would exceed this size only carry the meta
     * block of each event.
     */
    public static final int MAX_LOGGED_BODY_BYTES = 8192;

    private static final Logger LOG = LoggerFactory.getLogger(EventSerializer.class);
    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<Map<String, Object>>() { };

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public EventSerializer() {
        this(JacksonUtil.DEFAULT_OBJECT_WRITER, JacksonUtil.DEFAULT_OBJECT_READER);
    }

    public EventSerializer(ObjectWriter writer, ObjectReader reader) {
        this.writer = writer;
        this.reader = reader;
    }

    /**
     * Serialize events as a JSON array.
     */
    public Optional<byte[]> serializeEvents(List<Event> events) {
        try {
            return Optional.of(writer.writeValueAsBytes(events));
        } catch (JsonProcessingException e) {
            LOG.error("Unable to serialize events: {}. Aborting send. Events: {}",
                    e.getOriginalMessage(), metaOnly(events), e);
            return Optional.empty();
        }
    }

    /**
     * Serialize a single event as a JSON object, this is the form signatures are computed on.
     */
    public Optional<byte[]> serializeEvent(Event event) {
        try {
            return Optional.of(writer.writeValueAsBytes(event));
        } catch (JsonProcessingException e) {
            LOG.error("Unable to serialize event: {}. Event: {}",
                    e.getOriginalMessage(), metaOnly(Collections.singletonList(event)), e);
            return Optional.empty();
        }
    }

    /**
     * Report values that have no JSON scalar representation.
     *
     * Only the first offending property of each event is logged. Nothing is
     * rejected, the events are sent as they are.
     */
    public void validateJsonSerializable(List<Event> events) {
        for (Event event : events) {
            findNonScalar(null, event.fields()).ifPresent(offending ->
                LOG.error("Non-scalar value found in the event {}: property {} has type {}",
                        toLoggableString(event.meta()), offending.name, offending.type));
        }
    }

    /**
     * Describe events for a log entry, keeping only their meta blocks when
     * the serialized body is too large to be logged whole.
     */
    public String describeForLog(List<Event> events, int bodySize) {
        if (bodySize > MAX_LOGGED_BODY_BYTES) return metaOnly(events);
        return toLoggableString(events);
    }

    public Event parseEvent(byte[] body) throws IOException {
        return new Event(reader.forType(EVENT_TYPE).readValue(body));
    }

    /**
     * Parse a body holding either one JSON object or an array of them.
     */
    public List<Event> parseEvents(byte[] body) throws IOException {
        JsonNode node = reader.readTree(new ByteArrayInputStream(body));
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty body");
        }
        List<Event> events = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                events.add(new Event(reader.forType(EVENT_TYPE).readValue(item)));
            }
        } else if (node.isObject()) {
            events.add(new Event(reader.forType(EVENT_TYPE).readValue(node)));
        } else {
            throw new IOException("Expected a JSON object or array but got " + node.getNodeType());
        }
        return events;
    }

    private String metaOnly(List<Event> events) {
        return toLoggableString(events.stream().map(Event::meta).collect(toList()));
    }

    private String toLoggableString(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static Optional<NonScalar> findNonScalar(Object name, Object value) {
        if (value instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                Optional<NonScalar> found = findNonScalar(e.getKey(), e.getValue());
                if (found.isPresent()) return found;
            }
            return Optional.empty();
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                Optional<NonScalar> found = findNonScalar(i, list.get(i));
                if (found.isPresent()) return found;
            }
            return Optional.empty();
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return Optional.empty();
        }
        return Optional.of(new NonScalar(String.valueOf(name), value.getClass().getName()));
    }

    private static final class NonScalar {
        private final String name;
        private final String type;

        private NonScalar(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }
}
