package org.wikimedia.eventbus.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.EqualsAndHashCode;

/**
 * An event as sent to the event intake service.
 *
 * Events are ordered field maps holding JSON compatible values (strings,
 * numbers, booleans, nulls, nested maps and lists). Every event built by
 * {@link EventFactory} carries a {@code $schema} and a {@code meta} block.
 * Instances are immutable: nested maps and lists are copied into
 * unmodifiable ones on construction, {@link #withSignature(String)} returns a
 * copy. Byte arrays are kept as given.
 */
@EqualsAndHashCode
public final class Event {
    public static final String SCHEMA_FIELD = "$schema";
    public static final String META_FIELD = "meta";
    public static final String SIGNATURE_FIELD = "mediawiki_signature";

    private final Map<String, Object> fields;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Event(Map<String, Object> fields) {
        this.fields = immutableCopy(fields);
    }

    @JsonValue
    public Map<String, Object> fields() {
        return fields;
    }

    @Nullable
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    @Nullable
    public String schema() {
        return (String) fields.get(SCHEMA_FIELD);
    }

    /**
     * The meta block, empty if this event has none.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> meta() {
        Object meta = fields.get(META_FIELD);
        if (meta instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) meta);
        }
        return Collections.emptyMap();
    }

    @Nullable
    public String id() {
        return (String) meta().get("id");
    }

    @Nullable
    public String stream() {
        return (String) meta().get("stream");
    }

    @Nullable
    public String signature() {
        return (String) fields.get(SIGNATURE_FIELD);
    }

    public Event withSignature(String signature) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(SIGNATURE_FIELD, signature);
        return new Event(copy);
    }

    public Event without(String field) {
        if (!fields.containsKey(field)) return this;
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.remove(field);
        return new Event(copy);
    }

    private static Map<String, Object> immutableCopy(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), immutableValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map) return immutableCopy((Map<?, ?>) value);
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object v : (List<?>) value) {
                copy.add(immutableValue(v));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public String toString() {
        return "Event" + fields;
    }
}
