package com.spanlens.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One span record as returned by the store, read-only.
 * Nested objects in the source are flattened into dotted field names
 * ({@code {"Attributes": {"error": true}}} becomes {@code Attributes.error}),
 * so exporters that nest and exporters that flatten look the same downstream.
 * @author kiransahoo
 */
@ToString
@EqualsAndHashCode
public final class SpanDocument {

    public static final String START_FIELD = "@timestamp";
    public static final String END_FIELD = "EndTimestamp";
    public static final String NAME_FIELD = "Name";
    public static final String KIND_FIELD = "Kind";
    public static final String TRACE_ID_FIELD = "TraceId";
    public static final String SPAN_ID_FIELD = "SpanId";
    public static final String PARENT_SPAN_ID_FIELD = "ParentSpanId";
    public static final String STATUS_FIELD = "TraceStatus";
    public static final String SERVICE_FIELD = "Resource.service.name";
    public static final String ATTRIBUTES_PREFIX = "Attributes.";

    private final Map<String, Object> fields;

    private SpanDocument(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static SpanDocument of(Map<String, ?> source) {
        Map<String, Object> flat = new LinkedHashMap<>();
        if (source != null) {
            flatten("", source, flat);
        }
        return new SpanDocument(flat);
    }

    private static void flatten(String prefix, Map<?, ?> source, Map<String, Object> target) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map) {
                flatten(key + ".", (Map<?, ?>) value, target);
            } else {
                // Explicit dotted keys and flattened nested keys may collide; first one wins
                target.putIfAbsent(key, value);
            }
        }
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public String getString(String field, String defaultValue) {
        Object value = fields.get(field);
        return value == null ? defaultValue : value.toString();
    }

    public String getName() {
        return getString(NAME_FIELD, "");
    }

    public Map<String, Object> getFields() {
        return fields;
    }
}
