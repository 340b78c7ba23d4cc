package com.spanlens.service.span;

import com.spanlens.config.AnalysisProperties;
import com.spanlens.model.ClassifiedSpans;
import com.spanlens.model.SpanDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups span documents by role and pulls the generic attribute namespace
 * and error indicators out of each document.
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpanClassifier {

    private static final String ERROR_ATTRIBUTE_PREFIX = SpanDocument.ATTRIBUTES_PREFIX + "error";
    private static final String ERROR_TYPE_SUFFIX = "error.type";

    // Status values that do not mark a span as failed
    private static final Set<String> OK_STATUSES = Set.of(
            "", "0", "unset", "ok", "status_code_unset", "status_code_ok"
    );

    private final AnalysisProperties properties;

    public ClassifiedSpans classify(List<SpanDocument> documents) {
        AnalysisProperties.SpanNames names = properties.getSpanNames();

        List<SpanDocument> apiCalls = new ArrayList<>();
        List<SpanDocument> processes = new ArrayList<>();
        List<SpanDocument> calls = new ArrayList<>();

        for (SpanDocument document : documents) {
            String spanName = document.getName();
            if (spanName.equals(names.getApiCall())) {
                apiCalls.add(document);
            } else if (spanName.equals(names.getProcess())) {
                processes.add(document);
            } else if (spanName.startsWith(names.getCallPrefix())) {
                calls.add(document);
            }
        }

        log.info("Found {} {} spans, {} {} spans and {} {}* spans",
                apiCalls.size(), names.getApiCall(),
                processes.size(), names.getProcess(),
                calls.size(), names.getCallPrefix());

        return ClassifiedSpans.builder()
                .apiCalls(apiCalls)
                .processes(processes)
                .calls(calls)
                .all(List.copyOf(documents))
                .build();
    }

    /**
     * Every {@code Attributes.*} field under its un-prefixed name, skipping names
     * the observation already defines explicitly.
     */
    public Map<String, Object> flattenAttributes(SpanDocument document, Set<String> reservedNames) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : document.getFields().entrySet()) {
            String key = field.getKey();
            if (!key.startsWith(SpanDocument.ATTRIBUTES_PREFIX)) {
                continue;
            }
            String name = key.substring(SpanDocument.ATTRIBUTES_PREFIX.length());
            if (name.isEmpty() || reservedNames.contains(name)) {
                continue;
            }
            attributes.putIfAbsent(name, field.getValue());
        }
        return attributes;
    }

    public boolean isError(SpanDocument document) {
        for (Map.Entry<String, Object> field : document.getFields().entrySet()) {
            if (field.getKey().startsWith(ERROR_ATTRIBUTE_PREFIX) && isTruthy(field.getValue())) {
                return true;
            }
        }
        return document.get(SpanDocument.STATUS_FIELD)
                .map(this::isFailedStatus)
                .orElse(false);
    }

    public String errorType(SpanDocument document) {
        for (Map.Entry<String, Object> field : document.getFields().entrySet()) {
            String key = field.getKey();
            if (key.startsWith(SpanDocument.ATTRIBUTES_PREFIX) && key.endsWith(ERROR_TYPE_SUFFIX)
                    && field.getValue() != null) {
                return field.getValue().toString();
            }
        }
        return null;
    }

    private boolean isFailedStatus(Object status) {
        if (status instanceof Number) {
            return ((Number) status).doubleValue() != 0;
        }
        return !OK_STATUSES.contains(status.toString().trim().toLowerCase(Locale.ROOT));
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            return !text.isEmpty() && !"false".equalsIgnoreCase(text) && !"0".equals(text);
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        return true;
    }
}
