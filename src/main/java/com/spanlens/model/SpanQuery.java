package com.spanlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SpanQuery {

    public static final List<String> DEFAULT_FIELDS = List.of(
            SpanDocument.START_FIELD,
            SpanDocument.END_FIELD,
            SpanDocument.NAME_FIELD,
            "Attributes.*",
            "Resource.*",
            SpanDocument.KIND_FIELD,
            SpanDocument.TRACE_ID_FIELD,
            SpanDocument.SPAN_ID_FIELD,
            SpanDocument.PARENT_SPAN_ID_FIELD,
            SpanDocument.STATUS_FIELD
    );

    String indexName;
    int hours;          // lookback, range starts at now - hours
    int maxDocs;
    @Builder.Default
    List<String> fields = DEFAULT_FIELDS;
}
