package com.spanlens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Span documents of one query, partitioned by span name. {@code all} keeps the
 * unfiltered set for the fallback scan.
 */
@Value
@Builder
public class ClassifiedSpans {
    List<SpanDocument> apiCalls;
    List<SpanDocument> processes;
    List<SpanDocument> calls;
    List<SpanDocument> all;
}
