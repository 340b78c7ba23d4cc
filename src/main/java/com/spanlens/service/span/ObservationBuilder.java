package com.spanlens.service.span;

import com.spanlens.exception.TimestampParseException;
import com.spanlens.model.BuildResult;
import com.spanlens.model.BuildSummary;
import com.spanlens.model.ClassifiedSpans;
import com.spanlens.model.Observation;
import com.spanlens.model.ObservationTable;
import com.spanlens.model.SpanDocument;
import com.spanlens.service.timestamp.TimestampNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns classified span documents into the observation table.
 * Canonical api-call spans are used first; when none of them yields a usable
 * latency, every document with both a start and an end timestamp is used instead.
 * Bad records are counted in the {@link BuildSummary} and skipped.
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationBuilder {

    public static final String UNKNOWN_SERVICE = "unknown";

    // Column names an attribute may never overwrite
    private static final Set<String> RESERVED_NAMES = Set.of(
            "timestamp", "latency", "trace_id", "span_id", "parent_span_id", "span_name",
            "error", "error_type", "service",
            "latency_anomaly", "window_error_rate", "error_rate_anomaly"
    );

    private final SpanClassifier classifier;
    private final TimestampNormalizer normalizer;

    public BuildResult build(List<SpanDocument> documents) {
        ClassifiedSpans classified = classifier.classify(documents);
        BuildSummary summary = BuildSummary.builder()
                .documentCount(documents.size())
                .apiCallCount(classified.getApiCalls().size())
                .processCount(classified.getProcesses().size())
                .callCount(classified.getCalls().size())
                .build();

        List<Observation> observations = extract(classified.getApiCalls(), summary);

        if (observations.isEmpty()) {
            log.info("No api_call spans with latency found. Trying to extract duration from all spans...");
            summary.setFallbackUsed(true);
            // Counters describe the pass that produced the table
            summary.setMissingEndCount(0);
            summary.setUnparseableCount(0);
            summary.setNegativeLatencyCount(0);
            observations = extract(classified.getAll(), summary);
        }

        summary.setAdmittedCount(observations.size());
        if (summary.getSkippedCount() > 0) {
            log.warn("Skipped {} spans: {} without end timestamp, {} with unparseable timestamps, {} ending before they start",
                    summary.getSkippedCount(), summary.getMissingEndCount(),
                    summary.getUnparseableCount(), summary.getNegativeLatencyCount());
        }
        log.info("Processed {} data points with latency information", observations.size());

        return new BuildResult(new ObservationTable(observations), summary);
    }

    private List<Observation> extract(List<SpanDocument> documents, BuildSummary summary) {
        List<Observation> observations = new ArrayList<>();
        for (SpanDocument document : documents) {
            toObservation(document, summary).ifPresent(observations::add);
        }
        return observations;
    }

    Optional<Observation> toObservation(SpanDocument document, BuildSummary summary) {
        if (!document.has(SpanDocument.END_FIELD)) {
            summary.setMissingEndCount(summary.getMissingEndCount() + 1);
            log.debug("Span {} has no end timestamp", document.getString(SpanDocument.SPAN_ID_FIELD, "?"));
            return Optional.empty();
        }

        Instant start;
        Instant end;
        try {
            start = normalizer.parse(document.getString(SpanDocument.START_FIELD, ""));
            end = normalizer.parse(document.getString(SpanDocument.END_FIELD, ""));
        } catch (TimestampParseException e) {
            summary.setUnparseableCount(summary.getUnparseableCount() + 1);
            log.debug("Error processing span: {}", e.getMessage());
            return Optional.empty();
        }

        if (end.isBefore(start)) {
            summary.setNegativeLatencyCount(summary.getNegativeLatencyCount() + 1);
            log.debug("Span {} ends before it starts ({} < {})",
                    document.getString(SpanDocument.SPAN_ID_FIELD, "?"), end, start);
            return Optional.empty();
        }

        Duration duration = Duration.between(start, end);
        double latency = duration.getSeconds() + duration.getNano() / 1_000_000_000.0;

        return Optional.of(Observation.builder()
                .timestamp(start)
                .latency(latency)
                .traceId(document.getString(SpanDocument.TRACE_ID_FIELD, ""))
                .spanId(document.getString(SpanDocument.SPAN_ID_FIELD, ""))
                .parentSpanId(document.getString(SpanDocument.PARENT_SPAN_ID_FIELD, ""))
                .spanName(document.getString(SpanDocument.NAME_FIELD, "unknown"))
                .error(classifier.isError(document))
                .errorType(classifier.errorType(document))
                .service(document.getString(SpanDocument.SERVICE_FIELD, UNKNOWN_SERVICE))
                .extraAttributes(classifier.flattenAttributes(document, RESERVED_NAMES))
                .build());
    }
}
