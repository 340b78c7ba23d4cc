package com.spanlens.service.span;

import com.spanlens.SpanFixtures;
import com.spanlens.model.ClassifiedSpans;
import com.spanlens.model.SpanDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.spanlens.SpanFixtures.BASE;
import static org.assertj.core.api.Assertions.assertThat;

class SpanClassifierTest {

    private final SpanClassifier classifier = new SpanClassifier(SpanFixtures.properties());

    @Test
    void partitionsByDeclaredName() {
        List<SpanDocument> documents = List.of(
                SpanDocument.of(SpanFixtures.span("api_call", BASE, 0.1)),
                SpanDocument.of(SpanFixtures.span("process_data", BASE, 0.3)),
                SpanDocument.of(SpanFixtures.span("call_inventory", BASE, 0.05)),
                SpanDocument.of(SpanFixtures.span("call_pricing", BASE, 0.07)),
                SpanDocument.of(SpanFixtures.span("GET /health", BASE, 0.01)));

        ClassifiedSpans classified = classifier.classify(documents);

        assertThat(classified.getApiCalls()).hasSize(1);
        assertThat(classified.getProcesses()).hasSize(1);
        assertThat(classified.getCalls()).hasSize(2);
        assertThat(classified.getAll()).hasSize(5);
    }

    @Test
    void flattensAttributesWithoutOverwritingExplicitNames() {
        SpanDocument document = SpanDocument.of(Map.of(
                "Attributes.http.method", "POST",
                "Attributes.service", "shadowed",
                "Attributes", Map.of("user", Map.of("tier", "gold"))));

        Map<String, Object> attributes = classifier.flattenAttributes(document, Set.of("service"));

        assertThat(attributes)
                .containsEntry("http.method", "POST")
                .containsEntry("user.tier", "gold")
                .doesNotContainKey("service");
    }

    @Test
    void truthyErrorAttributeMarksError() {
        assertThat(classifier.isError(SpanDocument.of(Map.of("Attributes.error", true)))).isTrue();
        assertThat(classifier.isError(SpanDocument.of(Map.of("Attributes.error", "true")))).isTrue();
        assertThat(classifier.isError(SpanDocument.of(Map.of("Attributes.error.type", "TimeoutError")))).isTrue();
    }

    @Test
    void falsyErrorAttributeDoesNotMarkError() {
        assertThat(classifier.isError(SpanDocument.of(Map.of("Attributes.error", false)))).isFalse();
        assertThat(classifier.isError(SpanDocument.of(Map.of("Attributes.error", 0)))).isFalse();
        assertThat(classifier.isError(SpanDocument.of(Map.of("Attributes.error", "")))).isFalse();
    }

    @Test
    void nonOkStatusMarksError() {
        assertThat(classifier.isError(SpanDocument.of(Map.of("TraceStatus", 2)))).isTrue();
        assertThat(classifier.isError(SpanDocument.of(Map.of("TraceStatus", "Error")))).isTrue();
        assertThat(classifier.isError(SpanDocument.of(Map.of("TraceStatus", 0)))).isFalse();
        assertThat(classifier.isError(SpanDocument.of(Map.of("TraceStatus", "Unset")))).isFalse();
        assertThat(classifier.isError(SpanDocument.of(Map.of("TraceStatus", "OK")))).isFalse();
        assertThat(classifier.isError(SpanDocument.of(Map.of("Name", "api_call")))).isFalse();
    }

    @Test
    void errorTypeComesFromAttributeEndingInErrorType() {
        assertThat(classifier.errorType(SpanDocument.of(Map.of("Attributes.error.type", "ConnectionReset"))))
                .isEqualTo("ConnectionReset");
        assertThat(classifier.errorType(SpanDocument.of(Map.of("Attributes.db.error.type", "Deadlock"))))
                .isEqualTo("Deadlock");
        assertThat(classifier.errorType(SpanDocument.of(Map.of("Attributes.error", true)))).isNull();
    }
}
