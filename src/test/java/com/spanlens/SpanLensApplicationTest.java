package com.spanlens;

import com.spanlens.engine.file.FileSpanStore;
import com.spanlens.factory.SpanStoreFactory;
import com.spanlens.service.pipeline.PipelineOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spanlens.runner.enabled=false",
        "store.type=file",
        "store.file=src/test/resources/fixtures/search-response.json"
})
class SpanLensApplicationTest {

    @Autowired
    private SpanStoreFactory storeFactory;

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Test
    void contextWiresTheConfiguredStore() {
        assertThat(storeFactory.getStore()).isInstanceOf(FileSpanStore.class);
        assertThat(orchestrator.isStopRequested()).isFalse();
    }
}
