package com.spanlens.factory;

import com.spanlens.config.StoreProperties;
import com.spanlens.engine.SpanStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands the orchestrator the single store selected by {@code store.type}.
 * Exactly one {@link SpanStore} bean exists per context; the rest are switched off
 * by their {@code @ConditionalOnProperty}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpanStoreFactory {

    private final SpanStore store;
    private final StoreProperties storeProperties;

    @PostConstruct
    public void init() {
        log.info("SpanLens store initialized: {} (store.type={}, max attempts {}, backoff {}s)",
                store.getEngineType(), storeProperties.getType(),
                storeProperties.getMaxAttempts(), storeProperties.getBackoff().toSeconds());
    }

    public SpanStore getStore() {
        return store;
    }
}
