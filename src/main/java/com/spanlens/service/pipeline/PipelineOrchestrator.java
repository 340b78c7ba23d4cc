package com.spanlens.service.pipeline;

import com.spanlens.config.AnalysisProperties;
import com.spanlens.config.StoreProperties;
import com.spanlens.engine.SpanStore;
import com.spanlens.engine.StoreSession;
import com.spanlens.exception.EmptyResultException;
import com.spanlens.exception.ModelFitException;
import com.spanlens.exception.StoreConnectionException;
import com.spanlens.factory.SpanStoreFactory;
import com.spanlens.model.AnomalyWindow;
import com.spanlens.model.BuildResult;
import com.spanlens.model.ObservationTable;
import com.spanlens.model.RunReport;
import com.spanlens.model.RunState;
import com.spanlens.model.SpanDocument;
import com.spanlens.model.SpanQuery;
import com.spanlens.service.anomaly.ErrorWindowAnomalyDetector;
import com.spanlens.service.anomaly.LatencyAnomalyDetector;
import com.spanlens.service.report.AnomalyReportWriter;
import com.spanlens.service.span.ObservationBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs the analysis pipeline:
 * CONNECT -> FETCH -> BUILD -> DETECT_LATENCY -> DETECT_ERROR_WINDOWS -> EMIT.
 * <p>
 * Any stage can end the run in FAILED; an empty fetch ends it in SKIPPED. Failures are
 * logged and reported, never thrown, so continuous mode keeps going. At most one run
 * is active at a time and the store session never outlives its run.
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private static final DateTimeFormatter STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter LOG_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SpanStoreFactory storeFactory;
    private final ObservationBuilder observationBuilder;
    private final LatencyAnomalyDetector latencyDetector;
    private final ErrorWindowAnomalyDetector errorWindowDetector;
    private final AnomalyReportWriter reportWriter;
    private final AnalysisProperties analysisProperties;
    private final StoreProperties storeProperties;

    private final AtomicLong runCounter = new AtomicLong();
    private final ReentrantLock runLock = new ReentrantLock();
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    /**
     * Execute a single run.
     */
    public RunReport runOnce() {
        runLock.lock();
        try {
            return execute();
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Run, sleep for the configured interval, repeat until {@link #stop()} is called.
     *
     * @return report of the last run, or null when stopped before the first one
     */
    public RunReport runContinuously() {
        Duration interval = analysisProperties.getInterval();
        log.info("Running in continuous mode with {} second intervals. Press Ctrl+C to stop.",
                interval.toSeconds());

        RunReport last = null;
        while (!isStopRequested()) {
            last = runOnce();
            if (isStopRequested()) {
                break;
            }
            log.info("Sleeping for {} seconds...", interval.toSeconds());
            try {
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Stopping continuous analysis");
        return last;
    }

    /**
     * Ask the loop to stop and wait, up to the shutdown timeout, for an in-flight run to end.
     */
    public void stop() {
        if (isStopRequested()) {
            return;
        }
        stopSignal.countDown();
        try {
            long timeoutMs = analysisProperties.getShutdownTimeout().toMillis();
            if (runLock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                runLock.unlock();
            } else {
                log.warn("Analysis run still active after {} ms, shutting down anyway", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    private RunReport execute() {
        long runNumber = runCounter.incrementAndGet();
        LocalDateTime startedAt = LocalDateTime.now();
        long startNanos = System.nanoTime();
        log.info("=== Analysis run {} at {} ===", runNumber, LOG_FORMAT.format(startedAt));

        RunReport report = RunReport.builder()
                .runNumber(runNumber)
                .startedAt(startedAt)
                .build();
        RunState state = RunState.CONNECT;

        try (StoreSession session = withRetry("connect", () -> storeFactory.getStore().connect())) {
            // 1. Fetch
            state = RunState.FETCH;
            SpanQuery query = SpanQuery.builder()
                    .indexName(analysisProperties.getIndex())
                    .hours(analysisProperties.getHours())
                    .maxDocs(analysisProperties.getMaxDocs())
                    .build();
            List<SpanDocument> documents = withRetry("search", () -> session.search(query));
            if (documents.isEmpty()) {
                throw new EmptyResultException(String.format(
                        "No span documents in index %s for the last %d hours",
                        query.getIndexName(), query.getHours()));
            }

            // 2. Build observations
            state = RunState.BUILD;
            BuildResult built = observationBuilder.build(documents);
            ObservationTable table = built.getTable();
            report.setBuildSummary(built.getSummary());
            report.setTable(table);
            if (table.isEmpty()) {
                return finish(report, RunState.FAILED, state,
                        "No usable latency data found in " + documents.size() + " documents", startNanos);
            }

            // 3. Latency anomalies; a fit failure still lets the error windows through
            state = RunState.DETECT_LATENCY;
            String fitFailure = null;
            try {
                report.setLatencyAnomalyCount(latencyDetector.detect(table));
            } catch (ModelFitException e) {
                fitFailure = e.getMessage();
                log.error("Latency model fit failed: {}", fitFailure);
            }

            // 4. Error-rate windows
            state = RunState.DETECT_ERROR_WINDOWS;
            List<AnomalyWindow> windows = errorWindowDetector.detect(table);
            report.setWindows(windows);

            // 5. Emit
            state = RunState.EMIT;
            Path outputDir = Paths.get(analysisProperties.getOutputDir());
            report.setOutputFiles(reportWriter.write(table, windows, outputDir, STAMP_FORMAT.format(startedAt)));
            reportWriter.logReport(table, windows);

            if (fitFailure != null) {
                return finish(report, RunState.FAILED, RunState.DETECT_LATENCY, fitFailure, startNanos);
            }
            return finish(report, RunState.COMPLETED, state, null, startNanos);
        } catch (EmptyResultException e) {
            log.info("{}; nothing to analyze this cycle", e.getMessage());
            return finish(report, RunState.SKIPPED, state, e.getMessage(), startNanos);
        } catch (StoreConnectionException e) {
            log.error("Store unavailable during {}: {}", state, e.getMessage());
            return finish(report, RunState.FAILED, state, e.getMessage(), startNanos);
        } catch (RuntimeException e) {
            log.error("Analysis run {} failed during {}", runNumber, state, e);
            return finish(report, RunState.FAILED, state, e.getMessage(), startNanos);
        }
    }

    private RunReport finish(RunReport report, RunState finalState, RunState lastStage,
                             String reason, long startNanos) {
        report.setFinalState(finalState);
        report.setLastStage(lastStage);
        report.setFailureReason(reason);
        report.setElapsed(Duration.ofNanos(System.nanoTime() - startNanos));

        if (finalState == RunState.FAILED) {
            log.warn("Run {} FAILED at {}: {}", report.getRunNumber(), lastStage, reason);
        } else {
            log.info("Run {} {} in {} ms", report.getRunNumber(), finalState, report.getElapsed().toMillis());
        }
        return report;
    }

    // Store calls are retried with a fixed backoff; anything else propagates at once
    private <T> T withRetry(String operation, Supplier<T> call) {
        int maxAttempts = storeProperties.getMaxAttempts();
        Duration backoff = storeProperties.getBackoff();
        StoreConnectionException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (StoreConnectionException e) {
                lastFailure = e;
                log.warn("Store {} attempt {}/{} failed: {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !backoff.isZero()) {
                    try {
                        Thread.sleep(backoff.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new StoreConnectionException("Interrupted while retrying store " + operation, ie);
                    }
                }
            }
        }
        throw lastFailure;
    }
}
