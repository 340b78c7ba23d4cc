package com.spanlens.service.anomaly;

import com.spanlens.config.AnalysisProperties;
import com.spanlens.model.AnomalyWindow;
import com.spanlens.model.Observation;
import com.spanlens.model.ObservationTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Error-rate anomalies over fixed, left-closed windows anchored at UTC midnight of the
 * earliest observation's day.
 * <p>
 * Observations are bucketed by timestamp, each non-empty window gets the mean of its
 * error flags, and windows above the threshold are flagged. Window values are then
 * attached to every observation with a backward as-of join: an observation takes the
 * latest window starting at or before its own timestamp, never a later one.
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ErrorWindowAnomalyDetector {

    private final AnalysisProperties properties;

    public List<AnomalyWindow> detect(ObservationTable table) {
        if (table.isEmpty()) {
            log.info("No error data available for anomaly detection");
            return List.of();
        }

        log.info("Detecting error rate anomalies...");
        List<AnomalyWindow> windows = computeWindows(table);
        joinBackward(table, windows);

        long anomalousWindows = windows.stream().filter(AnomalyWindow::isErrorRateAnomaly).count();
        log.info("Found {} error rate anomalies ({} of {} windows) based on a threshold of {}",
                table.countErrorRateAnomalies(), anomalousWindows, windows.size(),
                properties.getErrorThreshold());
        return windows;
    }

    /**
     * One window per non-empty bucket, ordered by start.
     */
    public List<AnomalyWindow> computeWindows(ObservationTable table) {
        if (table.isEmpty()) {
            return List.of();
        }
        Duration windowSize = properties.getWindowSize();
        double threshold = properties.getErrorThreshold();
        Instant origin = startOfDay(table.getObservations().get(0).getTimestamp());

        // start -> {observations, errors}
        TreeMap<Instant, int[]> buckets = new TreeMap<>();
        for (Observation observation : table.getObservations()) {
            Instant start = windowStart(observation.getTimestamp(), origin, windowSize);
            int[] counts = buckets.computeIfAbsent(start, k -> new int[2]);
            counts[0]++;
            if (observation.isError()) {
                counts[1]++;
            }
        }

        List<AnomalyWindow> windows = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, int[]> bucket : buckets.entrySet()) {
            int total = bucket.getValue()[0];
            int errors = bucket.getValue()[1];
            double rate = (double) errors / total;
            windows.add(AnomalyWindow.builder()
                    .windowStart(bucket.getKey())
                    .observationCount(total)
                    .errorCount(errors)
                    .windowErrorRate(rate)
                    .errorRateAnomaly(rate > threshold)
                    .build());
        }
        return windows;
    }

    /**
     * Attach window values to observations; an observation before the first window stays unset.
     */
    public void joinBackward(ObservationTable table, List<AnomalyWindow> windows) {
        TreeMap<Instant, AnomalyWindow> byStart = new TreeMap<>();
        for (AnomalyWindow window : windows) {
            byStart.put(window.getWindowStart(), window);
        }

        for (Observation observation : table.getObservations()) {
            Map.Entry<Instant, AnomalyWindow> match = byStart.floorEntry(observation.getTimestamp());
            if (match == null) {
                observation.setWindowErrorRate(null);
                observation.setErrorRateAnomaly(null);
            } else {
                observation.setWindowErrorRate(match.getValue().getWindowErrorRate());
                observation.setErrorRateAnomaly(match.getValue().isErrorRateAnomaly());
            }
        }
    }

    // Buckets are anchored at UTC midnight of the earliest observation's day
    static Instant startOfDay(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.DAYS);
    }

    // origin must not be after timestamp
    static Instant windowStart(Instant timestamp, Instant origin, Duration windowSize) {
        long index = Duration.between(origin, timestamp).dividedBy(windowSize);
        return origin.plus(windowSize.multipliedBy(index));
    }
}
