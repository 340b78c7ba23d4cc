package com.spanlens.service.anomaly;

import com.spanlens.config.AnalysisProperties;
import com.spanlens.exception.ModelFitException;
import com.spanlens.model.Observation;
import com.spanlens.model.ObservationTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Flags latency outliers with an isolation forest retrained on every batch.
 * About {@code contamination * N} observations end up flagged; ties in the score
 * distribution can move the count either way.
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LatencyAnomalyDetector {

    private final AnalysisProperties properties;

    /**
     * Sets {@code latencyAnomaly} on every observation of the table.
     *
     * @return number of observations flagged
     * @throws ModelFitException when the latency column is constant or not finite
     */
    public long detect(ObservationTable table) {
        if (table.isEmpty()) {
            log.info("No latency data available for anomaly detection");
            return 0;
        }

        List<Observation> observations = table.getObservations();
        if (observations.size() == 1) {
            observations.get(0).setLatencyAnomaly(false);
            return 0;
        }

        double[] latencies = table.latencies();
        checkFittable(latencies);

        log.info("Detecting latency anomalies...");
        IsolationForest forest = new IsolationForest(
                properties.getTrees(), properties.getSampleSize(), properties.getSeed());
        boolean[] outliers = forest.fitPredict(latencies, properties.getContamination());

        long anomalyCount = 0;
        for (int i = 0; i < outliers.length; i++) {
            observations.get(i).setLatencyAnomaly(outliers[i]);
            if (outliers[i]) {
                anomalyCount++;
            }
        }

        log.info("Found {} latency anomalies out of {} data points", anomalyCount, observations.size());
        return anomalyCount;
    }

    private void checkFittable(double[] latencies) {
        double first = latencies[0];
        boolean constant = true;
        for (double latency : latencies) {
            if (!Double.isFinite(latency)) {
                throw new ModelFitException("Latency column contains non-finite value " + latency);
            }
            if (latency != first) {
                constant = false;
            }
        }
        if (constant) {
            throw new ModelFitException(String.format(
                    "Latency column is constant (%d values of %.6fs), nothing to isolate",
                    latencies.length, first));
        }
    }
}
