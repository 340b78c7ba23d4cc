package com.spanlens.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Observations ordered by timestamp. Rows with equal timestamps keep their input order.
 * @author kiransahoo
 */
public class ObservationTable {

    private final List<Observation> observations;

    public ObservationTable(List<Observation> observations) {
        List<Observation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(Observation::getTimestamp));
        this.observations = Collections.unmodifiableList(sorted);
    }

    public static ObservationTable empty() {
        return new ObservationTable(List.of());
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public Stream<Observation> stream() {
        return observations.stream();
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public double[] latencies() {
        return observations.stream()
                .mapToDouble(Observation::getLatency)
                .toArray();
    }

    public long countLatencyAnomalies() {
        return observations.stream()
                .filter(o -> Boolean.TRUE.equals(o.getLatencyAnomaly()))
                .count();
    }

    public long countErrorRateAnomalies() {
        return observations.stream()
                .filter(o -> Boolean.TRUE.equals(o.getErrorRateAnomaly()))
                .count();
    }
}
