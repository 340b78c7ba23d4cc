package com.spanlens.service.anomaly;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void averagePathLengthMatchesKnownValues() {
        assertThat(IsolationForest.averagePathLength(0)).isZero();
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    void percentileInterpolatesLinearly() {
        double[] values = {4, 1, 3, 2, 5};

        assertThat(IsolationForest.percentile(values, 0)).isEqualTo(1.0);
        assertThat(IsolationForest.percentile(values, 50)).isEqualTo(3.0);
        assertThat(IsolationForest.percentile(values, 90)).isCloseTo(4.6, within(1e-12));
        assertThat(IsolationForest.percentile(values, 100)).isEqualTo(5.0);
    }

    @Test
    void isolatedPointScoresHigherThanClusteredPoints() {
        double[] values = new double[50];
        for (int i = 0; i < 49; i++) {
            values[i] = 1.0 + (i % 7) * 0.01;
        }
        values[49] = 25.0;

        double[] scores = new IsolationForest(100, 256, 7L).fitScore(values);

        for (int i = 0; i < 49; i++) {
            assertThat(scores[49]).isGreaterThan(scores[i]);
        }
        for (double score : scores) {
            assertThat(score).isBetween(0.0, 1.0);
        }
    }

    @Test
    void sameSeedGivesSameScores() {
        double[] values = {0.1, 0.2, 0.15, 0.3, 4.0, 0.12, 0.18};

        double[] first = new IsolationForest(50, 256, 42L).fitScore(values);
        double[] second = new IsolationForest(50, 256, 42L).fitScore(values);

        assertThat(second).containsExactly(first);
    }

    @Test
    void emptyInputScoresNothing() {
        assertThat(new IsolationForest(10, 16, 1L).fitScore(new double[0])).isEmpty();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> new IsolationForest(0, 256, 1L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForest(10, 1, 1L)).isInstanceOf(IllegalArgumentException.class);
    }
}
