package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.math.LeastSquaresInterpolator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ExpectedValueEstimator}.
 */
class ExpectedValueEstimatorTest {

    private final ExpectedValueEstimator estimator = new ExpectedValueEstimator(new LeastSquaresInterpolator());

    @Test
    @DisplayName("A flagged spike is replaced by the level of its neighbours")
    void shouldRemoveFlaggedSpike() {
        double[] values = new double[10];
        Arrays.fill(values, 1.0);
        values[5] = 100.0;

        double[] expected = estimator.estimate(values, new int[] { 5 });

        assertThat(expected).hasSize(10);
        for (double v : expected) {
            assertThat(v).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Low-frequency content passes through unchanged")
    void shouldKeepLowFrequencies() {
        int length = 16;
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = Math.sin(2 * Math.PI * i / length);
        }

        double[] expected = estimator.estimate(values, new int[0]);

        for (int i = 0; i < length; i++) {
            assertThat(expected[i]).isCloseTo(values[i], within(1e-9));
        }
    }

    @Test
    @DisplayName("The Nyquist component is filtered out")
    void shouldRemoveHighestFrequency() {
        double[] values = new double[16];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2 == 0 ? 1.0 : -1.0;
        }

        double[] expected = estimator.estimate(values, new int[0]);

        for (double v : expected) {
            assertThat(v).isCloseTo(0.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Input array is not modified")
    void shouldNotMutateInput() {
        double[] values = { 1, 1, 1, 50, 1, 1, 1, 1 };
        double[] copy = values.clone();

        estimator.estimate(values, new int[] { 3 });

        assertThat(values).containsExactly(copy);
    }
}
