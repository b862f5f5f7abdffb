package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.math.TrailingAverageFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SpectralTransformer}.
 */
class SpectralTransformerTest {

    private SpectralTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new SpectralTransformer(new TrailingAverageFilter(), 3);
    }

    @Test
    @DisplayName("Constant series has a flat saliency map of 1/n")
    void shouldProduceFlatMapForConstantSeries() {
        double[] values = new double[15];
        Arrays.fill(values, 1.0);

        double[] mags = transformer.transform(values);

        // only the DC bin survives, rescaled to saliency 1
        assertThat(mags).hasSize(15);
        for (double mag : mags) {
            assertThat(mag).isCloseTo(1.0 / 15, within(1e-9));
        }
    }

    @Test
    @DisplayName("Saliency peaks at a spike")
    void shouldPeakAtSpike() {
        double[] values = new double[16];
        Arrays.fill(values, 1.0);
        values[7] = 50.0;

        double[] mags = transformer.transform(values);

        int argMax = 0;
        for (int i = 1; i < mags.length; i++) {
            if (mags[i] > mags[argMax]) {
                argMax = i;
            }
        }
        assertThat(argMax).isEqualTo(7);
    }

    @Test
    @DisplayName("All-zero series stays zero instead of producing NaN")
    void shouldHandleZeroSpectrum() {
        double[] mags = transformer.transform(new double[10]);

        assertThat(mags).hasSize(10).containsOnly(0.0);
    }

    @Test
    @DisplayName("Should reject magWindow < 1")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> new SpectralTransformer(new TrailingAverageFilter(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("magWindow");
    }
}
