package com.spectralsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesExtender}.
 */
class SeriesExtenderTest {

    @Test
    @DisplayName("predictNext([1, 2, 3]) is values[1] + (3-1)/2 + (3-2)/1 = 4")
    void shouldPredictBySummingSlopes() {
        assertThat(SeriesExtender.predictNext(new double[] { 1.0, 2.0, 3.0 })).isEqualTo(4.0);
    }

    @Test
    @DisplayName("predictNext of two values is values[1] plus their difference")
    void shouldPredictFromTwoValues() {
        assertThat(SeriesExtender.predictNext(new double[] { 2.0, 5.0 })).isEqualTo(8.0);
    }

    @Test
    @DisplayName("predictNext needs at least two values")
    void shouldRejectTooShortHistory() {
        assertThatThrownBy(() -> SeriesExtender.predictNext(new double[] { 1.0 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 2");
        assertThatThrownBy(() -> SeriesExtender.predictNext(new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Extended series keeps the input as prefix and appends extendNum equal values")
    void shouldAppendPredictedTail() {
        double[] values = { 3.0, 1.0, 4.0, 1.0, 5.0, 9.0, 2.0, 6.0 };

        double[] extended = SeriesExtender.extendSeries(values, 4, 3);

        assertThat(extended).hasSize(values.length + 4);
        assertThat(Arrays.copyOf(extended, values.length)).containsExactly(values);
        double tail = extended[values.length];
        for (int i = values.length; i < extended.length; i++) {
            assertThat(extended[i]).isEqualTo(tail);
        }
        // prediction from values[3..6] = {1, 5, 9, 2}
        assertThat(tail).isEqualTo(SeriesExtender.predictNext(new double[] { 1.0, 5.0, 9.0, 2.0 }));
    }

    @Test
    @DisplayName("A straight line is continued by its next value")
    void shouldContinueLinearSeries() {
        double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };

        double[] extended = SeriesExtender.extendSeries(values);

        assertThat(extended).hasSize(15);
        assertThat(Arrays.copyOfRange(extended, 10, 15)).containsOnly(10.0);
    }

    @Test
    @DisplayName("Short series use whatever history is available")
    void shouldClipLookBackAtSeriesStart() {
        double[] extended = SeriesExtender.extendSeries(new double[] { 1.0, 2.0, 3.0 });

        // prediction uses {1, 2}: 2 + (2 - 1) = 3
        assertThat(extended).containsExactly(1.0, 2.0, 3.0, 3.0, 3.0, 3.0, 3.0, 3.0);
    }

    @Test
    @DisplayName("Should reject lookAhead < 1")
    void shouldRejectInvalidLookAhead() {
        assertThatThrownBy(() -> SeriesExtender.extendSeries(new double[] { 1, 2, 3, 4 }, 5, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookAhead");
    }

    @Test
    @DisplayName("Should reject series too short to predict from")
    void shouldRejectTooShortSeries() {
        assertThatThrownBy(() -> SeriesExtender.extendSeries(new double[] { 1.0, 2.0 }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
