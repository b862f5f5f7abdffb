package com.spectralsentinel.core.boundary;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FactorTableBoundaryCalculator}.
 */
class FactorTableBoundaryCalculatorTest {

    private final FactorTableBoundaryCalculator calculator = new FactorTableBoundaryCalculator();

    @Nested
    @DisplayName("Factor table")
    class FactorTable {

        @Test
        @DisplayName("Table has one factor per integer sensitivity, pinned to 1.0 at 50")
        void shouldHaveKnownAnchors() {
            double[] factors = FactorTableBoundaryCalculator.factors();

            assertThat(factors).hasSize(101);
            assertThat(factors[50]).isEqualTo(1.0);
            assertThat(factors[51]).isCloseTo(1 / 1.15, within(1e-15));
            assertThat(factors[0]).isCloseTo(184331.62871148242, within(1e-6));
            assertThat(factors[30]).isCloseTo(100.8956415134347, within(1e-9));
            assertThat(factors[100]).isCloseTo(9.767e-06, within(1e-8));
        }

        @Test
        @DisplayName("Factors strictly decrease with sensitivity")
        void shouldDecrease() {
            double[] factors = FactorTableBoundaryCalculator.factors();

            for (int i = 1; i < factors.length; i++) {
                assertThat(factors[i]).isLessThan(factors[i - 1]);
            }
        }
    }

    @Nested
    @DisplayName("margin")
    class Margin {

        @Test
        @DisplayName("Integer sensitivity reads the table directly")
        void shouldUseTableAtIntegerSensitivity() {
            assertThat(calculator.margin(1.0, 50)).isEqualTo(1.0);
            assertThat(calculator.margin(2.0, 30)).isCloseTo(2 * 100.8956415134347, within(1e-9));
        }

        @Test
        @DisplayName("Fractional sensitivity interpolates linearly")
        void shouldInterpolateBetweenSensitivities() {
            assertThat(calculator.margin(1.0, 50.5)).isCloseTo(0.9347826086956522, within(1e-12));
        }

        @Test
        @DisplayName("Sensitivity 100 gives a zero margin")
        void shouldBeZeroAtMaxSensitivity() {
            assertThat(calculator.margin(5.0, 100)).isZero();
        }

        @Test
        @DisplayName("Should reject sensitivity outside [0, 100] and non-positive units")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> calculator.margin(1.0, -0.1))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("sensitivity");
            assertThatThrownBy(() -> calculator.margin(1.0, 100.5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> calculator.margin(1.0, Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> calculator.margin(0.0, 50))
                    .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("unit");
        }
    }

    @Nested
    @DisplayName("boundaryUnits")
    class Units {

        @Test
        @DisplayName("Units blend local and average trend and never drop below 1")
        void shouldBlendTrends() {
            double[] values = new double[12];
            Arrays.fill(values, 10.0);
            boolean[] isAnomaly = new boolean[12];

            double[] units = calculator.boundaryUnits(values, isAnomaly);

            assertThat(units).hasSize(12).containsOnly(10.0);
            assertThat(calculator.boundaryUnits(new double[] { 0.2, 0.1, 0.3 }, new boolean[3]))
                    .containsOnly(1.0);
        }

        @Test
        @DisplayName("Anomalous points are excluded from the average trend")
        void shouldExcludeAnomaliesFromAverage() {
            double[] values = { 10, 10, 10, 10, 10, 10, 30, 30, 30 };
            boolean[] isAnomaly = { false, false, false, false, false, false, true, true, true };

            double[] units = calculator.boundaryUnits(values, isAnomaly);

            // window 3: trends are 10 for the first six points, 30 for the last three
            assertThat(units[0]).isCloseTo(10.0, within(1e-12));
            assertThat(units[8]).isCloseTo(0.5 * 30 + 0.5 * 10, within(1e-12));
        }

        @Test
        @DisplayName("Should reject mismatched lengths")
        void shouldRejectLengthMismatch() {
            assertThatThrownBy(() -> calculator.boundaryUnits(new double[3], new boolean[2]))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("anomalyScores")
    class Scores {

        @Test
        @DisplayName("Score locates the distance on the margin scale")
        void shouldScoreFlaggedPoints() {
            double[] scores = calculator.anomalyScores(
                    new double[] { 1.0, 100.0, 1.0 },
                    new double[] { 1.0, 1.0, 1.0 },
                    new double[] { 1.0, 1.0, 1.0 },
                    new boolean[] { false, true, false });

            assertThat(scores[0]).isZero();
            assertThat(scores[1]).isCloseTo(0.6991136746986263, within(1e-12));
            assertThat(scores[2]).isZero();
        }

        @Test
        @DisplayName("Flagged point on its expected value scores zero; beyond every margin scores one")
        void shouldClampScores() {
            double[] scores = calculator.anomalyScores(
                    new double[] { 5.0, 1e9 },
                    new double[] { 5.0, 0.0 },
                    new double[] { 1.0, 1.0 },
                    new boolean[] { true, true });

            assertThat(scores).containsExactly(0.0, 1.0);
        }
    }
}
