package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.InvalidConfigurationException;
import com.seasonalesd.core.stats.QuantileFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IterativeEsdTester}.
 */
class IterativeEsdTesterTest {

    private final IterativeEsdTester tester = new IterativeEsdTester();

    @Test
    @DisplayName("Should report every candidate up to the last significant iteration")
    void shouldConfirmRetroactively() {
        int n = 20;
        double[] values = new double[n];
        for (int i = 0; i < 19; i++) {
            values[i] = i;
        }
        values[19] = 30;
        // huge quantiles everywhere except the second iteration (n - 2 - 1 degrees of freedom)
        QuantileFunction quantile = (p, df) -> df == n - 3 ? 0.5 : 1e6;

        EsdTestResult result = new IterativeEsdTester(quantile).test(series(values), options(0.49).build());

        assertThat(result.getIterations().get(0).exceedsCriticalValue()).isFalse();
        assertThat(result.getIterations().get(1).exceedsCriticalValue()).isTrue();
        assertThat(result.getIterations().subList(2, result.getIterations().size()))
                .noneMatch(EsdIteration::exceedsCriticalValue);
        assertThat(result.getConfirmedCount()).isEqualTo(2);
        assertThat(result.anomalies()).containsExactly(20L, 19L);
    }

    @Test
    @DisplayName("Should keep iterating after a non-significant candidate")
    void shouldNotStopOnFirstFailure() {
        double[] values = new double[20];
        for (int i = 0; i < 19; i++) {
            values[i] = i;
        }
        values[19] = 30;

        EsdTestResult result = new IterativeEsdTester((p, df) -> 1e6).test(series(values), options(0.49).build());

        assertThat(result.getMaxOutliers()).isEqualTo(9);
        assertThat(result.getIterations()).hasSize(9);
        assertThat(result.anomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should compute the critical value from the t quantile")
    void shouldComputeCriticalValue() {
        double[] values = noise(40);
        values[10] = -5;

        EsdTestResult result = tester.test(series(values), options(0.10).upperTail(false).build());

        EsdIteration first = result.getIterations().get(0);
        assertThat(first.getCandidate()).isEqualTo(11L);
        assertThat(first.getStatistic()).isCloseTo(11.1291, within(1e-3));
        assertThat(first.getCriticalValue()).isCloseTo(2.8675, within(1e-3));
    }

    @Test
    @DisplayName("Should honour the direction of the test")
    void shouldHonourDirection() {
        double[] values = noise(40);
        values[3] = 6;
        values[30] = -7;
        WorkingSeries residuals = series(values);

        assertThat(tester.test(residuals, options(0.10).direction(Direction.POS).build()).anomalies())
                .containsExactly(4L);
        assertThat(tester.test(residuals, options(0.10).direction(Direction.NEG).build()).anomalies())
                .containsExactly(31L);
        assertThat(tester.test(residuals, options(0.10).direction(Direction.BOTH).build()).anomalies())
                .containsExactly(31L, 4L);
    }

    @Test
    @DisplayName("Should ignore a low outlier in a positive-only test")
    void shouldIgnoreOppositeTail() {
        double[] values = noise(40);
        values[10] = -5;

        assertThat(tester.test(series(values), options(0.10).build()).anomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should use mean and standard deviation when requested")
    void shouldSupportPlainEsd() {
        double[] values = noise(40);
        values[10] = -5;

        EsdTestResult result = tester.test(series(values), options(0.10).upperTail(false).useEsd(true).build());

        assertThat(result.anomalies()).containsExactly(11L);
    }

    @Test
    @DisplayName("Should pick the first of two equally extreme points")
    void shouldBreakTiesByPosition() {
        double[] values = new double[12];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 3;
        }
        values[3] = 9;
        values[7] = 9;

        EsdTestResult result = new IterativeEsdTester((p, df) -> 0.0).test(series(values), options(0.2).build());

        assertThat(result.getIterations().get(0).getCandidate()).isEqualTo(4L);
        assertThat(result.getIterations().get(1).getCandidate()).isEqualTo(8L);
    }

    @Test
    @DisplayName("Should stop when the residual spread is zero")
    void shouldStopOnZeroScale() {
        double[] values = new double[20];
        values[4] = 10;

        EsdTestResult result = tester.test(series(values), options(0.49).build());

        assertThat(result.getIterations()).isEmpty();
        assertThat(result.anomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should stop only at a scale no larger than the series resolution")
    void shouldStopAtResolution() {
        double[] values = noise(40);
        for (int i = 0; i < values.length; i++) {
            values[i] *= 1e-12;
        }
        values[5] = 1e-9;
        long[] timestamps = timestamps(values.length);

        EsdTestResult exact = tester.test(WorkingSeries.of(timestamps, values), options(0.10).build());
        EsdTestResult coarse = tester.test(WorkingSeries.of(timestamps, values, 1e-8), options(0.10).build());

        // a tiny but non-zero spread is still tested when no round-off floor is set
        assertThat(exact.anomalies()).containsExactly(6L);
        assertThat(coarse.getIterations()).isEmpty();
        assertThat(coarse.anomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should size the anomaly budget from the raw series length")
    void shouldBudgetFromRawLength() {
        double[] values = noise(8);
        values[7] = 50;

        EsdTestResult result = tester.test(series(values), 10, options(0.10).build());

        assertThat(result.getMaxOutliers()).isEqualTo(1);
        assertThat(result.anomalies()).containsExactly(8L);
        assertThatThrownBy(() -> tester.test(series(values), 8, options(0.10).build()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> tester.test(series(values), 7, options(0.10).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numObs");
    }

    @Test
    @DisplayName("Should never report more than floor(n * k) anomalies")
    void shouldBoundAnomalyCount() {
        double[] values = noise(50);
        for (int i = 0; i < 50; i += 5) {
            values[i] = 40 + i;
        }

        EsdTestResult result = new IterativeEsdTester((p, df) -> 0.0).test(series(values), options(0.1).build());

        assertThat(result.getMaxOutliers()).isEqualTo(5);
        assertThat(result.anomalies()).hasSize(5).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should stop once no degrees of freedom are left")
    void shouldStopWithoutDegreesOfFreedom() {
        double[] values = { 1, 5, 2, 8 };

        EsdTestResult result = new IterativeEsdTester((p, df) -> 0.0).test(series(values), options(1.0).build());

        // iterations 1 and 2 leave n - i - 1 = 2 and 1 degrees of freedom
        assertThat(result.getIterations()).hasSize(2);
    }

    @Test
    @DisplayName("Should throw when floor(n * k) is zero")
    void shouldRejectZeroMaxOutliers() {
        assertThatThrownBy(() -> tester.test(series(noise(10)), options(0.05).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Maximum number of anomalies is 0");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EsdOptions.Builder options(double k) {
        return EsdOptions.builder().k(k).alpha(0.05);
    }

    private static double[] noise(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = ((i * 37) % 11 - 5) / 10.0;
        }
        return values;
    }

    private static long[] timestamps(int n) {
        long[] timestamps = new long[n];
        for (int i = 0; i < n; i++) {
            timestamps[i] = i + 1L;
        }
        return timestamps;
    }

    private static WorkingSeries series(double[] values) {
        return WorkingSeries.of(timestamps(values.length), values);
    }
}
