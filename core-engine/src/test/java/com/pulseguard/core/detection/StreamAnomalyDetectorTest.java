package com.pulseguard.core.detection;

import com.pulseguard.core.config.DetectorSettings;
import com.pulseguard.core.model.Alert;
import com.pulseguard.core.model.Reading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StreamAnomalyDetector}.
 */
class StreamAnomalyDetectorTest {

    private StreamAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new StreamAnomalyDetector();
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    @Nested
    class Construction {

        @Test
        @DisplayName("Default detector uses alpha=0.1, threshold=3.5, window=30")
        void shouldUseDefaults() {
            assertThat(detector.getAlpha()).isEqualTo(0.1);
            assertThat(detector.getThreshold()).isEqualTo(3.5);
            assertThat(detector.getWindowSize()).isEqualTo(30);
            assertThat(detector.getScoringMode()).isEqualTo(ScoringMode.SELF_INCLUSIVE);
            assertThat(detector.getHistoryMode()).isEqualTo(HistoryMode.UNBOUNDED);
            assertThat(detector.getEma()).isEmpty();
            assertThat(detector.getObservationCount()).isZero();
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -0.1, 1.0001, Double.NaN, Double.POSITIVE_INFINITY})
        @DisplayName("Should reject alpha outside (0, 1]")
        void shouldRejectInvalidAlpha(double alpha) {
            assertThatThrownBy(() -> new StreamAnomalyDetector(alpha, 3.5))
                    .isInstanceOf(InvalidParameterException.class)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("alpha");
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -1.0, Double.NaN})
        @DisplayName("Should reject non-positive threshold")
        void shouldRejectInvalidThreshold(double threshold) {
            assertThatThrownBy(() -> new StreamAnomalyDetector(0.1, threshold))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("threshold");
        }

        @Test
        @DisplayName("Should accept alpha of exactly 1")
        void shouldAcceptAlphaOfOne() {
            StreamAnomalyDetector d = new StreamAnomalyDetector(1.0, 0.5);
            d.update(3.0);
            d.update(7.0);
            assertThat(d.getEma()).hasValue(7.0);
        }

        @Test
        @DisplayName("Should reject window size below one")
        void shouldRejectInvalidWindow() {
            assertThatThrownBy(() -> new StreamAnomalyDetector("w", 0.1, 3.5, 0,
                    ScoringMode.SELF_INCLUSIVE, HistoryMode.UNBOUNDED))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("windowSize");
        }

        @Test
        @DisplayName("Should build from DetectorSettings")
        void shouldBuildFromSettings() {
            DetectorSettings settings = new DetectorSettings();
            settings.setName("sensor-profile");
            settings.setAlpha(0.3);
            settings.setThreshold(2.0);
            settings.setWindowSize(10);
            settings.setScoringMode("pre_update");
            settings.setHistoryMode("BOUNDED");

            StreamAnomalyDetector d = new StreamAnomalyDetector(settings);

            assertThat(d.getName()).isEqualTo("sensor-profile");
            assertThat(d.getAlpha()).isEqualTo(0.3);
            assertThat(d.getThreshold()).isEqualTo(2.0);
            assertThat(d.getWindowSize()).isEqualTo(10);
            assertThat(d.getScoringMode()).isEqualTo(ScoringMode.PRE_UPDATE);
            assertThat(d.getHistoryMode()).isEqualTo(HistoryMode.BOUNDED);
        }
    }

    // ------------------------------------------------------------------
    // Core algorithm
    // ------------------------------------------------------------------

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -42.5, 1e9, 3.14})
    @DisplayName("First observation is never flagged and seeds the baseline")
    void shouldNotFlagFirstObservation(double value) {
        assertThat(detector.update(value)).isFalse();
        assertThat(detector.getEma()).hasValue(value);
        assertThat(detector.getMad()).isZero();
        assertThat(detector.getResidualHistory()).containsExactly(0.0);
    }

    @Test
    @DisplayName("Second observation follows the EMA / MAD / z-score formulas")
    void shouldComputeSecondObservationExactly() {
        StreamAnomalyDetector d = new StreamAnomalyDetector(0.5, 3.5);
        d.update(10.0);

        DetectionResult result = d.score(20.0);

        // ema = 0.5 * 20 + 0.5 * 10 = 15, residual = 5
        // history [0, 5] -> median 2.5, deviations [2.5, 2.5] -> mad 2.5
        assertThat(result.getBaseline()).isEqualTo(15.0);
        assertThat(result.getResidual()).isEqualTo(5.0);
        assertThat(result.getMad()).isEqualTo(2.5);
        assertThat(result.getModifiedZScore()).isCloseTo(0.6745 * 5.0 / 2.5, within(1e-12));
        assertThat(result.isAnomalous()).isFalse();
        assertThat(result.getIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("Constant input keeps MAD at zero and never flags")
    void shouldNeverFlagWithZeroDispersion() {
        for (int i = 0; i < 40; i++) {
            assertThat(detector.update(10.0)).isFalse();
        }
        assertThat(detector.getMad()).isZero();
        assertThat(detector.getEma()).hasValue(10.0);
    }

    @Test
    @DisplayName("Zero MAD suppresses even a huge jump")
    void shouldGuardDivisionByZero() {
        for (int i = 0; i < 40; i++) {
            detector.update(0.0);
        }

        DetectionResult result = detector.score(100.0);

        // 29 zero residuals and one spike: median and MAD are both 0
        assertThat(result.getMad()).isZero();
        assertThat(result.getModifiedZScore()).isZero();
        assertThat(result.isAnomalous()).isFalse();
    }

    @Test
    @DisplayName("Should flag a single spike after a quiet baseline around zero")
    void shouldFlagSingleSpike() {
        for (int i = 0; i < 40; i++) {
            assertThat(detector.update(i % 2 == 0 ? 0.1 : -0.1)).isFalse();
        }

        assertThat(detector.getMad()).isGreaterThan(0.0);
        assertThat(detector.update(100.0)).isTrue();
    }

    @Test
    @DisplayName("Lower threshold flags at least as many points as a higher one")
    void shouldBeMonotonicInThreshold() {
        double[] sequence = noisySequence(11L, 300);
        sequence[120] += 2.0;
        sequence[200] += 6.0;

        StreamAnomalyDetector strict = new StreamAnomalyDetector(0.1, 3.5);
        StreamAnomalyDetector lenient = new StreamAnomalyDetector(0.1, 1.0);

        int strictFlags = 0;
        int lenientFlags = 0;
        for (double v : sequence) {
            boolean s = strict.update(v);
            boolean l = lenient.update(v);
            if (s) {
                strictFlags++;
                assertThat(l).as("lenient detector must flag whatever the strict one flags").isTrue();
            }
            if (l) {
                lenientFlags++;
            }
        }

        assertThat(lenientFlags).isGreaterThanOrEqualTo(strictFlags);
        assertThat(lenientFlags).isGreaterThan(0);
    }

    @Test
    @DisplayName("MAD uses the whole history below 30 residuals and the last 30 from then on")
    void shouldSwitchToTrailingWindowAtThirtyResiduals() {
        // alpha=1 with pre-update scoring makes each residual the first difference,
        // so residual k equals k for k >= 1
        StreamAnomalyDetector d = new StreamAnomalyDetector("window", 1.0, 3.5, 30,
                ScoringMode.PRE_UPDATE, HistoryMode.UNBOUNDED);

        double value = 0.0;
        d.update(value);
        for (int k = 1; k <= 31; k++) {
            value += k;
            d.update(value);

            double[] residuals = d.getResidualHistory();
            assertThat(residuals).hasSize(k + 1);
            int from = residuals.length < 30 ? 0 : residuals.length - 30;
            double expected = referenceMad(Arrays.copyOfRange(residuals, from, residuals.length));
            assertThat(d.getMad()).as("MAD after %d residuals", residuals.length).isEqualTo(expected);
        }

        // 32 residuals [0, 1, ..., 31]: the trailing window is [2..31] with MAD 7.5,
        // whereas the whole history would give 8.0
        assertThat(d.getMad()).isEqualTo(7.5);
        assertThat(referenceMad(d.getResidualHistory())).isEqualTo(8.0);
    }

    @Test
    @DisplayName("Identically built detectors produce identical verdicts")
    void shouldBeDeterministic() {
        double[] sequence = noisySequence(3L, 500);
        StreamAnomalyDetector a = new StreamAnomalyDetector();
        StreamAnomalyDetector b = new StreamAnomalyDetector();

        for (double v : sequence) {
            assertThat(a.update(v)).isEqualTo(b.update(v));
        }
        assertThat(a.getMad()).isEqualTo(b.getMad());
        assertThat(a.getEma()).isEqualTo(b.getEma());
    }

    @Test
    @DisplayName("Verdicts never depend on later observations")
    void shouldNotLookAhead() {
        double[] prefix = noisySequence(5L, 80);
        prefix[60] += 8.0;
        double[] tail = noisySequence(6L, 40);
        double[] reversedTail = new double[tail.length];
        for (int i = 0; i < tail.length; i++) {
            reversedTail[i] = tail[tail.length - 1 - i] * 10;
        }

        List<Boolean> first = verdicts(concat(prefix, tail)).subList(0, prefix.length);
        List<Boolean> second = verdicts(concat(prefix, reversedTail)).subList(0, prefix.length);
        List<Boolean> prefixOnly = verdicts(prefix);

        assertThat(first).isEqualTo(prefixOnly);
        assertThat(second).isEqualTo(prefixOnly);
    }

    @Test
    @DisplayName("History length tracks the number of accepted updates")
    void shouldRecordOneResidualPerUpdate() {
        double[] sequence = noisySequence(9L, 75);
        for (int i = 0; i < sequence.length; i++) {
            detector.update(sequence[i]);
            assertThat(detector.getObservationCount()).isEqualTo(i + 1);
            assertThat(detector.getResidualHistory()).hasSize(i + 1);
        }
        assertThat(detector.getMad()).isGreaterThanOrEqualTo(0.0);
    }

    // ------------------------------------------------------------------
    // Input rejection
    // ------------------------------------------------------------------

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    @DisplayName("Should reject non-finite input without touching state")
    void shouldRejectNonFiniteInput(double bad) {
        assertThatThrownBy(() -> detector.update(bad))
                .isInstanceOf(InvalidInputException.class);
        assertThat(detector.getEma()).isEmpty();
        assertThat(detector.getObservationCount()).isZero();

        for (double v : noisySequence(1L, 35)) {
            detector.update(v);
        }
        double ema = detector.getEma().getAsDouble();
        double mad = detector.getMad();
        double[] history = detector.getResidualHistory();

        assertThatThrownBy(() -> detector.update(bad))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("finite");

        assertThat(detector.getEma()).hasValue(ema);
        assertThat(detector.getMad()).isEqualTo(mad);
        assertThat(detector.getResidualHistory()).containsExactly(history);
        assertThat(detector.getObservationCount()).isEqualTo(35);
    }

    // ------------------------------------------------------------------
    // Modes
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Bounded and unbounded history give identical results")
    void shouldMatchAcrossHistoryModes() {
        StreamAnomalyDetector unbounded = new StreamAnomalyDetector("u", 0.1, 3.5, 30,
                ScoringMode.SELF_INCLUSIVE, HistoryMode.UNBOUNDED);
        StreamAnomalyDetector bounded = new StreamAnomalyDetector("b", 0.1, 3.5, 30,
                ScoringMode.SELF_INCLUSIVE, HistoryMode.BOUNDED);

        double[] sequence = noisySequence(21L, 1_000);
        for (int i = 50; i < sequence.length; i += 97) {
            sequence[i] += 12.0;
        }

        for (double v : sequence) {
            DetectionResult u = unbounded.score(v);
            DetectionResult b = bounded.score(v);
            assertThat(b.getMad()).isEqualTo(u.getMad());
            assertThat(b.getModifiedZScore()).isEqualTo(u.getModifiedZScore());
            assertThat(b.isAnomalous()).isEqualTo(u.isAnomalous());
        }

        assertThat(bounded.getObservationCount()).isEqualTo(1_000);
        assertThat(bounded.getResidualHistory()).hasSize(30);
        assertThat(unbounded.getResidualHistory()).hasSize(1_000);
        double[] all = unbounded.getResidualHistory();
        assertThat(bounded.getResidualHistory())
                .containsExactly(Arrays.copyOfRange(all, all.length - 30, all.length));
    }

    @Test
    @DisplayName("Pre-update scoring measures the residual against the previous EMA")
    void shouldScoreAgainstPreviousBaseline() {
        StreamAnomalyDetector d = new StreamAnomalyDetector("pre", 0.1, 3.5, 30,
                ScoringMode.PRE_UPDATE, HistoryMode.UNBOUNDED);
        d.update(10.0);
        d.update(12.0);
        double before = d.getEma().getAsDouble();

        DetectionResult result = d.score(20.0);

        assertThat(result.getBaseline()).isEqualTo(before);
        assertThat(result.getResidual()).isEqualTo(20.0 - before);
        assertThat(d.getEma()).hasValue(0.1 * 20.0 + 0.9 * before);
    }

    // ------------------------------------------------------------------
    // Reading / Alert
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should emit an alert with diagnostics for an anomalous reading")
    void shouldEmitAlertForAnomalousReading() {
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 40; i++) {
            Optional<Alert> alert = detector.evaluate(
                    new Reading("sensor-1", i % 2 == 0 ? 0.1 : -0.1, base.plusSeconds(i)));
            assertThat(alert).isEmpty();
        }

        Optional<Alert> alert = detector.evaluate(new Reading("sensor-1", 100.0, base.plusSeconds(40)));

        assertThat(alert).isPresent();
        assertThat(alert.get().getDetectorName()).isEqualTo("ema-mad");
        assertThat(alert.get().getStreamId()).isEqualTo("sensor-1");
        assertThat(alert.get().getTimestamp()).isEqualTo(base.plusSeconds(40));
        assertThat(alert.get().getValue()).isEqualTo(100.0);
        assertThat(alert.get().getModifiedZScore()).isGreaterThan(3.5);
        assertThat(alert.get().getDetails()).contains("Anomalous reading");
    }

    @Test
    @DisplayName("Should skip readings without a value")
    void shouldSkipReadingWithoutValue() {
        Reading reading = new Reading();
        reading.setStreamId("sensor-1");

        assertThat(detector.evaluate(reading)).isEmpty();
        assertThat(detector.getObservationCount()).isZero();
    }

    @Test
    @DisplayName("An overflowing residual is rejected without touching state")
    void shouldRejectOverflowingResidual() {
        detector.update(-1e308);

        assertThatThrownBy(() -> detector.score(1e308))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("overflows")
                .extracting(e -> ((InvalidInputException) e).getRejectedValue())
                .isEqualTo(1e308);

        assertThat(detector.getObservationCount()).isEqualTo(1);
        assertThat(detector.getEma()).hasValue(-1e308);
        assertThat(detector.getMad()).isZero();
    }

    @Test
    @DisplayName("Extreme but representable values keep the MAD finite")
    void shouldKeepMadFiniteForExtremeValues() {
        double[] values = {-1e308, -5e307, 5e307, -1e308, 8e307, -3e307, 1e307};
        for (double v : values) {
            DetectionResult result = detector.score(v);
            assertThat(Double.isFinite(result.getResidual())).isTrue();
            assertThat(Double.isFinite(result.getModifiedZScore())).isTrue();
        }

        assertThat(Double.isFinite(detector.getMad())).isTrue();
        assertThat(detector.getMad()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject a reading with a non-finite value")
    void shouldRejectNonFiniteReading() {
        assertThatThrownBy(() -> detector.evaluate(new Reading("s", Double.NaN, Instant.now())))
                .isInstanceOf(InvalidInputException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] noisySequence(long seed, int length) {
        Random random = new Random(seed);
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = Math.sin(0.05 * i) + random.nextGaussian() * 0.3;
        }
        return values;
    }

    private static double[] concat(double[] a, double[] b) {
        double[] joined = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        return joined;
    }

    private static List<Boolean> verdicts(double[] values) {
        StreamAnomalyDetector d = new StreamAnomalyDetector();
        List<Boolean> out = new ArrayList<>();
        for (double v : values) {
            out.add(d.update(v));
        }
        return out;
    }

    /** Independent median-of-absolute-deviations reference. */
    private static double referenceMad(double[] values) {
        double m = referenceMedian(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - m);
        }
        return referenceMedian(deviations);
    }

    private static double referenceMedian(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
