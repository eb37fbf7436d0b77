package com.pulseguard.core.simulation;

import com.pulseguard.core.config.SimulationSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SyntheticSignalSource}.
 */
class SyntheticSignalSourceTest {

    @Test
    @DisplayName("Same seed produces the same labeled sequence")
    void shouldBeReproducible() {
        SyntheticSignalSource a = new SyntheticSignalSource(settings(99L, 0.1, 0.5));
        SyntheticSignalSource b = new SyntheticSignalSource(settings(99L, 0.1, 0.5));

        for (int i = 0; i < 500; i++) {
            LabeledSample x = a.next();
            LabeledSample y = b.next();
            assertThat(x.getIndex()).isEqualTo(i);
            assertThat(x.getValue()).isEqualTo(y.getValue());
            assertThat(x.isAnomalous()).isEqualTo(y.isAnomalous());
        }
    }

    @Test
    @DisplayName("Without noise or anomalies the signal is the clean seasonal pattern")
    void shouldProduceCleanSignal() {
        SyntheticSignalSource source = new SyntheticSignalSource(settings(1L, 0.0, 0.0));

        for (int t = 0; t < 300; t++) {
            LabeledSample sample = source.next();
            assertThat(sample.isAnomalous()).isFalse();
            assertThat(sample.getValue()).isCloseTo(clean(t), within(1e-12));
        }
    }

    @Test
    @DisplayName("Injected anomalies are at least 5 away from the clean signal")
    void shouldInjectVisibleAnomalies() {
        SyntheticSignalSource source = new SyntheticSignalSource(settings(4L, 1.0, 0.0));

        for (int t = 0; t < 300; t++) {
            LabeledSample sample = source.next();
            double offset = Math.abs(sample.getValue() - clean(t));
            assertThat(sample.isAnomalous()).isTrue();
            assertThat(offset).isBetween(5.0 - 1e-9, 20.0 + 1e-9);
        }
    }

    @Test
    @DisplayName("The source never ends")
    void shouldAlwaysHaveNext() {
        SyntheticSignalSource source = new SyntheticSignalSource(new SimulationSettings());
        assertThat(source.hasNext()).isTrue();
        source.next();
        assertThat(source.hasNext()).isTrue();
    }

    @Test
    @DisplayName("Should validate settings on construction")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new SyntheticSignalSource(settings(1L, -0.5, 0.5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("anomalyProbability");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static SimulationSettings settings(long seed, double probability, double noise) {
        SimulationSettings settings = new SimulationSettings();
        settings.setSeed(seed);
        settings.setAnomalyProbability(probability);
        settings.setNoiseStdDev(noise);
        return settings;
    }

    private static double clean(int t) {
        return 10 * Math.sin(0.01 * t) + Math.sin(0.1 * t);
    }
}
