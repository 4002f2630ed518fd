package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GarchDistributionTest {

    @Test
    void firstDrawUsesUnconditionalVariance() {
        GarchDistribution garch = new GarchDistribution(0.0001, 0.1, 0.85);

        assertThat(garch.unconditionalVariance()).isCloseTo(0.002, within(1e-15));
        assertThat(garch.getCurrentVariance()).isCloseTo(0.002, within(1e-15));
    }

    @Test
    void varianceFollowsRecursionAfterEachDraw() {
        GarchDistribution garch = new GarchDistribution(0.0001, 0.1, 0.85);

        double r = garch.sampleWithShock(1.5, new RandomSource(1L));

        assertThat(r).isCloseTo(Math.sqrt(0.002) * 1.5, within(1e-15));
        assertThat(garch.getCurrentVariance())
                .isCloseTo(0.0001 + 0.1 * r * r + 0.85 * 0.002, within(1e-15));
        assertThat(garch.getSamplesDrawn()).isEqualTo(1);
    }

    @Test
    void rejectsNonStationaryPersistence() {
        assertThatThrownBy(() -> new GarchDistribution(0.0001, 0.2, 0.8))
                .isInstanceOf(NumericDegeneracyException.class);
        assertThatThrownBy(() -> new GarchDistribution(-0.0001, 0.1, 0.8))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void updateParametersIsRejectedMidPath() {
        GarchDistribution garch = new GarchDistribution(0.0001, 0.1, 0.85);
        garch.sample(new RandomSource(2L));

        assertThatThrownBy(() -> garch.updateParameters(new double[]{0.0002, 0.05, 0.9}))
                .isInstanceOf(IllegalStateException.class);

        garch.reset();
        garch.updateParameters(new double[]{0.0002, 0.05, 0.9});
        assertThat(garch.getCurrentVariance()).isCloseTo(0.0002 / 0.05, within(1e-15));
    }

    @Test
    void copyStartsFromUnconditionalVariance() {
        GarchDistribution garch = new GarchDistribution(0.0001, 0.1, 0.85);
        RandomSource source = new RandomSource(4L);
        for (int i = 0; i < 100; i++) {
            garch.sample(source);
        }

        GarchDistribution copy = garch.copy();

        assertThat(copy.getCurrentVariance()).isCloseTo(0.002, within(1e-15));
        assertThat(copy.getSamplesDrawn()).isZero();
    }

    @Test
    void squaredReturnsAreSeriallyCorrelated() {
        GarchDistribution garch = new GarchDistribution(0.0001, 0.1, 0.85);
        RandomSource source = new RandomSource(17L);
        int n = 50_000;
        double[] current = new double[n - 1];
        double[] next = new double[n - 1];
        double previous = garch.sample(source);
        for (int i = 0; i < n - 1; i++) {
            double r = garch.sample(source);
            current[i] = previous * previous;
            next[i] = r * r;
            previous = r;
        }

        assertThat(EngineFixtures.correlation(current, next)).isGreaterThan(0.05);
    }
}
