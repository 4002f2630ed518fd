package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StudentTDistributionTest {

    private static double[] sample(StudentTDistribution distribution, long seed, int count) {
        RandomSource source = new RandomSource(seed);
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = distribution.sample(source);
        }
        return values;
    }

    @Test
    void rejectsFractionalDegreesOfFreedom() {
        assertThatThrownBy(() -> new StudentTDistribution(4.5, 0.0, 1.0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("정수");
    }

    @Test
    void rejectsOutOfRangeDegreesOfFreedom() {
        assertThatThrownBy(() -> new StudentTDistribution(0, 0.0, 1.0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new StudentTDistribution(5_000, 0.0, 1.0))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void zeroShockReturnsLocation() {
        StudentTDistribution t = new StudentTDistribution(5, 0.03, 0.5);

        assertThat(t.sampleWithShock(0.0, new RandomSource(1L))).isEqualTo(0.03);
    }

    @Test
    void sampleMeanTracksLocation() {
        double[] values = sample(new StudentTDistribution(10, 0.5, 0.1), 8L, 40_000);

        assertThat(new StatisticsEngine().mean(values)).isCloseTo(0.5, within(0.005));
    }

    @Test
    void lowDegreesOfFreedomProduceFatTails() {
        double[] values = sample(new StudentTDistribution(3, 0.0, 1.0), 21L, 50_000);

        assertThat(new StatisticsEngine().excessKurtosis(values)).isGreaterThan(1.0);
    }

    @Test
    void scaleMatchesTargetStandardDeviation() {
        assertThat(StudentTDistribution.scaleForStandardDeviation(5, 0.2))
                .isCloseTo(0.2 * Math.sqrt(3.0 / 5.0), within(1e-15));
        assertThat(StudentTDistribution.scaleForStandardDeviation(2, 0.2)).isEqualTo(0.2);
    }

    @Test
    void updateParametersRequiresThreeValues() {
        StudentTDistribution t = new StudentTDistribution(5, 0.0, 1.0);

        assertThatThrownBy(() -> t.updateParameters(new double[]{5, 0.0}))
                .isInstanceOf(InvalidInputException.class);

        t.updateParameters(new double[]{7, 0.1, 0.2});
        assertThat(t.parameters()).containsExactly(7.0, 0.1, 0.2);
    }
}
