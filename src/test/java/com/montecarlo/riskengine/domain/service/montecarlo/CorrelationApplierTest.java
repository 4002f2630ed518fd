package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CorrelationApplierTest {

    private final CorrelationApplier applier = new CorrelationApplier();

    @Test
    void factorsTwoByTwoMatrix() {
        double[][] lower = applier.choleskyFactor(new double[][]{{1.0, 0.6}, {0.6, 1.0}}, 2);

        assertThat(lower[0][0]).isCloseTo(1.0, within(1e-12));
        assertThat(lower[0][1]).isZero();
        assertThat(lower[1][0]).isCloseTo(0.6, within(1e-12));
        assertThat(lower[1][1]).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void factorReproducesMatrix() {
        double[][] matrix = {
                {1.0, 0.5, 0.3},
                {0.5, 1.0, 0.2},
                {0.3, 0.2, 1.0}
        };

        double[][] lower = applier.choleskyFactor(matrix, 3);

        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                double sum = 0.0;
                for (int k = 0; k < 3; k++) {
                    sum += lower[i][k] * lower[j][k];
                }
                assertThat(sum).as("LLt[%d][%d]", i, j).isCloseTo(matrix[i][j], within(1e-12));
            }
            for (int j = i + 1; j < 3; j++) {
                assertThat(lower[i][j]).isZero();
            }
        }
    }

    static Stream<Arguments> malformedMatrices() {
        return Stream.of(
                Arguments.of("dimension mismatch", new double[][]{{1.0}}, 2),
                Arguments.of("ragged", new double[][]{{1.0, 0.2}, {0.2}}, 2),
                Arguments.of("coefficient above one", new double[][]{{1.0, 1.2}, {1.2, 1.0}}, 2),
                Arguments.of("asymmetric", new double[][]{{1.0, 0.3}, {0.1, 1.0}}, 2),
                Arguments.of("diagonal not one", new double[][]{{2.0, 0.3}, {0.3, 1.0}}, 2),
                Arguments.of("non-finite", new double[][]{{1.0, Double.NaN}, {Double.NaN, 1.0}}, 2)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("malformedMatrices")
    void rejectsMalformedMatrix(String label, double[][] matrix, int assetCount) {
        assertThatThrownBy(() -> applier.choleskyFactor(matrix, assetCount))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsNullMatrix() {
        assertThatThrownBy(() -> applier.validate(null, 2))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsMatrixThatIsNotPositiveSemidefinite() {
        double[][] matrix = {
                {1.0, 0.9, -0.9},
                {0.9, 1.0, 0.9},
                {-0.9, 0.9, 1.0}
        };

        assertThatThrownBy(() -> applier.choleskyFactor(matrix, 3))
                .isInstanceOf(NumericDegeneracyException.class);
    }

    @Test
    void acceptsSingularPerfectCorrelation() {
        double[][] matrix = {{1.0, 1.0}, {1.0, 1.0}};

        assertThatCode(() -> applier.choleskyFactor(matrix, 2)).doesNotThrowAnyException();

        double[][] lower = applier.choleskyFactor(matrix, 2);
        double[][] correlated = applier.correlate(new double[][]{{0.5, -1.0}, {2.0, 3.0}}, lower);
        assertThat(correlated[1]).containsExactly(0.5, -1.0);
    }

    @Test
    void correlatedShocksCarryTargetCorrelation() {
        int count = 40_000;
        RandomSource root = new RandomSource(21L);
        RandomSource first = root.split();
        RandomSource second = root.split();
        double[][] independent = new double[2][count];
        for (int i = 0; i < count; i++) {
            independent[0][i] = NormalDistribution.standardShock(first);
            independent[1][i] = NormalDistribution.standardShock(second);
        }

        double[][] lower = applier.choleskyFactor(new double[][]{{1.0, 0.7}, {0.7, 1.0}}, 2);
        double[][] correlated = applier.correlate(independent, lower);

        assertThat(correlated[0]).containsExactly(independent[0]);
        assertThat(EngineFixtures.correlation(correlated[0], correlated[1])).isCloseTo(0.7, within(0.02));
    }

    @Test
    void estimatesPerfectCorrelationFromHistory() {
        double[] x = {0.01, -0.02, 0.03, 0.00, -0.01};
        double[] y = new double[x.length];
        double[] z = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 2.0 * x[i] + 0.001;
            z[i] = -x[i];
        }

        double[][] corr = applier.estimateCorrelationMatrix(List.of(x, y, z));

        assertThat(corr[0][0]).isEqualTo(1.0);
        assertThat(corr[0][1]).isCloseTo(1.0, within(1e-12));
        assertThat(corr[0][2]).isCloseTo(-1.0, within(1e-12));
        assertThat(corr[2][1]).isEqualTo(corr[1][2]);
    }

    @Test
    void estimationRejectsConstantHistory() {
        assertThatThrownBy(() -> applier.estimateCorrelationMatrix(
                List.of(new double[]{0.5, 0.5, 0.5}, new double[]{0.1, 0.2, 0.3})))
                .isInstanceOf(NumericDegeneracyException.class);
    }
}
