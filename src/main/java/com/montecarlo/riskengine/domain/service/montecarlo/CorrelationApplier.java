package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class CorrelationApplier {

    static final double TOLERANCE = 1e-9;
    static final double PIVOT_TOLERANCE = 1e-10;

    public void validate(double[][] matrix, int assetCount) {
        if (matrix == null) {
            throw new InvalidInputException("상관행렬이 null입니다");
        }
        if (matrix.length != assetCount) {
            throw new InvalidInputException(
                    "상관행렬 차원이 자산 수와 다릅니다: rows=" + matrix.length + ", assets=" + assetCount);
        }
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i] == null || matrix[i].length != matrix.length) {
                throw new InvalidInputException("상관행렬은 정방행렬이어야 합니다: row " + i);
            }
        }
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix.length; j++) {
                double v = matrix[i][j];
                if (!Double.isFinite(v)) {
                    throw new InvalidInputException("상관행렬에 유한하지 않은 값이 있습니다: [" + i + "][" + j + "]");
                }
                if (i == j && Math.abs(v - 1.0) > TOLERANCE) {
                    throw new InvalidInputException("상관행렬 대각 원소는 1이어야 합니다: [" + i + "][" + i + "]=" + v);
                }
                if (i != j && Math.abs(v) > 1.0 + TOLERANCE) {
                    throw new InvalidInputException("상관계수 절댓값은 1 이하여야 합니다: [" + i + "][" + j + "]=" + v);
                }
                if (Math.abs(v - matrix[j][i]) > TOLERANCE) {
                    throw new InvalidInputException("상관행렬은 대칭이어야 합니다: [" + i + "][" + j + "]");
                }
            }
        }
    }

    public double[][] choleskyFactor(double[][] matrix, int assetCount) {
        validate(matrix, assetCount);

        int n = matrix.length;
        double[][] lower = new double[n][n];

        for (int j = 0; j < n; j++) {
            double pivot = matrix[j][j];
            for (int k = 0; k < j; k++) {
                pivot -= lower[j][k] * lower[j][k];
            }
            if (pivot < -PIVOT_TOLERANCE) {
                throw new NumericDegeneracyException(
                        "상관행렬이 양의 준정부호가 아닙니다: pivot[" + j + "]=" + pivot);
            }
            double diag = pivot > PIVOT_TOLERANCE ? Math.sqrt(pivot) : 0.0;
            lower[j][j] = diag;

            for (int i = j + 1; i < n; i++) {
                double sum = matrix[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= lower[i][k] * lower[j][k];
                }
                if (diag > 0.0) {
                    lower[i][j] = sum / diag;
                } else if (Math.abs(sum) > TOLERANCE) {
                    throw new NumericDegeneracyException(
                            "상관행렬이 양의 준정부호가 아닙니다: 특이 pivot[" + j + "]에서 잔차 " + sum);
                }
            }
        }

        log.debug("[Correlation] Cholesky 분해 완료: n={}", n);
        return lower;
    }

    public double[][] correlate(double[][] independentShocks, double[][] lower) {
        int assets = independentShocks.length;
        if (lower.length != assets) {
            throw new InvalidInputException("Cholesky 인자 차원이 자산 수와 다릅니다");
        }
        int count = independentShocks[0].length;
        for (double[] row : independentShocks) {
            if (row.length != count) {
                throw new InvalidInputException("자산별 충격 길이가 서로 다릅니다");
            }
        }

        double[][] correlated = new double[assets][count];
        for (int sim = 0; sim < count; sim++) {
            for (int i = 0; i < assets; i++) {
                double sum = 0.0;
                for (int k = 0; k <= i; k++) {
                    sum += lower[i][k] * independentShocks[k][sim];
                }
                correlated[i][sim] = sum;
            }
        }
        return correlated;
    }

    public double[][] estimateCorrelationMatrix(List<double[]> samples) {
        int n = samples.size();
        if (n == 0) {
            throw new InvalidInputException("상관행렬 추정에 사용할 표본이 없습니다");
        }
        int length = samples.get(0).length;
        for (double[] s : samples) {
            if (s.length != length) {
                throw new InvalidInputException("상관행렬 추정에는 길이가 같은 표본이 필요합니다");
            }
        }
        if (length < 2) {
            throw new NumericDegeneracyException("상관행렬 추정에는 2개 이상의 관측치가 필요합니다");
        }

        double[] means = new double[n];
        double[] stdevs = new double[n];
        for (int a = 0; a < n; a++) {
            double[] s = samples.get(a);
            double sum = 0.0;
            for (double v : s) sum += v;
            means[a] = sum / length;
            double sq = 0.0;
            for (double v : s) sq += (v - means[a]) * (v - means[a]);
            stdevs[a] = Math.sqrt(sq / (length - 1));
            if (stdevs[a] == 0.0) {
                throw new NumericDegeneracyException("분산이 0인 표본으로는 상관계수를 계산할 수 없습니다: asset " + a);
            }
        }

        double[][] corr = new double[n][n];
        for (int i = 0; i < n; i++) {
            corr[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double cov = 0.0;
                double[] x = samples.get(i);
                double[] y = samples.get(j);
                for (int t = 0; t < length; t++) {
                    cov += (x[t] - means[i]) * (y[t] - means[j]);
                }
                cov /= (length - 1);
                double rho = Math.max(-1.0, Math.min(1.0, cov / (stdevs[i] * stdevs[j])));
                corr[i][j] = rho;
                corr[j][i] = rho;
            }
        }
        return corr;
    }
}
