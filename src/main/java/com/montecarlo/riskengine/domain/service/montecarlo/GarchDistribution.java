package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import com.montecarlo.riskengine.domain.model.DistributionKind;
import lombok.Getter;

@Getter
public final class GarchDistribution implements Distribution {

    private double omega;
    private double alpha;
    private double beta;
    private double currentVariance;
    private int samplesDrawn;

    public GarchDistribution(double omega, double alpha, double beta) {
        validate(omega, alpha, beta);
        this.omega = omega;
        this.alpha = alpha;
        this.beta = beta;
        reset();
    }

    public double persistence() {
        return alpha + beta;
    }

    public double unconditionalVariance() {
        return omega / (1.0 - persistence());
    }

    public void reset() {
        this.currentVariance = unconditionalVariance();
        this.samplesDrawn = 0;
    }

    @Override
    public DistributionKind kind() {
        return DistributionKind.GARCH;
    }

    @Override
    public double sampleWithShock(double shock, RandomSource source) {
        double r = Math.sqrt(currentVariance) * shock;
        currentVariance = omega + alpha * r * r + beta * currentVariance;
        samplesDrawn++;
        return r;
    }

    @Override
    public void updateParameters(double[] params) {
        if (samplesDrawn > 0) {
            throw new IllegalStateException(
                    "GARCH 파라미터는 경로 진행 중 변경할 수 없습니다 (samplesDrawn=" + samplesDrawn + ")");
        }
        if (params == null || params.length != 3) {
            throw new InvalidInputException("GARCH 파라미터는 [omega, alpha, beta] 3개여야 합니다");
        }
        validate(params[0], params[1], params[2]);
        this.omega = params[0];
        this.alpha = params[1];
        this.beta = params[2];
        reset();
    }

    @Override
    public double[] parameters() {
        return new double[]{omega, alpha, beta};
    }

    @Override
    public GarchDistribution copy() {
        return new GarchDistribution(omega, alpha, beta);
    }

    private static void validate(double omega, double alpha, double beta) {
        if (!Double.isFinite(omega) || !Double.isFinite(alpha) || !Double.isFinite(beta)) {
            throw new InvalidInputException("GARCH 파라미터는 유한값이어야 합니다");
        }
        if (omega < 0 || alpha < 0 || beta < 0) {
            throw new InvalidInputException(
                    "GARCH 파라미터는 음수일 수 없습니다: omega=" + omega + ", alpha=" + alpha + ", beta=" + beta);
        }
        if (alpha + beta >= 1.0) {
            throw new NumericDegeneracyException(
                    "GARCH 정상성 조건 위반: alpha + beta = " + (alpha + beta) + " (1 미만이어야 함)");
        }
    }
}
