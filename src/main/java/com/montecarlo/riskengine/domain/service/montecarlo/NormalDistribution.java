package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.model.DistributionKind;
import lombok.Getter;

@Getter
public final class NormalDistribution implements Distribution {

    static final double MIN_UNIFORM = 1e-10;

    private double mean;
    private double stdDev;

    public NormalDistribution(double mean, double stdDev) {
        validate(mean, stdDev);
        this.mean = mean;
        this.stdDev = stdDev;
    }

    public static double standardShock(RandomSource source) {
        double u1 = source.generate();
        double u2 = source.generate();
        if (u1 < MIN_UNIFORM) u1 = MIN_UNIFORM;
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
    }

    @Override
    public DistributionKind kind() {
        return DistributionKind.NORMAL;
    }

    @Override
    public double sampleWithShock(double shock, RandomSource source) {
        return mean + stdDev * shock;
    }

    @Override
    public void updateParameters(double[] params) {
        if (params == null || params.length != 2) {
            throw new InvalidInputException("정규분포 파라미터는 [mean, stdDev] 2개여야 합니다");
        }
        validate(params[0], params[1]);
        this.mean = params[0];
        this.stdDev = params[1];
    }

    @Override
    public double[] parameters() {
        return new double[]{mean, stdDev};
    }

    @Override
    public NormalDistribution copy() {
        return new NormalDistribution(mean, stdDev);
    }

    private static void validate(double mean, double stdDev) {
        if (!Double.isFinite(mean) || !Double.isFinite(stdDev)) {
            throw new InvalidInputException("정규분포 파라미터는 유한값이어야 합니다");
        }
        if (stdDev < 0) {
            throw new InvalidInputException("표준편차(stdDev)는 음수일 수 없습니다: " + stdDev);
        }
    }
}
