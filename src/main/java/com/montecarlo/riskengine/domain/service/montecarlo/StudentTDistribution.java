package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.model.DistributionKind;
import lombok.Getter;

@Getter
public final class StudentTDistribution implements Distribution {

    static final int MAX_DEGREES_OF_FREEDOM = 1_000;

    private int degreesOfFreedom;
    private double location;
    private double scale;

    public StudentTDistribution(double degreesOfFreedom, double location, double scale) {
        this.degreesOfFreedom = validateDegreesOfFreedom(degreesOfFreedom);
        validateLocationScale(location, scale);
        this.location = location;
        this.scale = scale;
    }

    public static double scaleForStandardDeviation(int degreesOfFreedom, double stdDev) {
        if (degreesOfFreedom <= 2) return stdDev;
        return stdDev * Math.sqrt((degreesOfFreedom - 2.0) / degreesOfFreedom);
    }

    @Override
    public DistributionKind kind() {
        return DistributionKind.STUDENT_T;
    }

    @Override
    public double sampleWithShock(double shock, RandomSource source) {
        double chiSq = 0.0;
        for (int i = 0; i < degreesOfFreedom; i++) {
            double z = NormalDistribution.standardShock(source);
            chiSq += z * z;
        }
        double t = shock / Math.sqrt(chiSq / degreesOfFreedom);
        if (!Double.isFinite(t)) t = shock;
        return location + scale * t;
    }

    @Override
    public void updateParameters(double[] params) {
        if (params == null || params.length != 3) {
            throw new InvalidInputException("Student-t 파라미터는 [degreesOfFreedom, location, scale] 3개여야 합니다");
        }
        int df = validateDegreesOfFreedom(params[0]);
        validateLocationScale(params[1], params[2]);
        this.degreesOfFreedom = df;
        this.location = params[1];
        this.scale = params[2];
    }

    @Override
    public double[] parameters() {
        return new double[]{degreesOfFreedom, location, scale};
    }

    @Override
    public StudentTDistribution copy() {
        return new StudentTDistribution(degreesOfFreedom, location, scale);
    }

    private static int validateDegreesOfFreedom(double df) {
        if (!Double.isFinite(df) || df < 1 || df > MAX_DEGREES_OF_FREEDOM) {
            throw new InvalidInputException(
                    "자유도(degreesOfFreedom)는 1 이상 " + MAX_DEGREES_OF_FREEDOM + " 이하여야 합니다: " + df);
        }
        if (df != Math.rint(df)) {
            throw new InvalidInputException("자유도(degreesOfFreedom)는 정수여야 합니다: " + df);
        }
        return (int) df;
    }

    private static void validateLocationScale(double location, double scale) {
        if (!Double.isFinite(location) || !Double.isFinite(scale)) {
            throw new InvalidInputException("Student-t 파라미터는 유한값이어야 합니다");
        }
        if (scale < 0) {
            throw new InvalidInputException("척도(scale)는 음수일 수 없습니다: " + scale);
        }
    }
}
