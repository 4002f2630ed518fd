package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.model.DistributionKind;

public sealed interface Distribution permits NormalDistribution, StudentTDistribution, GarchDistribution {

    DistributionKind kind();

    default double sample(RandomSource source) {
        return sampleWithShock(NormalDistribution.standardShock(source), source);
    }

    double sampleWithShock(double shock, RandomSource source);

    void updateParameters(double[] params);

    double[] parameters();

    Distribution copy();
}
