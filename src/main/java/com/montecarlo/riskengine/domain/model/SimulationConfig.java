package com.montecarlo.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@Builder(toBuilder = true)
public class SimulationConfig {

    @Builder.Default
    private final int pathCount = 10_000;

    @Builder.Default
    private final double confidenceLevel = 0.95;

    @Builder.Default
    private final long seed = 0L;

    @Builder.Default
    private final DistributionKind distributionKind = DistributionKind.NORMAL;

    @Builder.Default
    private final List<Double> distributionParameters = List.of();

    @Builder.Default
    private final boolean useAntitheticVariates = false;

    @Builder.Default
    private final boolean useControlVariates = false;

    @Builder.Default
    private final List<Double> reportedConfidenceLevels = List.of();

    public double[] distributionParameterArray() {
        if (distributionParameters == null) return new double[0];
        return distributionParameters.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
