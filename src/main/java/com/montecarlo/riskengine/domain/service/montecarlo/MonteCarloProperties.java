package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.model.DistributionKind;
import com.montecarlo.riskengine.domain.model.SimulationConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "montecarlo")
public class MonteCarloProperties {

    private int pathCount = 10_000;
    private double confidenceLevel = 0.95;
    private long seed = 0L;
    private DistributionKind distribution = DistributionKind.NORMAL;
    private double degreesOfFreedom = 5.0;
    private boolean useAntitheticVariates = false;
    private boolean useControlVariates = false;
    private List<Double> reportedConfidenceLevels = List.of(0.95, 0.99);
    private boolean parallelAssets = true;
    private int workerThreads = 0;
    private int maxPathCount = 5_000_000;
    private boolean estimateDegreesOfFreedom = false;
    private boolean estimateCorrelation = false;

    public int resolvedWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public SimulationConfig.SimulationConfigBuilder configBuilder() {
        return SimulationConfig.builder()
                .pathCount(pathCount)
                .confidenceLevel(confidenceLevel)
                .seed(seed)
                .distributionKind(distribution)
                .useAntitheticVariates(useAntitheticVariates)
                .useControlVariates(useControlVariates)
                .reportedConfidenceLevels(reportedConfidenceLevels);
    }
}
