package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationOutcome {

    private ScenarioType scenario;
    private String symbol;
    private boolean success;
    private ErrorCategory errorCategory;
    private String errorMessage;
    private DistributionKind distributionKind;
    private int pathCount;
    private double effectiveExpectedReturn;
    private double effectiveVolatility;
    private ReturnPath returnPath;
    private double[] simulatedPrices;
    private RiskStatistics statistics;
    private long timestamp;
    private long calcDurationMicros;

    public static SimulationOutcome failure(ScenarioType scenario, String symbol, SimulationFailure failure) {
        return SimulationOutcome.builder()
                .scenario(scenario)
                .symbol(symbol)
                .success(false)
                .errorCategory(failure.category())
                .errorMessage(failure.message())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public double getValueAtRisk() {
        return statistics != null ? statistics.getValueAtRisk() : Double.NaN;
    }

    public double getConditionalValueAtRisk() {
        return statistics != null ? statistics.getConditionalValueAtRisk() : Double.NaN;
    }
}
