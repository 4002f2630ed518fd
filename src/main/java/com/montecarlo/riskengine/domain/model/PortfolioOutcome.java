package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PortfolioOutcome {

    private String portfolioName;
    private boolean success;
    private ErrorCategory errorCategory;
    private String errorMessage;
    private DistributionKind distributionKind;
    private int pathCount;
    private boolean correlated;
    private List<Double> normalizedWeights;
    private ReturnPath portfolioReturns;
    private double[] portfolioValues;
    private RiskStatistics statistics;
    private double portfolioVar;
    private double portfolioCvar;
    private double expectedReturn;
    private double portfolioVolatility;
    private List<SimulationOutcome> assetOutcomes;
    private List<AssetContribution> varContributions;
    private long timestamp;
    private long calcDurationMicros;

    public static PortfolioOutcome failure(String portfolioName, SimulationFailure failure) {
        return PortfolioOutcome.builder()
                .portfolioName(portfolioName)
                .success(false)
                .errorCategory(failure.category())
                .errorMessage(failure.message())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssetContribution {
        private String symbol;
        private double weight;
        private double assetVar;
        private double varContribution;
    }
}
