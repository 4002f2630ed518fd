package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskStatistics {

    private int sampleSize;
    private double mean;
    private double standardDeviation;
    private double skewness;
    private double excessKurtosis;
    private List<PercentilePoint> percentiles;
    private double confidenceLevel;
    private double valueAtRisk;
    private double conditionalValueAtRisk;
    private List<TailRiskPoint> tailRisk;

    public double percentile(double probability) {
        return percentiles.stream()
                .filter(p -> Double.compare(p.getProbability(), probability) == 0)
                .findFirst()
                .map(PercentilePoint::getValue)
                .orElseThrow(() -> new IllegalArgumentException("ladder has no probability " + probability));
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PercentilePoint {
        private double probability;
        private double value;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TailRiskPoint {
        private double confidenceLevel;
        private double valueAtRisk;
        private double conditionalValueAtRisk;
    }
}
