package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SingleAssetSummary {

    private double var;
    private double cvar;
    private double mean;
    private double standardDeviation;
    private double skewness;
    private double kurtosis;
    private boolean success;
    private String errorMessage;

    public static SingleAssetSummary failure(double sentinel, String errorMessage) {
        return SingleAssetSummary.builder()
                .var(sentinel)
                .cvar(sentinel)
                .mean(sentinel)
                .standardDeviation(sentinel)
                .skewness(sentinel)
                .kurtosis(sentinel)
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
