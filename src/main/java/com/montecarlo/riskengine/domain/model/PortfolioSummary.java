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
public class PortfolioSummary {

    private double portfolioVar;
    private double portfolioCvar;
    private double expectedReturn;
    private double portfolioVolatility;
    private boolean success;
    private String errorMessage;

    public static PortfolioSummary failure(double sentinel, String errorMessage) {
        return PortfolioSummary.builder()
                .portfolioVar(sentinel)
                .portfolioCvar(sentinel)
                .expectedReturn(sentinel)
                .portfolioVolatility(sentinel)
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
