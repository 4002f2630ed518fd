package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Getter
@ToString
@Jacksonized
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PortfolioSpec {

    private final String name;

    @Builder.Default
    private final List<AssetSpec> assets = List.of();

    @Builder.Default
    private final List<Double> weights = List.of();

    private final double[][] correlationMatrix;

    public boolean hasCorrelationMatrix() {
        return correlationMatrix != null;
    }
}
