package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;
import java.util.List;

@Getter
@ToString
@Jacksonized
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetSpec {

    private final String symbol;

    @Builder.Default
    private final double initialPrice = 1.0;

    private final double expectedReturn;

    private final double volatility;

    @Builder.Default
    private final List<Double> historicalReturns = List.of();

    public boolean hasHistory() {
        return historicalReturns != null && !historicalReturns.isEmpty();
    }

    public double[] historicalReturnArray() {
        if (historicalReturns == null) return new double[0];
        return historicalReturns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static AssetSpec fromHistory(String symbol, double[] historicalReturns) {
        return AssetSpec.builder()
                .symbol(symbol)
                .historicalReturns(historicalReturns == null
                        ? List.of()
                        : Arrays.stream(historicalReturns).boxed().toList())
                .build();
    }
}
