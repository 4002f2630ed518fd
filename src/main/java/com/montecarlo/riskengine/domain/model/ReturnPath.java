package com.montecarlo.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public final class ReturnPath {

    private final double[] returns;

    @JsonCreator
    public ReturnPath(double[] returns) {
        this.returns = returns.clone();
    }

    public int size() {
        return returns.length;
    }

    public double get(int index) {
        return returns[index];
    }

    @JsonValue
    public double[] toArray() {
        return returns.clone();
    }

    public double[] projectPrices(double initialPrice) {
        double[] prices = new double[returns.length];
        for (int i = 0; i < returns.length; i++) {
            prices[i] = initialPrice * Math.exp(returns[i]);
        }
        return prices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReturnPath other)) return false;
        return Arrays.equals(returns, other.returns);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(returns);
    }

    @Override
    public String toString() {
        return "ReturnPath(size=" + returns.length + ")";
    }
}
