package com.montecarlo.riskengine.domain.model;

public enum ScenarioType {
    SINGLE_ASSET, PORTFOLIO, STRESS_TEST;

    public String tag() {
        return name().toLowerCase();
    }
}
