package com.montecarlo.riskengine.domain.model;

public enum ErrorCategory {
    INVALID_INPUT,
    NUMERIC_DEGENERACY,
    INTERNAL_FAILURE
}
