package com.montecarlo.riskengine.domain.model;

public record SimulationFailure(ErrorCategory category, String message) {
}
