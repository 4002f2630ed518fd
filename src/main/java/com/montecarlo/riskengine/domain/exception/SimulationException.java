package com.montecarlo.riskengine.domain.exception;

import com.montecarlo.riskengine.domain.model.ErrorCategory;
import lombok.Getter;

@Getter
public abstract class SimulationException extends RuntimeException {

    private final ErrorCategory category;

    protected SimulationException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }
}
