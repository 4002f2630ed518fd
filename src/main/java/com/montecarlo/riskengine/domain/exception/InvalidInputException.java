package com.montecarlo.riskengine.domain.exception;

import com.montecarlo.riskengine.domain.model.ErrorCategory;

public class InvalidInputException extends SimulationException {

    public InvalidInputException(String message) {
        super(ErrorCategory.INVALID_INPUT, message);
    }
}
