package com.montecarlo.riskengine.domain.exception;

import com.montecarlo.riskengine.domain.model.ErrorCategory;

public class NumericDegeneracyException extends SimulationException {

    public NumericDegeneracyException(String message) {
        super(ErrorCategory.NUMERIC_DEGENERACY, message);
    }
}
