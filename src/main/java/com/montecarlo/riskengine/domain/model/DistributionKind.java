package com.montecarlo.riskengine.domain.model;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;

public enum DistributionKind {
    NORMAL(0),
    STUDENT_T(1),
    GARCH(2);

    private final int code;

    DistributionKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static DistributionKind fromCode(int code) {
        return switch (code) {
            case 0 -> NORMAL;
            case 1 -> STUDENT_T;
            case 2 -> GARCH;
            case 3, 4 -> throw new InvalidInputException("지원하지 않는 분포 유형입니다 (copula/custom): code=" + code);
            default -> throw new InvalidInputException("알 수 없는 분포 코드: " + code);
        };
    }
}
