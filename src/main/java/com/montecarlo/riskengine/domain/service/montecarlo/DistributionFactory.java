package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.model.DistributionKind;
import com.montecarlo.riskengine.domain.service.VolatilityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Slf4j
@Component
@RequiredArgsConstructor
public class DistributionFactory {

    private final MonteCarloProperties properties;
    private final VolatilityProperties volatilityProperties;

    public Distribution create(DistributionKind kind, double[] params) {
        if (kind == null) {
            throw new InvalidInputException("분포 유형(distributionKind)은 필수입니다");
        }
        double[] p = params != null ? params : new double[0];

        Distribution distribution = switch (kind) {
            case NORMAL -> new NormalDistribution(
                    param(p, 0, 0.0),
                    param(p, 1, 1.0));
            case STUDENT_T -> new StudentTDistribution(
                    param(p, 0, properties.getDegreesOfFreedom()),
                    param(p, 1, 0.0),
                    param(p, 2, 1.0));
            case GARCH -> new GarchDistribution(
                    param(p, 0, volatilityProperties.getGarchOmega()),
                    param(p, 1, volatilityProperties.getGarchAlpha()),
                    param(p, 2, volatilityProperties.getGarchBeta()));
        };

        log.debug("[Distribution] 생성: kind={}, params={}", kind, Arrays.toString(distribution.parameters()));
        return distribution;
    }

    private static double param(double[] params, int index, double fallback) {
        return params.length > index ? params[index] : fallback;
    }
}
