package com.montecarlo.riskengine.domain.service.montecarlo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TailEstimator {

    static final double NU_FLOOR = 3.0;
    static final double NU_CEILING = 30.0;
    static final int MIN_SAMPLES = 30;

    private final StatisticsEngine statisticsEngine;

    public boolean canEstimate(double[] returns) {
        return returns != null && returns.length >= MIN_SAMPLES;
    }

    public int estimateDegreesOfFreedom(double[] returns) {
        if (!canEstimate(returns)) {
            log.debug("[TailEstimator] 데이터 부족: samples={}, fallback nu={}",
                    returns == null ? 0 : returns.length, NU_CEILING);
            return (int) NU_CEILING;
        }

        double kurtosis = statisticsEngine.populationExcessKurtosis(returns);

        double nu;
        if (kurtosis <= 0) {
            nu = NU_CEILING;
        } else {
            nu = 6.0 / kurtosis + 4.0;
        }

        nu = Math.max(NU_FLOOR, Math.min(NU_CEILING, nu));

        log.debug("[TailEstimator] kurtosis={}, nu={}, samples={}",
                String.format("%.4f", kurtosis), String.format("%.2f", nu), returns.length);

        return (int) Math.round(nu);
    }
}
