package com.montecarlo.riskengine.domain.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GarchEstimator {

    static final int MIN_SAMPLES = 30;

    private final VolatilityProperties properties;

    @Getter
    public static class GarchFit {
        private final double alpha;
        private final double beta;
        private final double logLikelihood;

        public GarchFit(double alpha, double beta, double logLikelihood) {
            this.alpha = alpha;
            this.beta = beta;
            this.logLikelihood = logLikelihood;
        }

        public double omegaFor(double sampleVariance) {
            return sampleVariance * (1.0 - alpha - beta);
        }
    }

    public boolean canFit(double[] returns) {
        return properties.isGarchAutoFit() && returns != null && returns.length >= MIN_SAMPLES;
    }

    public GarchFit fit(double[] returns) {
        if (returns == null || returns.length < MIN_SAMPLES) {
            return new GarchFit(properties.getGarchAlpha(), properties.getGarchBeta(), Double.NaN);
        }

        double sampleVar = sampleVariance(returns);
        double bestAlpha = properties.getGarchAlpha();
        double bestBeta = properties.getGarchBeta();
        double bestLL = Double.NEGATIVE_INFINITY;

        for (int ai = 1; ai <= 20; ai++) {
            double a = ai / 100.0;
            for (int bi = 70; bi <= 98; bi++) {
                double b = bi / 100.0;
                if (a + b >= 1.0) continue;

                double omega = sampleVar * (1.0 - a - b);
                double ll = logLikelihood(returns, omega, a, b);

                if (ll > bestLL) {
                    bestLL = ll;
                    bestAlpha = a;
                    bestBeta = b;
                }
            }
        }

        log.debug("[GARCH] quasi-MLE 완료: α={}, β={}, LL={}, n={}",
                String.format("%.3f", bestAlpha), String.format("%.3f", bestBeta),
                String.format("%.2f", bestLL), returns.length);
        return new GarchFit(bestAlpha, bestBeta, bestLL);
    }

    double logLikelihood(double[] returns, double omega, double alpha, double beta) {
        double variance = returns[0] * returns[0];
        double ll = 0.0;

        for (int i = 1; i < returns.length; i++) {
            double r = returns[i];
            variance = omega + alpha * returns[i - 1] * returns[i - 1] + beta * variance;
            if (variance <= 0) return Double.NEGATIVE_INFINITY;
            ll += -0.5 * (Math.log(variance) + r * r / variance);
        }
        return ll;
    }

    private double sampleVariance(double[] returns) {
        double sum = 0.0;
        for (double r : returns) sum += r;
        double mean = sum / returns.length;

        double sumSq = 0.0;
        for (double r : returns) {
            double diff = r - mean;
            sumSq += diff * diff;
        }
        return sumSq / (returns.length - 1);
    }
}
