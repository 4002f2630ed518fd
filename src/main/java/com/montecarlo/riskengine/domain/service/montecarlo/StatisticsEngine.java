package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import com.montecarlo.riskengine.domain.model.RiskStatistics;
import com.montecarlo.riskengine.domain.model.RiskStatistics.PercentilePoint;
import com.montecarlo.riskengine.domain.model.RiskStatistics.TailRiskPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Component
public class StatisticsEngine {

    static final double[] LADDER_PROBABILITIES = {0.01, 0.05, 0.10, 0.25, 0.50, 0.75, 0.90, 0.95, 0.99};

    // (1 - 0.9) * 10 evaluates to 0.9999999999999998
    static final double INDEX_EPSILON = 1e-9;

    public RiskStatistics compute(double[] sample, double confidenceLevel) {
        return compute(sample, confidenceLevel, List.of());
    }

    public RiskStatistics compute(double[] sample, double confidenceLevel, List<Double> reportedConfidenceLevels) {
        validateSample(sample);
        validateConfidence(confidenceLevel);
        requireVarianceSample(sample);

        double[] sorted = sorted(sample);
        double mean = mean(sample);
        double stdev = Math.sqrt(sampleVariance(sample, mean));

        List<TailRiskPoint> tailRisk = new ArrayList<>();
        if (reportedConfidenceLevels != null) {
            for (Double level : reportedConfidenceLevels) {
                validateConfidence(level);
                tailRisk.add(TailRiskPoint.builder()
                        .confidenceLevel(level)
                        .valueAtRisk(varFromSorted(sorted, level))
                        .conditionalValueAtRisk(cvarFromSorted(sorted, level))
                        .build());
            }
        }

        return RiskStatistics.builder()
                .sampleSize(sample.length)
                .mean(mean)
                .standardDeviation(stdev)
                .skewness(standardizedMoment(sample, mean, stdev, 3))
                .excessKurtosis(standardizedMoment(sample, mean, stdev, 4) - (stdev == 0 ? 0.0 : 3.0))
                .percentiles(ladderFromSorted(sorted))
                .confidenceLevel(confidenceLevel)
                .valueAtRisk(varFromSorted(sorted, confidenceLevel))
                .conditionalValueAtRisk(cvarFromSorted(sorted, confidenceLevel))
                .tailRisk(tailRisk)
                .build();
    }

    public double mean(double[] sample) {
        validateSample(sample);
        double sum = 0.0;
        for (double v : sample) sum += v;
        return sum / sample.length;
    }

    public double standardDeviation(double[] sample) {
        validateSample(sample);
        requireVarianceSample(sample);
        return Math.sqrt(sampleVariance(sample, mean(sample)));
    }

    public double excessKurtosis(double[] sample) {
        validateSample(sample);
        requireVarianceSample(sample);
        double mean = mean(sample);
        double stdev = Math.sqrt(sampleVariance(sample, mean));
        if (stdev == 0) return 0.0;
        return standardizedMoment(sample, mean, stdev, 4) - 3.0;
    }

    public double populationExcessKurtosis(double[] data) {
        int n = data.length;
        double mean = 0;
        for (double v : data) mean += v;
        mean /= n;

        double m2 = 0, m4 = 0;
        for (double v : data) {
            double d = v - mean;
            double d2 = d * d;
            m2 += d2;
            m4 += d2 * d2;
        }
        m2 /= n;
        m4 /= n;

        if (m2 == 0) return 0;
        return (m4 / (m2 * m2)) - 3.0;
    }

    public List<PercentilePoint> percentileLadder(double[] sample) {
        validateSample(sample);
        return ladderFromSorted(sorted(sample));
    }

    public double valueAtRisk(double[] sample, double confidenceLevel) {
        validateSample(sample);
        validateConfidence(confidenceLevel);
        return varFromSorted(sorted(sample), confidenceLevel);
    }

    public double conditionalValueAtRisk(double[] sample, double confidenceLevel) {
        validateSample(sample);
        validateConfidence(confidenceLevel);
        return cvarFromSorted(sorted(sample), confidenceLevel);
    }

    public double percentileFromSorted(double[] sorted, double probability) {
        int index = clampIndex((int) Math.floor(probability * (sorted.length - 1) + INDEX_EPSILON), sorted.length);
        return sorted[index];
    }

    public double sampleCovariance(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) {
            throw new NumericDegeneracyException("공분산 계산에는 길이가 같은 2개 이상의 표본이 필요합니다");
        }
        double mx = mean(x);
        double my = mean(y);
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += (x[i] - mx) * (y[i] - my);
        }
        return sum / (x.length - 1);
    }

    static int tailIndex(int n, double confidenceLevel) {
        return clampIndex((int) Math.floor((1.0 - confidenceLevel) * n + INDEX_EPSILON), n);
    }

    private List<PercentilePoint> ladderFromSorted(double[] sorted) {
        List<PercentilePoint> ladder = new ArrayList<>(LADDER_PROBABILITIES.length);
        for (double p : LADDER_PROBABILITIES) {
            ladder.add(PercentilePoint.builder()
                    .probability(p)
                    .value(percentileFromSorted(sorted, p))
                    .build());
        }
        return ladder;
    }

    private double varFromSorted(double[] sorted, double confidenceLevel) {
        return -sorted[tailIndex(sorted.length, confidenceLevel)];
    }

    private double cvarFromSorted(double[] sorted, double confidenceLevel) {
        int index = tailIndex(sorted.length, confidenceLevel);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i <= index; i++) {
            sum += sorted[i];
            count++;
        }
        if (count == 0) return varFromSorted(sorted, confidenceLevel);
        return -sum / count;
    }

    private double sampleVariance(double[] sample, double mean) {
        double sumSq = 0.0;
        for (double v : sample) {
            double d = v - mean;
            sumSq += d * d;
        }
        return sumSq / (sample.length - 1);
    }

    private double standardizedMoment(double[] sample, double mean, double stdev, int order) {
        if (stdev == 0) return 0.0;
        double sum = 0.0;
        for (double v : sample) {
            double z = (v - mean) / stdev;
            double zPow = z * z * z;
            if (order == 4) zPow *= z;
            sum += zPow;
        }
        return sum / sample.length;
    }

    private static int clampIndex(int index, int n) {
        return Math.max(0, Math.min(index, n - 1));
    }

    private static double[] sorted(double[] sample) {
        double[] copy = sample.clone();
        Arrays.sort(copy);
        return copy;
    }

    private static void validateSample(double[] sample) {
        if (sample == null || sample.length == 0) {
            throw new InvalidInputException("표본이 비어 있습니다");
        }
        for (double v : sample) {
            if (!Double.isFinite(v)) {
                throw new InvalidInputException("표본에 유한하지 않은 값이 있습니다: " + v);
            }
        }
    }

    private static void requireVarianceSample(double[] sample) {
        if (sample.length < 2) {
            throw new NumericDegeneracyException("분산 기반 통계에는 2개 이상의 표본이 필요합니다: n=" + sample.length);
        }
    }

    static void validateConfidence(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new InvalidInputException("신뢰수준(confidenceLevel)은 0과 1 사이여야 합니다: " + confidenceLevel);
        }
    }
}
