package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import com.montecarlo.riskengine.domain.model.AssetSpec;
import com.montecarlo.riskengine.domain.model.ReturnPath;
import com.montecarlo.riskengine.domain.model.SimulationConfig;
import com.montecarlo.riskengine.domain.service.GarchEstimator;
import com.montecarlo.riskengine.domain.service.GarchEstimator.GarchFit;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PathSimulator {

    private final MonteCarloProperties properties;
    private final GarchEstimator garchEstimator;
    private final TailEstimator tailEstimator;
    private final StatisticsEngine statisticsEngine;

    @Getter
    public static class Moments {
        private final double mean;
        private final double stdDev;
        private final boolean fromHistory;

        public Moments(double mean, double stdDev, boolean fromHistory) {
            this.mean = mean;
            this.stdDev = stdDev;
            this.fromHistory = fromHistory;
        }
    }

    public Moments resolveMoments(AssetSpec asset) {
        validateAsset(asset);

        if (asset.hasHistory()) {
            double[] history = asset.historicalReturnArray();
            if (history.length < 2) {
                throw new NumericDegeneracyException(
                        "과거 수익률 표본이 " + history.length + "개뿐이라 분산을 정의할 수 없습니다: symbol=" + asset.getSymbol());
            }
            for (double r : history) {
                if (!Double.isFinite(r)) {
                    throw new InvalidInputException("과거 수익률에 유한하지 않은 값이 있습니다: symbol=" + asset.getSymbol());
                }
            }
            return new Moments(statisticsEngine.mean(history), statisticsEngine.standardDeviation(history), true);
        }

        if (!Double.isFinite(asset.getExpectedReturn())) {
            throw new InvalidInputException("기대수익률(expectedReturn)은 유한값이어야 합니다: symbol=" + asset.getSymbol());
        }
        if (!(asset.getVolatility() > 0) || !Double.isFinite(asset.getVolatility())) {
            throw new InvalidInputException(
                    "변동성(volatility)은 양수여야 합니다: symbol=" + asset.getSymbol() + ", volatility=" + asset.getVolatility());
        }
        return new Moments(asset.getExpectedReturn(), asset.getVolatility(), false);
    }

    public double[] drawShocks(int count, RandomSource source, boolean antithetic) {
        double[] shocks = new double[count];
        for (int i = 0; i < count; i++) {
            if (antithetic && i % 2 == 1) {
                shocks[i] = -shocks[i - 1];
            } else {
                shocks[i] = NormalDistribution.standardShock(source);
            }
        }
        return shocks;
    }

    public ReturnPath simulate(AssetSpec asset, SimulationConfig config,
                               Distribution distribution, RandomSource source) {
        return simulate(asset, resolveMoments(asset), config, distribution, source, null);
    }

    public ReturnPath simulate(AssetSpec asset, SimulationConfig config,
                               Distribution distribution, RandomSource source, double[] shocks) {
        return simulate(asset, resolveMoments(asset), config, distribution, source, shocks);
    }

    public ReturnPath simulate(AssetSpec asset, Moments moments, SimulationConfig config,
                               Distribution distribution, RandomSource source, double[] shocks) {
        validateConfig(config);
        int pathCount = config.getPathCount();
        if (shocks == null) {
            shocks = drawShocks(pathCount, source, config.isUseAntitheticVariates());
        } else if (shocks.length != pathCount) {
            throw new InvalidInputException(
                    "충격 수가 경로 수와 다릅니다: shocks=" + shocks.length + ", pathCount=" + pathCount);
        }

        calibrate(asset, moments, distribution);

        long startNano = System.nanoTime();

        double[] returns = new double[pathCount];
        for (int i = 0; i < pathCount; i++) {
            returns[i] = distribution.sampleWithShock(shocks[i], source);
        }

        if (config.isUseControlVariates()) {
            applyControlVariate(returns, shocks);
        }

        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
        log.debug("[PathSim] 생성 완료: symbol={}, kind={}, paths={}, mean={}, sd={}, antithetic={}, controlVariate={}, elapsed={}ms",
                asset.getSymbol(), distribution.kind(), pathCount,
                String.format("%.6f", moments.getMean()), String.format("%.6f", moments.getStdDev()),
                config.isUseAntitheticVariates(), config.isUseControlVariates(), elapsedMs);

        return new ReturnPath(returns);
    }

    void calibrate(AssetSpec asset, Moments moments, Distribution distribution) {
        double mean = moments.getMean();
        double stdDev = moments.getStdDev();

        if (distribution instanceof NormalDistribution normal) {
            normal.updateParameters(new double[]{mean, stdDev});
        } else if (distribution instanceof StudentTDistribution studentT) {
            int df = studentT.getDegreesOfFreedom();
            double[] history = asset.historicalReturnArray();
            if (properties.isEstimateDegreesOfFreedom() && moments.isFromHistory()
                    && tailEstimator.canEstimate(history)) {
                df = tailEstimator.estimateDegreesOfFreedom(history);
            }
            studentT.updateParameters(new double[]{
                    df, mean, StudentTDistribution.scaleForStandardDeviation(df, stdDev)});
        } else if (distribution instanceof GarchDistribution garch) {
            GarchFit fit = new GarchFit(garch.getAlpha(), garch.getBeta(), Double.NaN);
            double[] history = asset.historicalReturnArray();
            if (moments.isFromHistory() && garchEstimator.canFit(history)) {
                fit = garchEstimator.fit(history);
                log.debug("[PathSim] GARCH 적합 적용: symbol={}, α={}, β={}, LL={}",
                        asset.getSymbol(), fit.getAlpha(), fit.getBeta(), String.format("%.2f", fit.getLogLikelihood()));
            }
            garch.updateParameters(new double[]{fit.omegaFor(stdDev * stdDev), fit.getAlpha(), fit.getBeta()});
        } else {
            throw new IllegalStateException("알 수 없는 분포 구현: " + distribution.getClass().getName());
        }
    }

    private void applyControlVariate(double[] returns, double[] shocks) {
        if (returns.length < 2) return;
        double shockMean = statisticsEngine.mean(shocks);
        double shockVariance = statisticsEngine.sampleCovariance(shocks, shocks);
        if (shockVariance == 0.0) return;

        double b = statisticsEngine.sampleCovariance(returns, shocks) / shockVariance;
        double shift = b * shockMean;
        for (int i = 0; i < returns.length; i++) {
            returns[i] -= shift;
        }
    }

    private void validateAsset(AssetSpec asset) {
        if (asset == null) {
            throw new InvalidInputException("자산 정보(asset)는 필수입니다");
        }
        if (!(asset.getInitialPrice() > 0) || !Double.isFinite(asset.getInitialPrice())) {
            throw new InvalidInputException(
                    "초기 가격(initialPrice)은 양수여야 합니다: symbol=" + asset.getSymbol() + ", price=" + asset.getInitialPrice());
        }
    }

    private void validateConfig(SimulationConfig config) {
        if (config == null) {
            throw new InvalidInputException("시뮬레이션 설정(config)은 필수입니다");
        }
        if (config.getPathCount() <= 0) {
            throw new InvalidInputException("경로 수(pathCount)는 양수여야 합니다: " + config.getPathCount());
        }
        if (config.getPathCount() > properties.getMaxPathCount()) {
            throw new InvalidInputException(
                    "경로 수(pathCount)가 상한을 초과합니다: " + config.getPathCount() + " > " + properties.getMaxPathCount());
        }
    }
}
