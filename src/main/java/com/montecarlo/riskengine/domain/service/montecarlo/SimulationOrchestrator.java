package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.NumericDegeneracyException;
import com.montecarlo.riskengine.domain.exception.SimulationException;
import com.montecarlo.riskengine.domain.model.AssetSpec;
import com.montecarlo.riskengine.domain.model.ErrorCategory;
import com.montecarlo.riskengine.domain.model.PortfolioOutcome;
import com.montecarlo.riskengine.domain.model.PortfolioOutcome.AssetContribution;
import com.montecarlo.riskengine.domain.model.PortfolioSpec;
import com.montecarlo.riskengine.domain.model.ReturnPath;
import com.montecarlo.riskengine.domain.model.RiskStatistics;
import com.montecarlo.riskengine.domain.model.ScenarioType;
import com.montecarlo.riskengine.domain.model.SimulationConfig;
import com.montecarlo.riskengine.domain.model.SimulationFailure;
import com.montecarlo.riskengine.domain.model.SimulationOutcome;
import com.montecarlo.riskengine.domain.service.montecarlo.PathSimulator.Moments;
import com.montecarlo.riskengine.infra.monitor.SimulationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.IntFunction;

@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationOrchestrator {

    private final DistributionFactory distributionFactory;
    private final PathSimulator pathSimulator;
    private final CorrelationApplier correlationApplier;
    private final StatisticsEngine statisticsEngine;
    private final MonteCarloProperties properties;
    private final SimulationMetrics metrics;
    private final ExecutorService simulationExecutor;

    public SimulationOutcome simulateSingleAsset(AssetSpec asset, SimulationConfig config) {
        long startNano = System.nanoTime();
        try {
            validateConfig(config);
            RandomSource root = new RandomSource(config.getSeed());
            SimulationOutcome outcome = runAsset(ScenarioType.SINGLE_ASSET, asset,
                    pathSimulator.resolveMoments(asset), config, root.split(), null);
            complete(ScenarioType.SINGLE_ASSET, outcome, startNano);
            return outcome;
        } catch (SimulationException e) {
            return assetFailure(ScenarioType.SINGLE_ASSET, asset, new SimulationFailure(e.getCategory(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[MC] 단일 자산 시뮬레이션 내부 오류: symbol={}", symbolOf(asset), e);
            return assetFailure(ScenarioType.SINGLE_ASSET, asset, internalFailure(e));
        }
    }

    public SimulationOutcome simulateStressTest(AssetSpec asset, double[] stressFactors, SimulationConfig config) {
        long startNano = System.nanoTime();
        try {
            validateConfig(config);
            AssetSpec stressed = stressedAsset(asset, stressFactors);
            RandomSource root = new RandomSource(config.getSeed());
            SimulationOutcome outcome = runAsset(ScenarioType.STRESS_TEST, stressed,
                    pathSimulator.resolveMoments(stressed), config, root.split(), null);
            complete(ScenarioType.STRESS_TEST, outcome, startNano);
            return outcome;
        } catch (SimulationException e) {
            return assetFailure(ScenarioType.STRESS_TEST, asset, new SimulationFailure(e.getCategory(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[MC] 스트레스 테스트 내부 오류: symbol={}", symbolOf(asset), e);
            return assetFailure(ScenarioType.STRESS_TEST, asset, internalFailure(e));
        }
    }

    public PortfolioOutcome simulatePortfolio(PortfolioSpec portfolio, SimulationConfig config) {
        long startNano = System.nanoTime();
        String name = portfolio != null ? portfolio.getName() : null;
        try {
            validateConfig(config);
            PortfolioOutcome outcome = runPortfolio(portfolio, config, startNano);
            metrics.recordDuration(ScenarioType.PORTFOLIO, System.nanoTime() - startNano);
            log.info("[MC] 포트폴리오 시뮬레이션 완료: name={}, assets={}, kind={}, correlated={}, VaR={}, CVaR={}, paths={}, total={}μs",
                    name, outcome.getAssetOutcomes().size(), config.getDistributionKind(), outcome.isCorrelated(),
                    String.format("%.6f", outcome.getPortfolioVar()), String.format("%.6f", outcome.getPortfolioCvar()),
                    config.getPathCount(), outcome.getCalcDurationMicros());
            return outcome;
        } catch (SimulationException e) {
            return portfolioFailure(name, new SimulationFailure(e.getCategory(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[MC] 포트폴리오 시뮬레이션 내부 오류: name={}", name, e);
            return portfolioFailure(name, internalFailure(e));
        }
    }

    private PortfolioOutcome runPortfolio(PortfolioSpec portfolio, SimulationConfig config, long startNano) {
        if (portfolio == null || portfolio.getAssets() == null || portfolio.getAssets().isEmpty()) {
            throw new InvalidInputException("포트폴리오에는 최소 1개의 자산이 필요합니다");
        }
        List<AssetSpec> assets = portfolio.getAssets();
        if (portfolio.getWeights() == null || portfolio.getWeights().size() != assets.size()) {
            throw new InvalidInputException("자산 수와 가중치 수가 일치해야 합니다: assets=" + assets.size()
                    + ", weights=" + (portfolio.getWeights() == null ? 0 : portfolio.getWeights().size()));
        }
        double[] weights = normalizeWeights(portfolio.getWeights());
        int assetCount = assets.size();
        Moments[] moments = new Moments[assetCount];
        for (int i = 0; i < assetCount; i++) {
            moments[i] = pathSimulator.resolveMoments(assets.get(i));
        }

        int pathCount = config.getPathCount();

        RandomSource root = new RandomSource(config.getSeed());
        RandomSource[] sources = new RandomSource[assetCount];
        for (int i = 0; i < assetCount; i++) {
            sources[i] = root.split();
        }

        double[][] correlationMatrix = resolveCorrelationMatrix(portfolio);
        List<SimulationOutcome> assetOutcomes;
        if (correlationMatrix == null) {
            assetOutcomes = forEachAsset(assetCount,
                    i -> runAsset(ScenarioType.PORTFOLIO, assets.get(i), moments[i], config, sources[i], null));
        } else {
            double[][] lower = correlationApplier.choleskyFactor(correlationMatrix, assetCount);
            List<double[]> independent = forEachAsset(assetCount,
                    i -> pathSimulator.drawShocks(pathCount, sources[i], config.isUseAntitheticVariates()));
            double[][] correlated = correlationApplier.correlate(independent.toArray(new double[0][]), lower);
            assetOutcomes = forEachAsset(assetCount,
                    i -> runAsset(ScenarioType.PORTFOLIO, assets.get(i), moments[i], config, sources[i], correlated[i]));
        }

        double[] portfolioReturns = new double[pathCount];
        double[] portfolioValues = new double[pathCount];
        for (int sim = 0; sim < pathCount; sim++) {
            double portfolioReturn = 0.0;
            double portfolioValue = 0.0;
            for (int i = 0; i < assetCount; i++) {
                double assetReturn = assetOutcomes.get(i).getReturnPath().get(sim);
                portfolioReturn += weights[i] * assetReturn;
                portfolioValue += weights[i] * assets.get(i).getInitialPrice() * Math.exp(assetReturn);
            }
            portfolioReturns[sim] = portfolioReturn;
            portfolioValues[sim] = portfolioValue;
        }

        RiskStatistics statistics = statisticsEngine.compute(
                portfolioReturns, config.getConfidenceLevel(), config.getReportedConfidenceLevels());

        List<AssetContribution> contributions = new ArrayList<>(assetCount);
        List<Double> normalized = new ArrayList<>(assetCount);
        for (int i = 0; i < assetCount; i++) {
            double assetVar = assetOutcomes.get(i).getValueAtRisk();
            normalized.add(weights[i]);
            contributions.add(AssetContribution.builder()
                    .symbol(assets.get(i).getSymbol())
                    .weight(weights[i])
                    .assetVar(assetVar)
                    .varContribution(weights[i] * assetVar)
                    .build());
        }

        return PortfolioOutcome.builder()
                .portfolioName(portfolio.getName())
                .success(true)
                .distributionKind(config.getDistributionKind())
                .pathCount(pathCount)
                .correlated(correlationMatrix != null)
                .normalizedWeights(normalized)
                .portfolioReturns(new ReturnPath(portfolioReturns))
                .portfolioValues(portfolioValues)
                .statistics(statistics)
                .portfolioVar(statistics.getValueAtRisk())
                .portfolioCvar(statistics.getConditionalValueAtRisk())
                .expectedReturn(statistics.getMean())
                .portfolioVolatility(statistics.getStandardDeviation())
                .assetOutcomes(assetOutcomes)
                .varContributions(contributions)
                .timestamp(System.currentTimeMillis())
                .calcDurationMicros((System.nanoTime() - startNano) / 1_000)
                .build();
    }

    private SimulationOutcome runAsset(ScenarioType scenario, AssetSpec asset, Moments moments,
                                       SimulationConfig config, RandomSource source, double[] shocks) {
        long startNano = System.nanoTime();
        Distribution distribution = distributionFactory.create(
                config.getDistributionKind(), config.distributionParameterArray());

        ReturnPath path = pathSimulator.simulate(asset, moments, config, distribution, source, shocks);

        RiskStatistics statistics = statisticsEngine.compute(
                path.toArray(), config.getConfidenceLevel(), config.getReportedConfidenceLevels());

        return SimulationOutcome.builder()
                .scenario(scenario)
                .symbol(asset.getSymbol())
                .success(true)
                .distributionKind(distribution.kind())
                .pathCount(path.size())
                .effectiveExpectedReturn(moments.getMean())
                .effectiveVolatility(moments.getStdDev())
                .returnPath(path)
                .simulatedPrices(path.projectPrices(asset.getInitialPrice()))
                .statistics(statistics)
                .timestamp(System.currentTimeMillis())
                .calcDurationMicros((System.nanoTime() - startNano) / 1_000)
                .build();
    }

    AssetSpec stressedAsset(AssetSpec asset, double[] stressFactors) {
        if (stressFactors == null || stressFactors.length < 1) {
            throw new InvalidInputException("변동성 충격 계수(stressFactors[0])가 없습니다");
        }
        double volatilityShock = stressFactors[0];
        if (!(volatilityShock > 0) || !Double.isFinite(volatilityShock)) {
            throw new InvalidInputException("변동성 충격 계수는 양수여야 합니다: " + volatilityShock);
        }
        boolean hasReturnShock = stressFactors.length > 1;
        if (hasReturnShock && !Double.isFinite(stressFactors[1])) {
            throw new InvalidInputException("수익률 충격 계수는 유한값이어야 합니다: " + stressFactors[1]);
        }

        Moments base = pathSimulator.resolveMoments(asset);
        double stressedReturn = hasReturnShock ? base.getMean() * stressFactors[1] : base.getMean();
        double stressedVolatility = base.getStdDev() * volatilityShock;

        log.debug("[MC] 스트레스 자산 구성: symbol={}, μ {} → {}, σ {} → {}",
                asset.getSymbol(),
                String.format("%.6f", base.getMean()), String.format("%.6f", stressedReturn),
                String.format("%.6f", base.getStdDev()), String.format("%.6f", stressedVolatility));

        return asset.toBuilder()
                .expectedReturn(stressedReturn)
                .volatility(stressedVolatility)
                .historicalReturns(List.of())
                .build();
    }

    private double[][] resolveCorrelationMatrix(PortfolioSpec portfolio) {
        if (portfolio.hasCorrelationMatrix()) {
            return portfolio.getCorrelationMatrix();
        }
        if (!properties.isEstimateCorrelation() || portfolio.getAssets().size() < 2) {
            return null;
        }

        List<double[]> histories = new ArrayList<>();
        for (AssetSpec asset : portfolio.getAssets()) {
            if (!asset.hasHistory()) return null;
            histories.add(asset.historicalReturnArray());
        }
        int length = histories.get(0).length;
        for (double[] h : histories) {
            if (h.length != length) {
                log.debug("[Correlation] 과거 수익률 길이가 달라 상관행렬 추정 생략: name={}", portfolio.getName());
                return null;
            }
        }

        double[][] estimated;
        try {
            estimated = correlationApplier.estimateCorrelationMatrix(histories);
        } catch (NumericDegeneracyException e) {
            log.debug("[Correlation] 상관행렬 추정 불가, 독립 경로로 진행: name={}, reason={}",
                    portfolio.getName(), e.getMessage());
            return null;
        }
        log.debug("[Correlation] 과거 수익률로 상관행렬 추정: name={}, assets={}, samples={}",
                portfolio.getName(), histories.size(), length);
        return estimated;
    }

    private <T> List<T> forEachAsset(int assetCount, IntFunction<T> task) {
        List<T> results = new ArrayList<>(assetCount);
        if (!properties.isParallelAssets() || assetCount == 1) {
            for (int i = 0; i < assetCount; i++) {
                results.add(task.apply(i));
            }
            return results;
        }

        List<CompletableFuture<T>> futures = new ArrayList<>(assetCount);
        for (int i = 0; i < assetCount; i++) {
            int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(index), simulationExecutor));
        }
        try {
            for (CompletableFuture<T> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return results;
    }

    static double[] normalizeWeights(List<Double> weights) {
        double total = 0.0;
        for (Double w : weights) {
            if (w == null || !Double.isFinite(w)) {
                throw new InvalidInputException("가중치는 유한값이어야 합니다: " + w);
            }
            total += w;
        }
        if (!(total > 0) || !Double.isFinite(total)) {
            throw new InvalidInputException("가중치 합이 양수가 아니어서 정규화할 수 없습니다: sum=" + total);
        }

        double[] normalized = new double[weights.size()];
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] = weights.get(i) / total;
        }
        return normalized;
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
        StatisticsEngine.validateConfidence(config.getConfidenceLevel());
        if (config.getReportedConfidenceLevels() != null) {
            config.getReportedConfidenceLevels().forEach(level -> {
                if (level == null) throw new InvalidInputException("보고 신뢰수준에 null이 있습니다");
                StatisticsEngine.validateConfidence(level);
            });
        }
        if (config.getDistributionKind() == null) {
            throw new InvalidInputException("분포 유형(distributionKind)은 필수입니다");
        }
    }

    private void complete(ScenarioType scenario, SimulationOutcome outcome, long startNano) {
        long elapsedNanos = System.nanoTime() - startNano;
        metrics.recordDuration(scenario, elapsedNanos);
        log.info("[MC] 시뮬레이션 완료: scenario={}, symbol={}, kind={}, μ={}, σ={}, VaR={}, CVaR={}, paths={}, total={}μs",
                scenario, outcome.getSymbol(), outcome.getDistributionKind(),
                String.format("%.6f", outcome.getEffectiveExpectedReturn()),
                String.format("%.6f", outcome.getEffectiveVolatility()),
                String.format("%.6f", outcome.getValueAtRisk()),
                String.format("%.6f", outcome.getConditionalValueAtRisk()),
                outcome.getPathCount(), elapsedNanos / 1_000);
    }

    private SimulationOutcome assetFailure(ScenarioType scenario, AssetSpec asset, SimulationFailure failure) {
        metrics.recordFailure(scenario, failure.category());
        log.warn("[MC] 시뮬레이션 실패: scenario={}, symbol={}, category={}, reason={}",
                scenario, symbolOf(asset), failure.category(), failure.message());
        return SimulationOutcome.failure(scenario, symbolOf(asset), failure);
    }

    private PortfolioOutcome portfolioFailure(String name, SimulationFailure failure) {
        metrics.recordFailure(ScenarioType.PORTFOLIO, failure.category());
        log.warn("[MC] 포트폴리오 시뮬레이션 실패: name={}, category={}, reason={}",
                name, failure.category(), failure.message());
        return PortfolioOutcome.failure(name, failure);
    }

    private static SimulationFailure internalFailure(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new SimulationFailure(ErrorCategory.INTERNAL_FAILURE, message);
    }

    private static String symbolOf(AssetSpec asset) {
        return asset != null ? asset.getSymbol() : null;
    }
}
