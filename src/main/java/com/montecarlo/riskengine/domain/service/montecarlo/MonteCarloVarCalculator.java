package com.montecarlo.riskengine.domain.service.montecarlo;

import com.montecarlo.riskengine.domain.exception.InvalidInputException;
import com.montecarlo.riskengine.domain.exception.SimulationException;
import com.montecarlo.riskengine.domain.model.AssetSpec;
import com.montecarlo.riskengine.domain.model.DistributionKind;
import com.montecarlo.riskengine.domain.model.PortfolioOutcome;
import com.montecarlo.riskengine.domain.model.PortfolioSpec;
import com.montecarlo.riskengine.domain.model.PortfolioSummary;
import com.montecarlo.riskengine.domain.model.RiskStatistics;
import com.montecarlo.riskengine.domain.model.ScenarioType;
import com.montecarlo.riskengine.domain.model.SimulationConfig;
import com.montecarlo.riskengine.domain.model.SimulationFailure;
import com.montecarlo.riskengine.domain.model.SimulationOutcome;
import com.montecarlo.riskengine.domain.model.SingleAssetSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloVarCalculator {

    public static final double FAILURE_SENTINEL = Double.NaN;

    private static final Consumer<SimulationFailure> IGNORE = failure -> { };

    private final SimulationOrchestrator orchestrator;
    private final MonteCarloProperties properties;

    public static boolean isFailure(double value) {
        return Double.isNaN(value);
    }

    public double computeSingleAssetVaR(double[] historicalReturns, double confidenceLevel, int pathCount,
                                        DistributionKind distributionKind, double[] distributionParams) {
        return computeSingleAssetVaR(historicalReturns, confidenceLevel, pathCount,
                distributionKind, distributionParams, IGNORE);
    }

    public double computeSingleAssetVaR(double[] historicalReturns, double confidenceLevel, int pathCount,
                                        DistributionKind distributionKind, double[] distributionParams,
                                        Consumer<SimulationFailure> onFailure) {
        SimulationOutcome outcome = runSingle(historicalReturns, confidenceLevel, pathCount,
                distributionKind, distributionParams);
        if (!outcome.isSuccess()) {
            Objects.requireNonNullElse(onFailure, IGNORE)
                    .accept(new SimulationFailure(outcome.getErrorCategory(), outcome.getErrorMessage()));
            return FAILURE_SENTINEL;
        }
        return outcome.getValueAtRisk();
    }

    public double computePortfolioVaR(double[][] perAssetReturns, double[] weights, double confidenceLevel,
                                      int pathCount, double[][] correlationMatrix, DistributionKind distributionKind) {
        return computePortfolioVaR(perAssetReturns, weights, confidenceLevel, pathCount,
                correlationMatrix, distributionKind, IGNORE);
    }

    public double computePortfolioVaR(double[][] perAssetReturns, double[] weights, double confidenceLevel,
                                      int pathCount, double[][] correlationMatrix, DistributionKind distributionKind,
                                      Consumer<SimulationFailure> onFailure) {
        PortfolioOutcome outcome = runPortfolio(perAssetReturns, weights, confidenceLevel, pathCount,
                correlationMatrix, distributionKind);
        if (!outcome.isSuccess()) {
            Objects.requireNonNullElse(onFailure, IGNORE)
                    .accept(new SimulationFailure(outcome.getErrorCategory(), outcome.getErrorMessage()));
            return FAILURE_SENTINEL;
        }
        return outcome.getPortfolioVar();
    }

    public SingleAssetSummary runSingleAssetSimulation(double[] historicalReturns, double confidenceLevel,
                                                       int pathCount, DistributionKind distributionKind,
                                                       double[] distributionParams) {
        SimulationOutcome outcome = runSingle(historicalReturns, confidenceLevel, pathCount,
                distributionKind, distributionParams);
        if (!outcome.isSuccess()) {
            return SingleAssetSummary.failure(FAILURE_SENTINEL, outcome.getErrorMessage());
        }
        RiskStatistics stats = outcome.getStatistics();
        return SingleAssetSummary.builder()
                .var(stats.getValueAtRisk())
                .cvar(stats.getConditionalValueAtRisk())
                .mean(stats.getMean())
                .standardDeviation(stats.getStandardDeviation())
                .skewness(stats.getSkewness())
                .kurtosis(stats.getExcessKurtosis())
                .success(true)
                .build();
    }

    public PortfolioSummary runPortfolioSimulation(double[][] perAssetReturns, double[] weights,
                                                   double confidenceLevel, int pathCount,
                                                   double[][] correlationMatrix, DistributionKind distributionKind) {
        PortfolioOutcome outcome = runPortfolio(perAssetReturns, weights, confidenceLevel, pathCount,
                correlationMatrix, distributionKind);
        if (!outcome.isSuccess()) {
            return PortfolioSummary.failure(FAILURE_SENTINEL, outcome.getErrorMessage());
        }
        return PortfolioSummary.builder()
                .portfolioVar(outcome.getPortfolioVar())
                .portfolioCvar(outcome.getPortfolioCvar())
                .expectedReturn(outcome.getExpectedReturn())
                .portfolioVolatility(outcome.getPortfolioVolatility())
                .success(true)
                .build();
    }

    private SimulationOutcome runSingle(double[] historicalReturns, double confidenceLevel, int pathCount,
                                        DistributionKind distributionKind, double[] distributionParams) {
        try {
            if (historicalReturns == null || historicalReturns.length == 0) {
                throw new InvalidInputException("과거 수익률이 비어 있습니다");
            }
            SimulationConfig config = properties.configBuilder()
                    .confidenceLevel(confidenceLevel)
                    .pathCount(pathCount)
                    .distributionKind(distributionKind)
                    .distributionParameters(toList(distributionParams))
                    .build();
            return orchestrator.simulateSingleAsset(AssetSpec.fromHistory(null, historicalReturns), config);
        } catch (SimulationException e) {
            log.warn("[MC Calc] 단일 자산 입력 오류: {}", e.getMessage());
            return SimulationOutcome.failure(ScenarioType.SINGLE_ASSET, null,
                    new SimulationFailure(e.getCategory(), e.getMessage()));
        }
    }

    private PortfolioOutcome runPortfolio(double[][] perAssetReturns, double[] weights, double confidenceLevel,
                                          int pathCount, double[][] correlationMatrix,
                                          DistributionKind distributionKind) {
        try {
            if (perAssetReturns == null || weights == null) {
                throw new InvalidInputException("자산별 수익률과 가중치는 필수입니다");
            }
            List<AssetSpec> assets = new ArrayList<>(perAssetReturns.length);
            for (int i = 0; i < perAssetReturns.length; i++) {
                if (perAssetReturns[i] == null || perAssetReturns[i].length == 0) {
                    throw new InvalidInputException("자산 " + i + "의 과거 수익률이 비어 있습니다");
                }
                assets.add(AssetSpec.fromHistory("ASSET_" + i, perAssetReturns[i]));
            }
            PortfolioSpec portfolio = PortfolioSpec.builder()
                    .assets(assets)
                    .weights(toList(weights))
                    .correlationMatrix(correlationMatrix)
                    .build();
            SimulationConfig config = properties.configBuilder()
                    .confidenceLevel(confidenceLevel)
                    .pathCount(pathCount)
                    .distributionKind(distributionKind)
                    .build();
            return orchestrator.simulatePortfolio(portfolio, config);
        } catch (SimulationException e) {
            log.warn("[MC Calc] 포트폴리오 입력 오류: {}", e.getMessage());
            return PortfolioOutcome.failure(null, new SimulationFailure(e.getCategory(), e.getMessage()));
        }
    }

    private static List<Double> toList(double[] values) {
        return values == null ? List.of() : Arrays.stream(values).boxed().toList();
    }
}
