package com.montecarlo.riskengine.infra.monitor;

import com.montecarlo.riskengine.domain.model.ErrorCategory;
import com.montecarlo.riskengine.domain.model.ScenarioType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
public class SimulationMetrics {

    static final String DURATION_METRIC = "montecarlo.simulation.duration";
    static final String FAILURE_METRIC = "montecarlo.simulation.failures";

    private final MeterRegistry meterRegistry;

    public void recordDuration(ScenarioType scenario, long durationNanos) {
        Timer.builder(DURATION_METRIC)
                .tag("scenario", scenario.tag())
                .description("Monte Carlo simulation wall time")
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFailure(ScenarioType scenario, ErrorCategory category) {
        Counter.builder(FAILURE_METRIC)
                .tag("scenario", scenario.tag())
                .tag("category", category.name().toLowerCase())
                .description("Monte Carlo simulation failure outcomes")
                .register(meterRegistry)
                .increment();
    }
}
