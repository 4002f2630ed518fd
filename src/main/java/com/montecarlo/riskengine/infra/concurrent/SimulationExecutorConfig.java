package com.montecarlo.riskengine.infra.concurrent;

import com.montecarlo.riskengine.domain.service.montecarlo.MonteCarloProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SimulationExecutorConfig {

    private final MonteCarloProperties properties;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService simulationExecutor() {
        int threads = properties.resolvedWorkerThreads();
        log.info("[Executor] 자산별 시뮬레이션 워커 풀 기동: threads={}, parallelAssets={}",
                threads, properties.isParallelAssets());
        return Executors.newFixedThreadPool(threads, namedThreadFactory("mc-worker"));
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
