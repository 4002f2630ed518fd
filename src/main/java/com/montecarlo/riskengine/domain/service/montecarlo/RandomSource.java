package com.montecarlo.riskengine.domain.service.montecarlo;

import java.util.SplittableRandom;

public class RandomSource {

    public static final long ENTROPY_SEED = 0L;

    private SplittableRandom delegate;

    public RandomSource(long seed) {
        setSeed(seed);
    }

    private RandomSource(SplittableRandom delegate) {
        this.delegate = delegate;
    }

    public double generate() {
        return delegate.nextDouble();
    }

    public void setSeed(long seed) {
        this.delegate = seed == ENTROPY_SEED ? new SplittableRandom() : new SplittableRandom(seed);
    }

    public RandomSource split() {
        return new RandomSource(delegate.split());
    }
}
