package com.livepipe.realtime.pipeline;

import com.livepipe.realtime.model.StepType;

import java.util.Random;

public class RandomFailurePolicy implements FailurePolicy {

    private final double rate;
    private final Random random;

    public RandomFailurePolicy(double rate) {
        this(rate, new Random());
    }

    public RandomFailurePolicy(double rate, Random random) {
        this.rate   = rate;
        this.random = random;
    }

    @Override
    public boolean shouldFail(StepType type, int attempt) {
        return rate > 0 && random.nextDouble() < rate;
    }
}
