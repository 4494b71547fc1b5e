package com.restopos.kitchen.tuning;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the adaptive tuning on coarser cadences than the scheduler tick: the delay prediction every
 * {@link SchedulerConfig#getDelayPredictionEveryTicks()} ticks, duration learning and the capacity analysis every
 * {@link SchedulerConfig#getLearningEveryTicks()} ticks. One failing step does not prevent the others.
 */
@Slf4j @Singleton public class AdaptiveTuning {

    private final DurationLearner durationLearner;
    private final CapacityAdjuster capacityAdjuster;
    private final DelayPredictor delayPredictor;
    private final SchedulerConfig schedulerConfig;

    @Inject public AdaptiveTuning(DurationLearner durationLearner, CapacityAdjuster capacityAdjuster, DelayPredictor delayPredictor,
        SchedulerConfig schedulerConfig) {
        this.durationLearner = durationLearner;
        this.capacityAdjuster = capacityAdjuster;
        this.delayPredictor = delayPredictor;
        this.schedulerConfig = schedulerConfig;
    }

    /**
     * @param tickNumber 1 based number of the current tick.
     */
    public void onTick(long tickNumber) {
        if (isDue(tickNumber, schedulerConfig.getDelayPredictionEveryTicks())) {
            runStep("delayPrediction", delayPredictor::publishDelay);
        }
        if (isDue(tickNumber, schedulerConfig.getLearningEveryTicks())) {
            runStep("durationLearning", durationLearner::recalibrateBaseDuration);
            runStep("capacityAnalysis", capacityAdjuster::recommend);
        }
    }

    private static boolean isDue(long tickNumber, int everyTicks) {
        return everyTicks > 0 && tickNumber > 0 && tickNumber % everyTicks == 0;
    }

    private void runStep(String step, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            log.error("Adaptive tuning step={} failed", step, e);
        }
    }
}
