package com.restopos.kitchen.config;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * POJO for the bootstrap configuration of the kitchen scheduler. Look at kitchen_config.json for an example.
 * <p>
 * The first three values only seed the runtime {@link SystemConfiguration} when it has no value yet; from then on the
 * runtime configuration is the source of truth.
 */
@Getter @Setter @Builder public class SchedulerConfig {

    @Builder.Default private int maxConcurrentPreparations = ConfigKey.MaxConcurrentPreparations.getDefaultValue();
    @Builder.Default private int tickIntervalSeconds = ConfigKey.TickIntervalSeconds.getDefaultValue();
    @Builder.Default private int basePreparationDurationMinutes = ConfigKey.BasePreparationDurationMinutes.getDefaultValue();

    // Tuning cadences, in ticks.
    @Builder.Default private int delayPredictionEveryTicks = 10;
    @Builder.Default private int learningEveryTicks = 120;

    // History windows used by the adaptive tuning.
    @Builder.Default private int learningLookbackDays = 30;
    @Builder.Default private int learningSampleLimit = 50;
    @Builder.Default private int capacityLookbackHours = 4;
    @Builder.Default private int delayLookbackDays = 7;
    @Builder.Default private int minHistorySamples = 5;

    // Simulation only.
    @Builder.Default private double poissonMeanPerSecond = 0.5;
    @Builder.Default private int minDelayForReadyInSecs = 2;
    @Builder.Default private int maxDelayForReadyInSecs = 10;
}
