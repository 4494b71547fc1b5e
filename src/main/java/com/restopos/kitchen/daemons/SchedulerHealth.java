package com.restopos.kitchen.daemons;

import java.time.Duration;
import java.time.Instant;

/**
 * Health of the scheduler as reported to monitoring.
 */
public enum SchedulerHealth {

    Ok, Warning, Stopped;

    /**
     * A running scheduler is unhealthy once more than two intervals passed without a tick, counted from its start when
     * it never ticked.
     *
     * @param status
     * @param now
     * @return
     */
    public static SchedulerHealth classify(SchedulerStatus status, Instant now) {
        if (!status.isRunning())
            return Stopped;
        Duration maxSilence = Duration.ofSeconds(2L * status.getIntervalSeconds());
        Instant reference = status.getLastTickAt().orElse(status.getStartedAt().orElse(now));
        return Duration.between(reference, now).compareTo(maxSilence) > 0 ? Warning : Ok;
    }
}
