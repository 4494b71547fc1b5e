package com.restopos.kitchen.daemons;

import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Point in time view of the {@link SchedulerProcess} run state.
 */
public class SchedulerStatus {

    private final boolean running;
    private final int intervalSeconds;
    private final Instant startedAt;
    private final Instant lastTickAt;
    private final long tickCount;
    private final long failedTickCount;

    public SchedulerStatus(boolean running, int intervalSeconds, Instant startedAt, Instant lastTickAt, long tickCount,
        long failedTickCount) {
        this.running = running;
        this.intervalSeconds = intervalSeconds;
        this.startedAt = startedAt;
        this.lastTickAt = lastTickAt;
        this.tickCount = tickCount;
        this.failedTickCount = failedTickCount;
    }

    public boolean isRunning() {
        return running;
    }

    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getLastTickAt() {
        return Optional.ofNullable(lastTickAt);
    }

    public long getTickCount() {
        return tickCount;
    }

    public long getFailedTickCount() {
        return failedTickCount;
    }

    public Optional<Duration> getLastTickAge(Instant now) {
        return getLastTickAt().map(lastTick -> Duration.between(lastTick, now));
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(SchedulerStatus.class).add("running", running).add("intervalSeconds", intervalSeconds)
            .add("startedAt", startedAt).add("lastTickAt", lastTickAt).add("tickCount", tickCount).add("failedTickCount", failedTickCount)
            .toString();
    }
}
