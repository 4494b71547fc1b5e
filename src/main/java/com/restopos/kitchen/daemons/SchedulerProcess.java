package com.restopos.kitchen.daemons;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.restopos.kitchen.common.ExecutorServicesUtil;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.scheduling.AdmissionEngine;
import com.restopos.kitchen.scheduling.AdmissionResult;
import com.restopos.kitchen.scheduling.LateOrderSweep;
import com.restopos.kitchen.tuning.AdaptiveTuning;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic driver of the kitchen: every tick runs an admission pass and the late order sweep, and gives the adaptive
 * tuning a chance to run on its own cadence.
 * <p>
 * Ticks run on a single thread with a fixed delay, so a tick always completes before the next one is scheduled and ticks
 * never overlap. Stopping cancels the upcoming ticks only, a tick in flight runs to completion.
 */
@Slf4j @ThreadSafe @Singleton public class SchedulerProcess {

    private static final String SCHEDULER_THREAD_NAME_PREFIX = "kitchen-scheduler-";

    private final AdmissionEngine admissionEngine;
    private final LateOrderSweep lateOrderSweep;
    private final AdaptiveTuning adaptiveTuning;
    private final ConfigReader configReader;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong failedTickCount = new AtomicLong();
    private volatile boolean running;
    private volatile int intervalSeconds;
    private volatile Instant startedAt;
    private volatile Instant lastTickAt;
    private ScheduledExecutorService scheduledExecutorService;
    private ScheduledFuture<?> scheduledTicks;

    @Inject public SchedulerProcess(AdmissionEngine admissionEngine, LateOrderSweep lateOrderSweep, AdaptiveTuning adaptiveTuning,
        ConfigReader configReader, Clock clock) {
        this.admissionEngine = admissionEngine;
        this.lateOrderSweep = lateOrderSweep;
        this.adaptiveTuning = adaptiveTuning;
        this.configReader = configReader;
        this.clock = clock;
    }

    public boolean start() {
        return start(null);
    }

    /**
     * Runs a tick right away and then one every intervalSeconds.
     *
     * @param intervalSeconds null to use the configured tick interval.
     * @return false if the scheduler was already running.
     */
    public boolean start(Integer intervalSeconds) {
        Preconditions.checkArgument(intervalSeconds == null || intervalSeconds > 0, "intervalSeconds must be positive, was %s",
            intervalSeconds);
        synchronized (lifecycleLock) {
            if (running) {
                log.warn("Scheduler already running with intervalSeconds={}, ignoring start", this.intervalSeconds);
                return false;
            }
            int interval = intervalSeconds != null ? intervalSeconds : configReader.readInt(ConfigKey.TickIntervalSeconds);
            if (scheduledExecutorService == null) {
                scheduledExecutorService = ExecutorServicesUtil
                    .createScheduledThreadPool(SCHEDULER_THREAD_NAME_PREFIX, 1, ExecutorServicesUtil.WAIT_TIME_TO_SHUTDOWN_MS);
            }
            this.intervalSeconds = interval;
            this.startedAt = clock.instant();
            this.running = true;
            scheduledTicks = scheduledExecutorService.scheduleWithFixedDelay(this::tick, 0, interval, TimeUnit.SECONDS);
            log.info("Scheduler started with intervalSeconds={}", interval);
            return true;
        }
    }

    /**
     * One scheduler cycle. Failures of a step are logged and do not prevent the next steps or the next tick.
     */
    public void tick() {
        Instant tickStartedAt = clock.instant();
        long tickNumber = tickCount.incrementAndGet();
        boolean failed = false;
        try {
            AdmissionResult result = admissionEngine.evaluate();
            failed = !result.isSuccessful();
        } catch (RuntimeException e) {
            log.error("Admission pass failed on tick={}", tickNumber, e);
            failed = true;
        }
        try {
            lateOrderSweep.sweep();
        } catch (RuntimeException e) {
            log.error("Late order sweep failed on tick={}", tickNumber, e);
            failed = true;
        }
        try {
            adaptiveTuning.onTick(tickNumber);
        } catch (RuntimeException e) {
            log.error("Adaptive tuning failed on tick={}", tickNumber, e);
            failed = true;
        }
        if (failed)
            failedTickCount.incrementAndGet();
        lastTickAt = tickStartedAt;
    }

    /**
     * @return false if the scheduler was not running.
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return false;
            }
            scheduledTicks.cancel(false);
            scheduledTicks = null;
            running = false;
            log.info("Scheduler stopped after tickCount={}", tickCount.get());
            return true;
        }
    }

    /**
     * Changes the tick interval. A running scheduler is restarted with it, a stopped one only keeps it and stays stopped.
     *
     * @param intervalSeconds
     */
    public void updateInterval(int intervalSeconds) {
        Preconditions.checkArgument(intervalSeconds > 0, "intervalSeconds must be positive, was %s", intervalSeconds);
        synchronized (lifecycleLock) {
            boolean wasRunning = stop();
            this.intervalSeconds = intervalSeconds;
            if (wasRunning)
                start(intervalSeconds);
            else
                log.info("Scheduler not running, stored intervalSeconds={}", intervalSeconds);
        }
    }

    /**
     * Stops the scheduler and releases its thread. Waits for a tick in flight.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            stop();
            if (scheduledExecutorService != null) {
                ExecutorServicesUtil.shutdownGracefully(scheduledExecutorService, ExecutorServicesUtil.WAIT_TIME_TO_SHUTDOWN_MS);
                scheduledExecutorService = null;
            }
        }
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(running, intervalSeconds, startedAt, lastTickAt, tickCount.get(), failedTickCount.get());
    }

    public SchedulerHealth health() {
        return SchedulerHealth.classify(status(), clock.instant());
    }
}
