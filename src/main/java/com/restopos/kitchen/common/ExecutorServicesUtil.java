package com.restopos.kitchen.common;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the executor services used by the background activities of the kitchen. Every executor created here gets a
 * JVM shutdown hook, so in flight ticks and simulated kitchen work get a chance to finish when the process is stopped.
 * The hook is unregistered when the executor is shut down through this class.
 */
@Slf4j public class ExecutorServicesUtil {

    public static final long WAIT_TIME_TO_SHUTDOWN_MS = 30 * 1000; // In milliseconds

    private static final Map<ExecutorService, Thread> SHUTDOWN_HOOKS = new ConcurrentHashMap<>();

    private ExecutorServicesUtil() {
    }

    private static ThreadFactory getThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactory() {
            private final AtomicLong count = new AtomicLong();

            @Override public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + count.incrementAndGet());
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    /**
     * Stops the executor, waiting up to the given time for running tasks before interrupting them.
     *
     * @param executorService
     * @param waitTimeToShutdownInMs
     * @return true if the executor terminated within the wait time.
     */
    public static boolean shutdownGracefully(ExecutorService executorService, long waitTimeToShutdownInMs) {
        removeShutdownHook(executorService);
        return awaitShutdown(executorService, waitTimeToShutdownInMs);
    }

    /**
     * Stops the executor right away, dropping queued tasks and interrupting running ones.
     *
     * @param executorService
     * @return the tasks that never started.
     */
    public static List<Runnable> shutdownNow(ExecutorService executorService) {
        removeShutdownHook(executorService);
        return executorService.shutdownNow();
    }

    private static boolean awaitShutdown(ExecutorService executorService, long waitTimeToShutdownInMs) {
        executorService.shutdown();
        try {
            if (executorService.awaitTermination(waitTimeToShutdownInMs, TimeUnit.MILLISECONDS)) {
                log.info("Executor stopped safely.");
                return true;
            }
            log.warn("Executor could not stop on time. Stopping abruptly");
            List<Runnable> unfinished = executorService.shutdownNow();
            log.warn("No of unfinished tasks={}", unfinished.size());
        } catch (InterruptedException e) {
            log.error("Interrupted while executor is shutting down", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        return false;
    }

    public static ScheduledExecutorService createScheduledThreadPool(String threadNamePrefix, int threadsCount,
        long waitTimeToShutdownInMs) {
        ScheduledExecutorService scheduledExecutorService =
            Executors.newScheduledThreadPool(threadsCount, getThreadFactory(threadNamePrefix, true));
        Thread shutdownHook = new Thread(() -> {
            SHUTDOWN_HOOKS.remove(scheduledExecutorService);
            awaitShutdown(scheduledExecutorService, waitTimeToShutdownInMs);
        });
        SHUTDOWN_HOOKS.put(scheduledExecutorService, shutdownHook);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        return scheduledExecutorService;
    }

    @VisibleForTesting static boolean hasShutdownHook(ExecutorService executorService) {
        return SHUTDOWN_HOOKS.containsKey(executorService);
    }

    private static void removeShutdownHook(ExecutorService executorService) {
        Thread shutdownHook = SHUTDOWN_HOOKS.remove(executorService);
        if (shutdownHook == null)
            return;
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // The JVM is already shutting down and the hook runs anyway.
            log.debug("Could not remove shutdown hook of executor, JVM is shutting down", e);
        }
    }
}
