package waveflow.worker.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.cleanup.TempFileSweeper;
import waveflow.worker.config.WorkerConfig;
import waveflow.worker.consumer.ConsumerStats;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background housekeeping:
 * - work area sweep for files abandoned by crashed invocations
 * - periodic consumer stats line
 *
 * Uses a single-threaded executor so a slow sweep never overlaps the next one.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TempFileSweeper sweeper;
    private final ConsumerStats stats;
    private final WorkerConfig config;

    private volatile boolean running = false;

    public Scheduler(TempFileSweeper sweeper, ConsumerStats stats, WorkerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "waveflow-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.sweeper = sweeper;
        this.stats = stats;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long sweepIntervalMs = config.cleanupInterval().toMillis();
        if (sweepIntervalMs > 0) {
            executor.scheduleAtFixedRate(
                    wrapRunnable("temp-sweep", this::sweep),
                    sweepIntervalMs, // initial delay
                    sweepIntervalMs, // interval
                    TimeUnit.MILLISECONDS);
            log.info("Temp sweep scheduled every {}ms", sweepIntervalMs);
        } else {
            log.info("Temp sweep disabled");
        }

        long statsIntervalMs = config.statsInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("stats", this::logStats),
                statsIntervalMs,
                statsIntervalMs,
                TimeUnit.MILLISECONDS);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    void sweep() {
        try {
            sweeper.sweep();
        } catch (IOException e) {
            log.warn("Temp sweep of {} failed: {}", sweeper.dir(), e.toString());
        }
    }

    void logStats() {
        log.info("stats: {}", stats.snapshot());
    }

    /**
     * Wrap a runnable with error handling so one failure does not cancel the schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
