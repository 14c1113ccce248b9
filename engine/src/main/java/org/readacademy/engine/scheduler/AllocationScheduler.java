package org.readacademy.engine.scheduler;

import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.service.AllocationCycleService;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an allocation pass over newly submitted requests at a fixed interval.
 */
public final class AllocationScheduler {

    private static final Logger LOG = Logger.getLogger(AllocationScheduler.class.getName());

    private final ScheduledExecutorService executor;
    private final AllocationCycleService cycleService;
    private final int intervalSeconds;
    private volatile boolean running = false;

    public AllocationScheduler(AllocationCycleService cycleService, int intervalSeconds) {
        this.cycleService = Objects.requireNonNull(cycleService, "cycleService must not be null");

        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "allocation-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            LOG.warning("Scheduler already running");
            return;
        }

        LOG.info(() -> "Starting allocation scheduler with interval: " + intervalSeconds + "s");

        executor.scheduleAtFixedRate(
                this::runCycle,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );

        running = true;
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping allocation scheduler");
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run a single allocation cycle. Failures are logged; the next tick retries.
     */
    void runCycle() {
        try {
            LOG.fine("Running allocation cycle");
            AllocationResult result = cycleService.runPendingCycle();
            if (result != null) {
                LOG.info(() -> "Allocation cycle completed: " + result);
            }
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Error in allocation cycle", e);
        }
    }
}
