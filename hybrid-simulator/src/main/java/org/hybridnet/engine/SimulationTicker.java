package org.hybridnet.engine;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Steps a controller from a scheduled executor, one step per tick.
 */
public class SimulationTicker {

    private static final Logger LOGGER = LogManager.getLogger();

    private final SimulationController controller;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> task;
    private volatile boolean running = false;
    private volatile long ticks = 0;

    public SimulationTicker(SimulationController controller, ScheduledExecutorService executor) {
        this.controller = controller;
        this.executor = executor;
    }

    public synchronized void start(long periodMillis) {
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("Tick period must be positive");
        }
        if (running) {
            return;
        }
        running = true;
        task = executor.scheduleAtFixedRate(this::tick, 0, periodMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Simulation ticker started, period {} ms", periodMillis);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (task != null) {
            task.cancel(false);
        }
        LOGGER.info("Simulation ticker stopped after {} ticks at t={}", ticks, controller.getTime());
    }

    void tick() {
        if (!running) {
            return;
        }
        boolean more;
        try {
            synchronized (controller) {
                more = controller.step();
            }
            ticks++;
        } catch (RuntimeException e) {
            LOGGER.error("Simulation step failed, stopping ticker", e);
            stop();
            return;
        }
        if (!more) {
            stop();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getTicks() {
        return ticks;
    }
}
