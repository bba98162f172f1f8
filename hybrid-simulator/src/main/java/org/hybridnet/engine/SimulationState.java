package org.hybridnet.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only picture of a controller at one instant.
 */
public final class SimulationState {

    private final double time;
    private final long stepCount;
    private final boolean running;
    private final double progress;
    private final Map<String, Double> marking;

    public SimulationState(double time, long stepCount, boolean running, double progress, Map<String, Double> marking) {
        this.time = time;
        this.stepCount = stepCount;
        this.running = running;
        this.progress = progress;
        this.marking = Collections.unmodifiableMap(new LinkedHashMap<>(marking));
    }

    public double getTime() {
        return time;
    }

    public long getStepCount() {
        return stepCount;
    }

    public boolean isRunning() {
        return running;
    }

    public double getProgress() {
        return progress;
    }

    public Map<String, Double> getMarking() {
        return marking;
    }

    @Override
    public String toString() {
        return "SimulationState{time=" + time + ", steps=" + stepCount + ", running=" + running
                + ", progress=" + progress + ", marking=" + marking + "}";
    }
}
