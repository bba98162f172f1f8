package org.hybridnet.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hybridnet.model.TransitionKind;

/**
 * What a discrete firing consumed and produced.
 */
public class FiringRecord {

    private final String transitionId;
    private final TransitionKind kind;
    private final double time;
    private final Map<String, Double> consumed;
    private final Map<String, Double> produced;
    private Integer burst;
    private Double elapsed;

    public FiringRecord(String transitionId, TransitionKind kind, double time,
            Map<String, Double> consumed, Map<String, Double> produced) {
        this.transitionId = transitionId;
        this.kind = kind;
        this.time = time;
        this.consumed = Collections.unmodifiableMap(new LinkedHashMap<>(consumed));
        this.produced = Collections.unmodifiableMap(new LinkedHashMap<>(produced));
    }

    public String getTransitionId() {
        return transitionId;
    }

    public TransitionKind getKind() {
        return kind;
    }

    public double getTime() {
        return time;
    }

    public Map<String, Double> getConsumed() {
        return consumed;
    }

    public Map<String, Double> getProduced() {
        return produced;
    }

    /**
     * Burst multiplier of a stochastic firing, {@code null} for other kinds.
     */
    public Integer getBurst() {
        return burst;
    }

    FiringRecord withBurst(int burst) {
        this.burst = burst;
        return this;
    }

    /**
     * Time spent enabled before firing, for timed and stochastic firings.
     */
    public Double getElapsed() {
        return elapsed;
    }

    FiringRecord withElapsed(double elapsed) {
        this.elapsed = elapsed;
        return this;
    }

    @Override
    public String toString() {
        return "Fired " + transitionId + " at " + time + " consumed=" + consumed + " produced=" + produced;
    }
}
