package org.hybridnet.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one continuous integration step.
 */
public class FlowRecord {

    public static final String METHOD_RK4 = "rk4";

    private final String transitionId;
    private final double time;
    private final double rate;
    private final double dt;
    private final double flow;
    private final Map<String, Double> consumed;
    private final Map<String, Double> produced;
    private final boolean clamped;

    public FlowRecord(String transitionId, double time, double rate, double dt, double flow,
            Map<String, Double> consumed, Map<String, Double> produced, boolean clamped) {
        this.transitionId = transitionId;
        this.time = time;
        this.rate = rate;
        this.dt = dt;
        this.flow = flow;
        this.consumed = Collections.unmodifiableMap(new LinkedHashMap<>(consumed));
        this.produced = Collections.unmodifiableMap(new LinkedHashMap<>(produced));
        this.clamped = clamped;
    }

    public String getTransitionId() {
        return transitionId;
    }

    public double getTime() {
        return time;
    }

    /**
     * Clamped rate at the start of the step.
     */
    public double getRate() {
        return rate;
    }

    public double getDt() {
        return dt;
    }

    /**
     * Integrated flow over the step, before arc weights are applied.
     */
    public double getFlow() {
        return flow;
    }

    public Map<String, Double> getConsumed() {
        return consumed;
    }

    public Map<String, Double> getProduced() {
        return produced;
    }

    public String getMethod() {
        return METHOD_RK4;
    }

    public boolean isClamped() {
        return clamped;
    }

    @Override
    public String toString() {
        return "Flow " + transitionId + " at " + time + " rate=" + rate + " flow=" + flow + (clamped ? " (clamped)" : "");
    }
}
