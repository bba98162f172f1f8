package org.hybridnet.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.hybridnet.engine.FiringRecord;
import org.hybridnet.engine.FlowRecord;

public class StepEvent {

    private final long step;
    private final double time;
    private final double dt;
    private final FiringRecord firing;
    private final List<FlowRecord> flows;
    private final List<String> failures;
    private final List<String> urgentTransitions;
    private final List<String> missedDeadlines;
    private final Map<String, Double> marking;

    public StepEvent(long step, double time, double dt, FiringRecord firing, List<FlowRecord> flows,
            List<String> failures, List<String> urgentTransitions, List<String> missedDeadlines,
            Map<String, Double> marking) {
        this.step = step;
        this.time = time;
        this.dt = dt;
        this.firing = firing;
        this.flows = Collections.unmodifiableList(flows);
        this.failures = Collections.unmodifiableList(failures);
        this.urgentTransitions = Collections.unmodifiableList(urgentTransitions);
        this.missedDeadlines = Collections.unmodifiableList(missedDeadlines);
        this.marking = Collections.unmodifiableMap(marking);
    }

    public long getStep() {
        return step;
    }

    /**
     * Simulation time after the step.
     */
    public double getTime() {
        return time;
    }

    public double getDt() {
        return dt;
    }

    /**
     * The discrete firing of this step, {@code null} when none happened.
     */
    public FiringRecord getFiring() {
        return firing;
    }

    public List<FlowRecord> getFlows() {
        return flows;
    }

    /**
     * Rejected firings and failed integrations, as {@code "<id>: <reason>"}.
     */
    public List<String> getFailures() {
        return failures;
    }

    public List<String> getUrgentTransitions() {
        return urgentTransitions;
    }

    public List<String> getMissedDeadlines() {
        return missedDeadlines;
    }

    public Map<String, Double> getMarking() {
        return marking;
    }

    @Override
    public String toString() {
        return "Step " + step + " t=" + time + " fired=" + (firing == null ? "-" : firing.getTransitionId())
                + " flows=" + flows.size();
    }
}
