package org.hybridnet.engine;

import java.util.List;

import org.hybridnet.model.Arc;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.TimedParameters;
import org.hybridnet.model.Transition;

/**
 * A transition that may fire only while the time it has been continuously
 * enabled lies inside {@code [earliest, latest]}.
 */
public class TimedBehavior extends DiscreteBehavior {

    static final double EPSILON = 1e-9;

    private final TimedParameters parameters;
    private boolean deadlineReported = false;

    public TimedBehavior(Transition transition, PetriNetModel model, SimulationClock clock) {
        super(transition, model, clock);
        this.parameters = (TimedParameters) transition.getParameters();
    }

    @Override
    public Enablement canFire() {
        Enablement guard = checkGuard();
        if (guard != null) {
            return guard;
        }
        Enablement tokens = checkTokens(locality.getInputArcs(), 1, "insufficient-tokens-");
        if (tokens != null) {
            return tokens;
        }
        Double elapsed = getElapsed();
        if (elapsed == null) {
            return Enablement.disabled("not-enabled-yet");
        }
        if (elapsed < parameters.getEarliest() - EPSILON) {
            return Enablement.disabled("too-early");
        }
        if (elapsed > parameters.getLatest() + EPSILON) {
            return Enablement.disabled("too-late");
        }
        return Enablement.ENABLED;
    }

    @Override
    public FireResult fire(List<Arc> inputs, List<Arc> outputs) {
        Enablement enablement = canFire();
        if (!enablement.isEnabled()) {
            return FireResult.failure(enablement.getReason());
        }
        double elapsed = getElapsed();
        FireResult result = transfer(inputs, outputs, 1, clock.now());
        if (result.isSuccess()) {
            result.getRecord().withElapsed(elapsed);
            clearEnablement();
        }
        return result;
    }

    /**
     * True when the whole window falls inside the next step of size
     * {@code dt}: the transition is too early now and would be too late
     * after the step, while its tokens and guard allow firing.
     */
    public boolean willCrossWindow(double dt) {
        Double elapsed = getElapsed();
        if (elapsed == null || elapsed >= parameters.getEarliest() - EPSILON
                || elapsed + dt <= parameters.getLatest() + EPSILON) {
            return false;
        }
        return checkGuard() == null && checkTokens(locality.getInputArcs(), 1, "insufficient-tokens-") == null;
    }

    /**
     * Fires a transition whose window is crossed by the step of size
     * {@code dt}, recording the window bound it was due at.
     */
    public FireResult fireAcrossWindow(double dt, List<Arc> inputs, List<Arc> outputs) {
        if (!willCrossWindow(dt)) {
            return FireResult.failure(canFire().getReason());
        }
        FireResult result = transfer(inputs, outputs, 1, clock.now());
        if (result.isSuccess()) {
            result.getRecord().withElapsed(parameters.getEarliest());
            clearEnablement();
        }
        return result;
    }

    /**
     * Time since enablement, {@code null} when the transition is not tracked.
     */
    public Double getElapsed() {
        Double since = getEnablementTime();
        return since == null ? null : clock.now() - since;
    }

    /**
     * True when the window closes within the next step.
     */
    public boolean isUrgent(double stepSize) {
        Double elapsed = getElapsed();
        if (elapsed == null || elapsed < parameters.getEarliest() - EPSILON
                || elapsed > parameters.getLatest() + EPSILON) {
            return false;
        }
        return parameters.getLatest() - elapsed <= stepSize + EPSILON;
    }

    @Override
    public boolean isWaiting() {
        Double elapsed = getElapsed();
        return elapsed != null && elapsed < parameters.getEarliest() - EPSILON;
    }

    public boolean isDeadlineMissed() {
        Double elapsed = getElapsed();
        return elapsed != null && elapsed > parameters.getLatest() + EPSILON;
    }

    /**
     * Returns true only the first time a missed deadline is reported for the
     * current enablement.
     */
    boolean markDeadlineReported() {
        if (deadlineReported) {
            return false;
        }
        deadlineReported = true;
        return true;
    }

    @Override
    public void clearEnablement() {
        super.clearEnablement();
        deadlineReported = false;
    }

    public double getEarliest() {
        return parameters.getEarliest();
    }

    public double getLatest() {
        return parameters.getLatest();
    }

    @Override
    public String getTypeName() {
        return "Timed";
    }
}
