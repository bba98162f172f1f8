package org.hybridnet.engine;

import java.util.ArrayList;
import java.util.List;

import org.hybridnet.model.Arc;
import org.hybridnet.model.Locality;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.Place;
import org.hybridnet.model.RateFunction;
import org.hybridnet.model.Transition;
import org.hybridnet.model.TransitionKind;

/**
 * Firing semantics of one transition kind. A behavior is built once per
 * transition and keeps the transition's locality for its whole life.
 */
public abstract class TransitionBehavior {

    protected final Transition transition;
    protected final PetriNetModel model;
    protected final Locality locality;
    protected final SimulationClock clock;
    private Double enablementTime;

    protected TransitionBehavior(Transition transition, PetriNetModel model, SimulationClock clock) {
        this.transition = transition;
        this.model = model;
        this.clock = clock;
        this.locality = model.getLocality(transition.getId());
    }

    /**
     * Never throws and never mutates the marking.
     */
    public abstract Enablement canFire();

    public abstract String getTypeName();

    public Transition getTransition() {
        return transition;
    }

    public String getId() {
        return transition.getId();
    }

    public TransitionKind getKind() {
        return transition.getKind();
    }

    public Locality getLocality() {
        return locality;
    }

    public List<Arc> getInputArcs() {
        return locality.getInputArcs();
    }

    public List<Arc> getOutputArcs() {
        return locality.getOutputArcs();
    }

    /**
     * Token condition of every input arc, ignoring timing and guards.
     */
    public boolean isStructurallyEnabled() {
        for (Arc arc : locality.getInputArcs()) {
            if (!arc.isSatisfiedBy(place(arc).getMarking(), 1)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Starts tracking a newly enabled transition and forgets a newly disabled one.
     */
    public void updateEnablement(double now) {
        boolean enabled = isStructurallyEnabled();
        if (enabled && enablementTime == null) {
            setEnablementTime(now);
        } else if (!enabled && enablementTime != null) {
            clearEnablement();
        }
    }

    public void setEnablementTime(double time) {
        this.enablementTime = time;
    }

    public Double getEnablementTime() {
        return enablementTime;
    }

    public void clearEnablement() {
        this.enablementTime = null;
    }

    protected Place place(Arc arc) {
        return model.getPlace(arc.getPlaceId());
    }

    /**
     * @return {@code null} when there is no guard or it passes
     */
    protected Enablement checkGuard() {
        RateFunction guard = transition.getGuard();
        if (guard == null) {
            return null;
        }
        try {
            if (guard.evaluate(new MarkingContext(model, clock.now())) == 0.0) {
                return Enablement.disabled("guard-fails");
            }
            return null;
        } catch (RuntimeException e) {
            return Enablement.disabled("guard-error");
        }
    }

    /**
     * The arcs that move tokens, test and inhibitor arcs left out.
     */
    protected static List<Arc> consuming(List<Arc> arcs) {
        List<Arc> consuming = new ArrayList<>(arcs.size());
        for (Arc arc : arcs) {
            if (arc.consumesTokens()) {
                consuming.add(arc);
            }
        }
        return consuming;
    }

    @Override
    public String toString() {
        return getTypeName() + "(" + transition.getId() + ")";
    }
}
