package org.hybridnet.engine;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.hybridnet.model.Arc;
import org.hybridnet.model.ArcKind;
import org.hybridnet.model.ContinuousParameters;
import org.hybridnet.model.Locality;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.Place;
import org.hybridnet.model.Transition;
import org.hybridnet.model.expr.ExpressionException;

/**
 * Transition that moves a continuous amount every step, the amount being the
 * rate function integrated over the step with fourth order Runge-Kutta.
 */
public class ContinuousBehavior extends TransitionBehavior {

    /** Inputs left below this amount are emptied completely. */
    static final double DEPLETION_TOLERANCE = 1e-9;

    private final ContinuousParameters parameters;

    public ContinuousBehavior(Transition transition, PetriNetModel model, SimulationClock clock) {
        super(transition, model, clock);
        this.parameters = (ContinuousParameters) transition.getParameters();
    }

    @Override
    public Enablement canFire() {
        for (Arc arc : locality.getInputArcs()) {
            double marking = place(arc).getMarking();
            if (arc.getKind() == ArcKind.INHIBITOR && !arc.isSatisfiedBy(marking, 1)) {
                return Enablement.disabled("inhibited-by-" + arc.getPlaceId());
            }
            if (arc.getKind() == ArcKind.TEST && !arc.isSatisfiedBy(marking, 1)) {
                return Enablement.disabled("insufficient-tokens-" + arc.getPlaceId());
            }
            if (arc.consumesTokens() && marking <= 0) {
                return Enablement.disabled("input-place-empty-" + arc.getPlaceId());
            }
        }
        Enablement guard = checkGuard();
        if (guard != null) {
            return guard;
        }
        return locality.isSource() ? Enablement.ENABLED_NO_INPUTS : Enablement.ENABLED;
    }

    @Override
    public boolean isStructurallyEnabled() {
        for (Arc arc : locality.getInputArcs()) {
            double marking = place(arc).getMarking();
            if (arc.consumesTokens() ? marking <= 0 : !arc.isSatisfiedBy(marking, 1)) {
                return false;
            }
        }
        return true;
    }

    public FlowResult integrateStep(double dt, List<Arc> inputs, List<Arc> outputs) {
        return integrate(dt, inputs, outputs, true);
    }

    /**
     * Same computation as {@link #integrateStep} over the locality, without
     * touching the marking.
     */
    public FlowResult predictFlow(double dt) {
        return integrate(dt, locality.getInputArcs(), locality.getOutputArcs(), false);
    }

    /**
     * Clamped rate at the current marking.
     *
     * @throws ExpressionException if the rate function cannot be evaluated
     */
    public double evaluateCurrentRate() {
        return rateAt(clock.now(), 0.0, coefficients(consuming(locality.getInputArcs()), locality.getOutputArcs()),
                baseMarking(locality));
    }

    private FlowResult integrate(double dt, List<Arc> inputArcs, List<Arc> outputs, boolean apply) {
        if (dt < 0) {
            throw new IllegalArgumentException("Negative time step " + dt);
        }
        double now = clock.now();
        List<Arc> inputs = consuming(inputArcs);
        Map<String, Double> coefficients = coefficients(inputs, outputs);
        Map<String, Double> base = new HashMap<>();
        for (String placeId : coefficients.keySet()) {
            base.put(placeId, model.getPlace(placeId).getMarking());
        }

        double k1;
        double flow;
        try {
            k1 = rateAt(now, 0.0, coefficients, base);
            double k2 = rateAt(now + dt / 2, k1 * dt / 2, coefficients, base);
            double k3 = rateAt(now + dt / 2, k2 * dt / 2, coefficients, base);
            double k4 = rateAt(now + dt, k3 * dt, coefficients, base);
            flow = dt / 6 * (k1 + 2 * k2 + 2 * k3 + k4);
        } catch (RuntimeException e) {
            return FlowResult.failure("rate-evaluation-failed: " + e.getMessage());
        }

        if (flow <= 0 || dt == 0) {
            return FlowResult.success(new FlowRecord(getId(), now, k1, dt, 0.0,
                    zeros(inputs), zeros(outputs), false));
        }

        double actual = flow;
        for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
            double coefficient = entry.getValue();
            Place place = model.getPlace(entry.getKey());
            if (coefficient < 0) {
                actual = Math.min(actual, base.get(entry.getKey()) / -coefficient);
            } else if (coefficient > 0 && place.hasCapacity()) {
                actual = Math.min(actual, Math.max(0.0, place.getHeadroom()) / coefficient);
            }
        }
        boolean clamped = actual < flow;

        Map<String, Double> next = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
            double coefficient = entry.getValue();
            double value = base.get(entry.getKey()) + coefficient * actual;
            if (coefficient < 0 && value < DEPLETION_TOLERANCE) {
                if (value != 0.0) {
                    clamped = true;
                }
                value = 0.0;
            }
            next.put(entry.getKey(), value);
        }

        Map<String, Double> consumed = new LinkedHashMap<>();
        for (Arc arc : inputs) {
            consumed.merge(arc.getPlaceId(), arc.getWeight() * actual, Double::sum);
        }
        Map<String, Double> produced = new LinkedHashMap<>();
        for (Arc arc : outputs) {
            produced.merge(arc.getPlaceId(), arc.getWeight() * actual, Double::sum);
        }
        if (apply) {
            for (Map.Entry<String, Double> entry : next.entrySet()) {
                model.getPlace(entry.getKey()).setMarking(entry.getValue());
            }
        }
        return FlowResult.success(new FlowRecord(getId(), now, k1, dt, actual, consumed, produced, clamped));
    }

    /**
     * Rate seen after a partial flow {@code x}: inputs lowered and outputs
     * raised by {@code w * x}, floored at zero.
     */
    private double rateAt(double time, double x, Map<String, Double> coefficients, Map<String, Double> base) {
        Map<String, Double> displaced = new HashMap<>();
        for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
            displaced.put(entry.getKey(), Math.max(0.0, base.get(entry.getKey()) + entry.getValue() * x));
        }
        double raw = parameters.getRateFunction().evaluate(new MarkingContext(model, time, displaced));
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            throw new ExpressionException("Rate of " + getId() + " evaluated to " + raw);
        }
        return parameters.clamp(raw);
    }

    private Map<String, Double> baseMarking(Locality scope) {
        Map<String, Double> base = new HashMap<>();
        for (String placeId : scope.getPlaceIds()) {
            base.put(placeId, model.getPlace(placeId).getMarking());
        }
        return base;
    }

    /** Net marking change per unit of flow, for every place touched. */
    private static Map<String, Double> coefficients(List<Arc> inputs, List<Arc> outputs) {
        Map<String, Double> coefficients = new LinkedHashMap<>();
        for (Arc arc : inputs) {
            coefficients.merge(arc.getPlaceId(), -arc.getWeight(), Double::sum);
        }
        for (Arc arc : outputs) {
            coefficients.merge(arc.getPlaceId(), arc.getWeight(), Double::sum);
        }
        return coefficients;
    }

    private static Map<String, Double> zeros(List<Arc> arcs) {
        Map<String, Double> zeros = new LinkedHashMap<>();
        for (Arc arc : arcs) {
            zeros.put(arc.getPlaceId(), 0.0);
        }
        return zeros;
    }

    public ContinuousParameters getParameters() {
        return parameters;
    }

    @Override
    public String getTypeName() {
        return "Continuous";
    }
}
