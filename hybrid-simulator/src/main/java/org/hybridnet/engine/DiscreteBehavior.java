package org.hybridnet.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.hybridnet.model.Arc;
import org.hybridnet.model.ArcKind;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.Place;
import org.hybridnet.model.Transition;

/**
 * Behaviors that move tokens in whole, atomic firings.
 */
public abstract class DiscreteBehavior extends TransitionBehavior {

    protected DiscreteBehavior(Transition transition, PetriNetModel model, SimulationClock clock) {
        super(transition, model, clock);
    }

    public abstract FireResult fire(List<Arc> inputs, List<Arc> outputs);

    public int getPriority() {
        return transition.getPriority();
    }

    /**
     * True while the transition is tracked but its delay has not elapsed yet.
     */
    public boolean isWaiting() {
        return false;
    }

    /**
     * Token check shared by the discrete kinds, {@code null} when every
     * consuming input place holds at least {@code weight * multiplier} and
     * every test and inhibitor arc is satisfied.
     */
    protected Enablement checkTokens(List<Arc> inputs, int multiplier, String reasonPrefix) {
        Enablement conditions = checkReadArcs(inputs, reasonPrefix);
        if (conditions != null) {
            return conditions;
        }
        Map<String, Double> required = sumByPlace(consuming(inputs), multiplier);
        for (Map.Entry<String, Double> entry : required.entrySet()) {
            if (model.getPlace(entry.getKey()).getMarking() < entry.getValue()) {
                return Enablement.disabled(reasonPrefix + entry.getKey());
            }
        }
        return null;
    }

    /**
     * Moves {@code weight * multiplier} along every normal arc, or nothing at all when
     * a read arc is unsatisfied, an input is short or an output would exceed
     * its capacity.
     */
    protected FireResult transfer(List<Arc> inputs, List<Arc> outputs, int multiplier, double time) {
        Enablement conditions = checkReadArcs(inputs, "insufficient-tokens-");
        if (conditions != null) {
            return FireResult.failure(conditions.getReason());
        }
        Map<String, Double> consumed = sumByPlace(consuming(inputs), multiplier);
        Map<String, Double> produced = sumByPlace(outputs, multiplier);
        Map<String, Double> next = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : consumed.entrySet()) {
            Place place = model.getPlace(entry.getKey());
            if (place.getMarking() < entry.getValue()) {
                return FireResult.failure("insufficient-tokens-" + place.getId());
            }
            next.put(place.getId(), place.getMarking() - entry.getValue());
        }
        for (Map.Entry<String, Double> entry : produced.entrySet()) {
            Place place = model.getPlace(entry.getKey());
            double value = next.getOrDefault(place.getId(), place.getMarking()) + entry.getValue();
            if (place.hasCapacity() && value > place.getCapacity()) {
                return FireResult.failure("capacity-exceeded-" + place.getId());
            }
            next.put(place.getId(), value);
        }
        for (Map.Entry<String, Double> entry : next.entrySet()) {
            model.getPlace(entry.getKey()).setMarking(entry.getValue());
        }
        return FireResult.success(new FiringRecord(getId(), getKind(), time, consumed, produced));
    }

    private Enablement checkReadArcs(List<Arc> inputs, String reasonPrefix) {
        for (Arc arc : inputs) {
            if (arc.consumesTokens() || arc.isSatisfiedBy(place(arc).getMarking(), 1)) {
                continue;
            }
            if (arc.getKind() == ArcKind.INHIBITOR) {
                return Enablement.disabled("inhibited-by-" + arc.getPlaceId());
            }
            return Enablement.disabled(reasonPrefix + arc.getPlaceId());
        }
        return null;
    }

    private static Map<String, Double> sumByPlace(List<Arc> arcs, int multiplier) {
        Map<String, Double> sums = new LinkedHashMap<>();
        for (Arc arc : arcs) {
            sums.merge(arc.getPlaceId(), arc.getWeight() * multiplier, Double::sum);
        }
        return sums;
    }
}
