package org.hybridnet.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.hybridnet.model.ModelConfigurationException;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.Transition;

public final class BehaviorFactory {

    private BehaviorFactory() {
    }

    /**
     * @throws ModelConfigurationException if the transition parameters are invalid
     */
    public static TransitionBehavior create(Transition transition, PetriNetModel model,
            SimulationClock clock, Random random) {
        transition.getParameters().validate();
        switch (transition.getKind()) {
            case IMMEDIATE:
                return new ImmediateBehavior(transition, model, clock);
            case TIMED:
                return new TimedBehavior(transition, model, clock);
            case STOCHASTIC:
                return new StochasticBehavior(transition, model, clock, random);
            case CONTINUOUS:
                return new ContinuousBehavior(transition, model, clock);
            default:
                throw new ModelConfigurationException("Unsupported transition kind " + transition.getKind());
        }
    }

    /**
     * One behavior per transition, in model order.
     */
    public static Map<String, TransitionBehavior> createAll(PetriNetModel model, SimulationClock clock, Random random) {
        Map<String, TransitionBehavior> behaviors = new LinkedHashMap<>();
        for (Transition transition : model.getTransitions()) {
            behaviors.put(transition.getId(), create(transition, model, clock, random));
        }
        return behaviors;
    }
}
