package org.hybridnet.io;

import java.math.BigDecimal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.oristool.math.OmegaBigDecimal;
import org.oristool.math.function.EXP;
import org.oristool.models.stpn.trees.StochasticTransitionFeature;
import org.oristool.models.tpn.TimedTransitionFeature;
import org.oristool.petrinet.Marking;
import org.oristool.petrinet.PetriNet;
import org.oristool.petrinet.Place;
import org.oristool.petrinet.Postcondition;
import org.oristool.petrinet.Precondition;
import org.oristool.petrinet.Transition;

import org.hybridnet.model.ModelConfigurationException;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.TransitionParameters;

/**
 * Builds a {@link PetriNetModel} from a sirio net and its initial marking.
 *
 * <p>Exponential features become single token stochastic transitions with
 * rate {@code lambda * clockRate}. Any other density becomes a timed
 * transition over its support {@code [EFT, LFT]}, or an immediate one when
 * the support is the single point zero. Transitions with no feature are
 * immediate.
 */
public final class OrisNetImporter {

    private static final Logger LOGGER = LogManager.getLogger();

    private OrisNetImporter() {
    }

    public static PetriNetModel importNet(PetriNet net, Marking marking) {
        PetriNetModel model = new PetriNetModel();
        for (Place place : net.getPlaces()) {
            model.addPlace(place.getName(), marking.getTokens(place));
        }
        for (Transition transition : net.getTransitions()) {
            model.addTransition(transition.getName(), parametersOf(transition, marking));
            for (Precondition pre : net.getPreconditions(transition)) {
                model.addInputArc(pre.getPlace().getName(), transition.getName(), pre.getMultiplicity());
            }
            for (Postcondition post : net.getPostconditions(transition)) {
                model.addOutputArc(transition.getName(), post.getPlace().getName(), post.getMultiplicity());
            }
        }
        LOGGER.debug("Imported {} places and {} transitions", model.getPlaces().size(), model.getTransitions().size());
        return model;
    }

    static TransitionParameters parametersOf(Transition transition, Marking marking) {
        if (transition.hasFeature(StochasticTransitionFeature.class)) {
            StochasticTransitionFeature st = transition.getFeature(StochasticTransitionFeature.class);
            if (st.isEXP()) {
                BigDecimal lambda = ((EXP) st.density()).getLambda();
                double rate = lambda.doubleValue() * st.clockRate().evaluate(marking);
                return TransitionParameters.stochastic(rate, 1);
            }
            return window(transition, st.density().getDomainsEFT(), st.density().getDomainsLFT());
        }
        if (transition.hasFeature(TimedTransitionFeature.class)) {
            TimedTransitionFeature tt = transition.getFeature(TimedTransitionFeature.class);
            return window(transition, tt.getEFT(), tt.getLFT());
        }
        return TransitionParameters.immediate();
    }

    private static TransitionParameters window(Transition transition, OmegaBigDecimal eft, OmegaBigDecimal lft) {
        double earliest = eft.doubleValue();
        double latest = lft.doubleValue();
        if (Double.isInfinite(earliest)) {
            throw new ModelConfigurationException("Transition " + transition.getName() + " has no finite earliest firing time");
        }
        if (earliest == 0.0 && latest == 0.0) {
            return TransitionParameters.immediate();
        }
        return TransitionParameters.timed(earliest, latest);
    }
}
