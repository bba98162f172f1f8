package org.hybridnet.engine;

import java.util.List;

import org.hybridnet.model.Arc;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.Transition;

public class ImmediateBehavior extends DiscreteBehavior {

    public ImmediateBehavior(Transition transition, PetriNetModel model, SimulationClock clock) {
        super(transition, model, clock);
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
        return locality.isSource() ? Enablement.ENABLED_NO_INPUTS : Enablement.ENABLED;
    }

    @Override
    public FireResult fire(List<Arc> inputs, List<Arc> outputs) {
        return transfer(inputs, outputs, 1, clock.now());
    }

    @Override
    public String getTypeName() {
        return "Immediate";
    }
}
