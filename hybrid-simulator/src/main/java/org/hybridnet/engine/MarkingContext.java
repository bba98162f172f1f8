package org.hybridnet.engine;

import java.util.Collections;
import java.util.Map;

import org.hybridnet.model.Place;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.RateContext;
import org.hybridnet.model.expr.ExpressionException;

/**
 * Rate context over the live marking, optionally with some places displaced
 * (used by the intermediate Runge-Kutta evaluations).
 */
class MarkingContext implements RateContext {

    private final PetriNetModel model;
    private final double time;
    private final Map<String, Double> overrides;

    MarkingContext(PetriNetModel model, double time) {
        this(model, time, Collections.emptyMap());
    }

    MarkingContext(PetriNetModel model, double time, Map<String, Double> overrides) {
        this.model = model;
        this.time = time;
        this.overrides = overrides;
    }

    @Override
    public double getMarking(String placeId) {
        Double override = overrides.get(placeId);
        if (override != null) {
            return override;
        }
        Place place = model.getPlace(placeId);
        if (place == null) {
            throw new ExpressionException("Unknown place " + placeId);
        }
        return place.getMarking();
    }

    @Override
    public boolean hasPlace(String placeId) {
        return model.getPlace(placeId) != null;
    }

    @Override
    public double getTime() {
        return time;
    }
}
