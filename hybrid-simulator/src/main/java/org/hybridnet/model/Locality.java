package org.hybridnet.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The arcs directly connected to one transition. Computed once per behavior
 * and shared by enablement checks, firing and integration.
 */
public class Locality {

    private final String transitionId;
    private final List<Arc> inputArcs;
    private final List<Arc> outputArcs;

    public Locality(String transitionId, List<Arc> inputArcs, List<Arc> outputArcs) {
        this.transitionId = transitionId;
        this.inputArcs = Collections.unmodifiableList(new ArrayList<>(inputArcs));
        this.outputArcs = Collections.unmodifiableList(new ArrayList<>(outputArcs));
    }

    public String getTransitionId() {
        return transitionId;
    }

    public List<Arc> getInputArcs() {
        return inputArcs;
    }

    public List<Arc> getOutputArcs() {
        return outputArcs;
    }

    public boolean isSource() {
        return inputArcs.isEmpty();
    }

    public boolean isSink() {
        return outputArcs.isEmpty();
    }

    public Set<String> getPlaceIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Arc arc : inputArcs) {
            ids.add(arc.getPlaceId());
        }
        for (Arc arc : outputArcs) {
            ids.add(arc.getPlaceId());
        }
        return ids;
    }

    /**
     * True when the two localities touch at least one common place.
     */
    public boolean overlaps(Locality other) {
        Set<String> mine = getPlaceIds();
        for (String id : other.getPlaceIds()) {
            if (mine.contains(id)) {
                return true;
            }
        }
        return false;
    }
}
