package org.hybridnet.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Net topology and marking handed to the simulation engine. Places,
 * transitions and arcs are built here before simulating; the engine only
 * mutates place markings.
 */
public class PetriNetModel {

    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();

    public Place addPlace(String id, double initialMarking) {
        return addPlace(new Place(id, initialMarking));
    }

    public Place addPlace(Place place) {
        checkFreeId(place.getId());
        places.put(place.getId(), place);
        return place;
    }

    public Transition addTransition(String id, TransitionParameters parameters) {
        return addTransition(new Transition(id, parameters));
    }

    public Transition addTransition(Transition transition) {
        checkFreeId(transition.getId());
        transitions.put(transition.getId(), transition);
        return transition;
    }

    public Arc addInputArc(String placeId, String transitionId) {
        return addArc(Arc.input(placeId, transitionId, 1));
    }

    public Arc addInputArc(String placeId, String transitionId, double weight) {
        return addArc(Arc.input(placeId, transitionId, weight));
    }

    public Arc addOutputArc(String transitionId, String placeId) {
        return addArc(Arc.output(transitionId, placeId, 1));
    }

    public Arc addOutputArc(String transitionId, String placeId, double weight) {
        return addArc(Arc.output(transitionId, placeId, weight));
    }

    /**
     * Adds an arc that disables {@code transitionId} while {@code placeId}
     * holds {@code threshold} tokens or more.
     */
    public Arc addInhibitorArc(String placeId, String transitionId, double threshold) {
        return addArc(Arc.inhibitor(placeId, transitionId, threshold));
    }

    /**
     * Adds a read arc: {@code weight} tokens must be present, none are consumed.
     */
    public Arc addTestArc(String placeId, String transitionId, double weight) {
        return addArc(Arc.test(placeId, transitionId, weight));
    }

    public Arc addArc(Arc arc) {
        if (!places.containsKey(arc.getPlaceId())) {
            throw new IllegalArgumentException("Arc " + arc + " does not start or end in a known place");
        }
        if (!transitions.containsKey(arc.getTransitionId())) {
            throw new IllegalArgumentException("Arc " + arc + " does not start or end in a known transition");
        }
        arcs.add(arc);
        return arc;
    }

    public Place getPlace(String id) {
        return places.get(id);
    }

    public Transition getTransition(String id) {
        return transitions.get(id);
    }

    public Collection<Place> getPlaces() {
        return Collections.unmodifiableCollection(places.values());
    }

    public Collection<Transition> getTransitions() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    public Locality getLocality(String transitionId) {
        if (!transitions.containsKey(transitionId)) {
            throw new IllegalArgumentException("Unknown transition " + transitionId);
        }
        List<Arc> inputs = new ArrayList<>();
        List<Arc> outputs = new ArrayList<>();
        for (Arc arc : arcs) {
            if (!arc.getTransitionId().equals(transitionId)) {
                continue;
            }
            if (arc.getDirection() == ArcDirection.INPUT) {
                inputs.add(arc);
            } else {
                outputs.add(arc);
            }
        }
        return new Locality(transitionId, inputs, outputs);
    }

    public double getMarking(String placeId) {
        Place place = places.get(placeId);
        if (place == null) {
            throw new IllegalArgumentException("Unknown place " + placeId);
        }
        return place.getMarking();
    }

    /**
     * Current marking of every place, in insertion order.
     */
    public Map<String, Double> snapshotMarking() {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        for (Place place : places.values()) {
            snapshot.put(place.getId(), place.getMarking());
        }
        return snapshot;
    }

    /**
     * Weighted sum of the markings, used to check P-invariants.
     */
    public double weightedSum(Map<String, Double> weights) {
        double sum = 0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            sum += entry.getValue() * getMarking(entry.getKey());
        }
        return sum;
    }

    public void resetMarking() {
        for (Place place : places.values()) {
            place.restoreInitialMarking();
        }
    }

    private void checkFreeId(String id) {
        if (places.containsKey(id) || transitions.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate node id " + id);
        }
    }
}
