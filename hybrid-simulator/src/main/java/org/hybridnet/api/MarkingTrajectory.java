package org.hybridnet.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the marking after every step, for plotting.
 */
public class MarkingTrajectory implements SimulationListener {

    private final List<Double> times = new ArrayList<>();
    private final List<Map<String, Double>> markings = new ArrayList<>();
    private int firings = 0;

    @Override
    public void onStepExecuted(StepEvent event) {
        times.add(event.getTime());
        markings.add(new LinkedHashMap<>(event.getMarking()));
        if (event.getFiring() != null) {
            firings++;
        }
    }

    @Override
    public void onReset() {
        times.clear();
        markings.clear();
        firings = 0;
    }

    public int size() {
        return times.size();
    }

    public List<Double> getTimes() {
        return Collections.unmodifiableList(times);
    }

    public List<Map<String, Double>> getMarkings() {
        return Collections.unmodifiableList(markings);
    }

    /**
     * Values of one place, aligned with {@link #getTimes()}.
     */
    public List<Double> getSeries(String placeId) {
        List<Double> series = new ArrayList<>(markings.size());
        for (Map<String, Double> marking : markings) {
            series.add(marking.get(placeId));
        }
        return series;
    }

    public int getFiringCount() {
        return firings;
    }
}
