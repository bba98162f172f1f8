package org.hybridnet.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hybridnet.api.SimulationListener;
import org.hybridnet.api.StepEvent;
import org.hybridnet.engine.conflict.ConflictResolver;
import org.hybridnet.model.Arc;
import org.hybridnet.model.ConflictPolicy;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.SimulationSettings;

/**
 * Advances a hybrid net in fixed time steps. Each step fires at most one
 * discrete transition and integrates every continuous transition that was
 * enabled at the start of the step.
 */
public class SimulationController {

    private static final Logger LOGGER = LogManager.getLogger();

    static final double LARGE_STEP_WARNING = 1.0;

    private final PetriNetModel model;
    private final Random random;
    private final Map<String, TransitionBehavior> behaviors;
    private final List<String> discreteOrder = new ArrayList<>();
    private final List<SimulationListener> listeners = new ArrayList<>();
    private SimulationSettings settings;
    private ConflictResolver resolver;
    private double time = 0.0;
    private long stepCount = 0;
    private volatile boolean running = false;
    private volatile boolean stopRequested = false;
    private boolean deadlocked = false;

    public SimulationController(PetriNetModel model, SimulationSettings settings, SimulationListener... listeners) {
        this(model, settings, settings.getRandomSeed() == null ? new Random() : new Random(settings.getRandomSeed()),
                listeners);
    }

    public SimulationController(PetriNetModel model, SimulationSettings settings, Random random,
            SimulationListener... listeners) {
        this.model = model;
        this.settings = new SimulationSettings(settings);
        this.random = random;
        this.behaviors = BehaviorFactory.createAll(model, this::getTime, random);
        for (TransitionBehavior behavior : behaviors.values()) {
            if (behavior instanceof DiscreteBehavior) {
                discreteOrder.add(behavior.getId());
            }
        }
        this.resolver = ConflictResolver.forPolicy(this.settings.getConflictPolicy(), discreteOrder, random);
        Collections.addAll(this.listeners, listeners);
    }

    public boolean step() {
        return step(getEffectiveDt());
    }

    /**
     * Advances the simulation by {@code dt}.
     *
     * @return false once the configured duration has been reached, or when
     *         nothing fired or flowed and no discrete transition is ready or
     *         waiting for its delay
     */
    public boolean step(double dt) {
        if (dt < 0 || Double.isNaN(dt)) {
            throw new IllegalArgumentException("Time step must be non negative, got " + dt);
        }
        if (dt > LARGE_STEP_WARNING) {
            LOGGER.warn("Large time step {} may reduce integration accuracy", dt);
        }

        for (TransitionBehavior behavior : behaviors.values()) {
            if (behavior instanceof DiscreteBehavior) {
                behavior.updateEnablement(time);
            }
        }

        List<ContinuousBehavior> pending = new ArrayList<>();
        List<List<Arc>> pendingInputs = new ArrayList<>();
        List<List<Arc>> pendingOutputs = new ArrayList<>();
        for (TransitionBehavior behavior : behaviors.values()) {
            if (behavior instanceof ContinuousBehavior && behavior.canFire().isEnabled()) {
                pending.add((ContinuousBehavior) behavior);
                pendingInputs.add(behavior.getInputArcs());
                pendingOutputs.add(behavior.getOutputArcs());
            }
        }

        List<String> failures = new ArrayList<>();
        List<String> urgent = new ArrayList<>();
        List<String> missed = new ArrayList<>();
        List<DiscreteBehavior> enabled = new ArrayList<>();
        Set<DiscreteBehavior> crossing = new HashSet<>();
        for (TransitionBehavior behavior : behaviors.values()) {
            if (!(behavior instanceof DiscreteBehavior)) {
                continue;
            }
            if (behavior.canFire().isEnabled()) {
                enabled.add((DiscreteBehavior) behavior);
            } else if (behavior instanceof TimedBehavior && ((TimedBehavior) behavior).willCrossWindow(dt)) {
                enabled.add((DiscreteBehavior) behavior);
                crossing.add((DiscreteBehavior) behavior);
            }
        }

        FiringRecord firing = null;
        DiscreteBehavior selected = resolver.select(enabled);
        if (selected != null) {
            FireResult result = crossing.contains(selected)
                    ? ((TimedBehavior) selected).fireAcrossWindow(dt, selected.getInputArcs(), selected.getOutputArcs())
                    : selected.fire(selected.getInputArcs(), selected.getOutputArcs());
            if (result.isSuccess()) {
                firing = result.getRecord();
                LOGGER.debug("t={} {}", time, firing);
            } else {
                LOGGER.warn("Firing of {} rejected: {}", selected.getId(), result.getReason());
                failures.add(selected.getId() + ": " + result.getReason());
            }
        }

        List<FlowRecord> flows = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            ContinuousBehavior behavior = pending.get(i);
            FlowResult result = behavior.integrateStep(dt, pendingInputs.get(i), pendingOutputs.get(i));
            if (result.isSuccess()) {
                flows.add(result.getRecord());
            } else {
                LOGGER.warn("Integration of {} failed: {}", behavior.getId(), result.getReason());
                failures.add(behavior.getId() + ": " + result.getReason());
            }
        }

        for (TransitionBehavior behavior : behaviors.values()) {
            if (!(behavior instanceof TimedBehavior)) {
                continue;
            }
            TimedBehavior timed = (TimedBehavior) behavior;
            if (timed.isUrgent(dt)) {
                urgent.add(timed.getId());
            } else if (timed.isDeadlineMissed()) {
                missed.add(timed.getId());
                if (timed.markDeadlineReported()) {
                    LOGGER.warn("Timed transition {} missed its deadline of {} at t={}", timed.getId(),
                            timed.getLatest(), time);
                }
            }
        }

        time += dt;
        stepCount++;
        deadlocked = firing == null && flows.isEmpty() && !hasPendingDiscrete();

        StepEvent event = new StepEvent(stepCount, time, dt, firing, flows, failures, urgent, missed,
                model.snapshotMarking());
        notifyStep(event);
        if (isSimulationComplete()) {
            return false;
        }
        if (deadlocked) {
            LOGGER.info("Nothing can fire or flow at t={}, the net is dead", time);
            return false;
        }
        return true;
    }

    private boolean hasPendingDiscrete() {
        for (TransitionBehavior behavior : behaviors.values()) {
            if (behavior instanceof DiscreteBehavior
                    && (behavior.canFire().isEnabled() || ((DiscreteBehavior) behavior).isWaiting())) {
                return true;
            }
        }
        return false;
    }

    public int run() {
        return run(null, null);
    }

    /**
     * Steps until {@link #stop()}, {@code maxSteps} or the configured duration.
     *
     * @param timeStep step size, {@code null} for the effective dt
     * @param maxSteps step limit, {@code null} for none
     * @return number of steps executed
     */
    public int run(Double timeStep, Integer maxSteps) {
        running = true;
        stopRequested = false;
        int steps = 0;
        try {
            while (!stopRequested && (maxSteps == null || steps < maxSteps) && !isSimulationComplete()) {
                double dt = timeStep != null ? timeStep : getEffectiveDt();
                steps++;
                if (!step(dt)) {
                    break;
                }
            }
        } finally {
            running = false;
        }
        LOGGER.debug("Run ended after {} steps at t={}", steps, time);
        return steps;
    }

    public void stop() {
        stopRequested = true;
    }

    public void reset() {
        time = 0.0;
        stepCount = 0;
        stopRequested = false;
        deadlocked = false;
        if (settings.getRandomSeed() != null) {
            random.setSeed(settings.getRandomSeed());
        }
        for (TransitionBehavior behavior : behaviors.values()) {
            behavior.clearEnablement();
        }
        model.resetMarking();
        resolver.reset();
        for (SimulationListener listener : new ArrayList<>(listeners)) {
            try {
                listener.onReset();
            } catch (RuntimeException e) {
                LOGGER.error("Listener failed on reset", e);
            }
        }
    }

    public void setConflictPolicy(ConflictPolicy policy) {
        settings.setConflictPolicy(policy);
        resolver = ConflictResolver.forPolicy(policy, discreteOrder, random);
        notifySettingsChanged();
    }

    public void updateSettings(SimulationSettings newSettings) {
        Long previousSeed = settings.getRandomSeed();
        ConflictPolicy previousPolicy = settings.getConflictPolicy();
        settings = new SimulationSettings(newSettings);
        if (settings.getConflictPolicy() != previousPolicy) {
            resolver = ConflictResolver.forPolicy(settings.getConflictPolicy(), discreteOrder, random);
        }
        if (settings.getRandomSeed() != null && !settings.getRandomSeed().equals(previousSeed)) {
            random.setSeed(settings.getRandomSeed());
        }
        notifySettingsChanged();
    }

    public double getEffectiveDt() {
        return settings.getEffectiveDt();
    }

    public double getProgress() {
        return settings.calculateProgress(time);
    }

    public boolean isSimulationComplete() {
        return settings.isComplete(time);
    }

    public SimulationState getState() {
        return new SimulationState(time, stepCount, running, getProgress(), model.snapshotMarking());
    }

    public double getTime() {
        return time;
    }

    /**
     * True when the last step found the net dead.
     */
    public boolean isDeadlocked() {
        return deadlocked;
    }

    public long getStepCount() {
        return stepCount;
    }

    public boolean isRunning() {
        return running;
    }

    public SimulationSettings getSettings() {
        return new SimulationSettings(settings);
    }

    public ConflictResolver getResolver() {
        return resolver;
    }

    public PetriNetModel getModel() {
        return model;
    }

    public TransitionBehavior getBehavior(String transitionId) {
        return behaviors.get(transitionId);
    }

    public Collection<TransitionBehavior> getBehaviors() {
        return Collections.unmodifiableCollection(behaviors.values());
    }

    public void addListener(SimulationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SimulationListener listener) {
        listeners.remove(listener);
    }

    private void notifyStep(StepEvent event) {
        for (SimulationListener listener : new ArrayList<>(listeners)) {
            try {
                if (event.getFiring() != null) {
                    listener.onTransitionFired(event.getFiring());
                }
                for (FlowRecord flow : event.getFlows()) {
                    listener.onFlowIntegrated(flow);
                }
                listener.onStepExecuted(event);
            } catch (RuntimeException e) {
                LOGGER.error("Listener failed on step {}", event.getStep(), e);
            }
        }
    }

    private void notifySettingsChanged() {
        SimulationSettings copy = new SimulationSettings(settings);
        for (SimulationListener listener : new ArrayList<>(listeners)) {
            try {
                listener.onSettingsChanged(copy);
            } catch (RuntimeException e) {
                LOGGER.error("Listener failed on settings change", e);
            }
        }
    }
}
