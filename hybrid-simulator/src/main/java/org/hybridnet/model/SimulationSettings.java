package org.hybridnet.model;

/**
 * Timing and execution configuration of a simulation run. All values are
 * passed through to the controller; none of them changes the step algorithm.
 */
public class SimulationSettings {

    public static final TimeUnits DEFAULT_TIME_UNITS = TimeUnits.SECONDS;
    public static final boolean DEFAULT_DT_AUTO = true;
    public static final double DEFAULT_DT_MANUAL = 0.1;
    public static final double DEFAULT_TIME_SCALE = 1.0;
    public static final ConflictPolicy DEFAULT_CONFLICT_POLICY = ConflictPolicy.RANDOM;
    public static final int DEFAULT_STEPS_TARGET = 1000;

    private TimeUnits timeUnits = DEFAULT_TIME_UNITS;
    private Double duration;
    private double timeScale = DEFAULT_TIME_SCALE;
    private boolean dtAuto = DEFAULT_DT_AUTO;
    private double dtManual = DEFAULT_DT_MANUAL;
    private ConflictPolicy conflictPolicy = DEFAULT_CONFLICT_POLICY;
    private Long randomSeed;

    public SimulationSettings() {
    }

    public SimulationSettings(SimulationSettings other) {
        this.timeUnits = other.timeUnits;
        this.duration = other.duration;
        this.timeScale = other.timeScale;
        this.dtAuto = other.dtAuto;
        this.dtManual = other.dtManual;
        this.conflictPolicy = other.conflictPolicy;
        this.randomSeed = other.randomSeed;
    }

    public static SimulationSettingsBuilder builder() {
        return new SimulationSettingsBuilder();
    }

    public TimeUnits getTimeUnits() {
        return timeUnits;
    }

    public void setTimeUnits(TimeUnits timeUnits) {
        if (timeUnits == null) {
            throw new IllegalArgumentException("Time units cannot be null");
        }
        this.timeUnits = timeUnits;
    }

    /**
     * Duration in {@link #getTimeUnits()}, {@code null} when the run is unbounded.
     */
    public Double getDuration() {
        return duration;
    }

    public void setDuration(Double duration) {
        if (duration != null && !(duration > 0)) {
            throw new IllegalArgumentException("Duration must be positive or null");
        }
        this.duration = duration;
    }

    public void setDuration(double duration, TimeUnits units) {
        setTimeUnits(units);
        setDuration(duration);
    }

    public void clearDuration() {
        this.duration = null;
    }

    public boolean hasDuration() {
        return duration != null;
    }

    public Double getDurationSeconds() {
        return duration == null ? null : timeUnits.toSeconds(duration);
    }

    public double getTimeScale() {
        return timeScale;
    }

    public void setTimeScale(double timeScale) {
        if (!(timeScale > 0)) {
            throw new IllegalArgumentException("Time scale must be positive");
        }
        this.timeScale = timeScale;
    }

    public boolean isDtAuto() {
        return dtAuto;
    }

    public void setDtAuto(boolean dtAuto) {
        this.dtAuto = dtAuto;
    }

    public double getDtManual() {
        return dtManual;
    }

    public void setDtManual(double dtManual) {
        if (!(dtManual > 0) || Double.isInfinite(dtManual)) {
            throw new IllegalArgumentException("Manual time step must be positive and finite: " + dtManual);
        }
        this.dtManual = dtManual;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public void setConflictPolicy(ConflictPolicy conflictPolicy) {
        if (conflictPolicy == null) {
            throw new IllegalArgumentException("Conflict policy cannot be null");
        }
        this.conflictPolicy = conflictPolicy;
    }

    /**
     * Seed for the random source of stochastic transitions and of the random
     * conflict policy, {@code null} for an unseeded source.
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    /**
     * {@code duration / 1000} in auto mode when a duration is set, the manual
     * value otherwise.
     */
    public double getEffectiveDt() {
        if (dtAuto && duration != null) {
            return duration / DEFAULT_STEPS_TARGET;
        }
        return dtManual;
    }

    public Integer estimateStepCount() {
        if (duration == null) {
            return null;
        }
        return (int) Math.ceil(duration / getEffectiveDt() - 1e-9);
    }

    public double calculateProgress(double time) {
        if (duration == null) {
            return 0.0;
        }
        return Math.min(time / duration, 1.0);
    }

    public boolean isComplete(double time) {
        return duration != null && time >= duration - 1e-9;
    }

    @Override
    public String toString() {
        String durationText = duration == null ? "unbounded" : duration + " " + timeUnits.getSymbol();
        String dtText = dtAuto ? "auto (" + getEffectiveDt() + ")" : "manual (" + dtManual + ")";
        return "SimulationSettings(duration=" + durationText + ", dt=" + dtText + ", scale=" + timeScale
                + ", policy=" + conflictPolicy + ")";
    }
}
