package org.hybridnet.model;

public class SimulationSettingsBuilder {

    private final SimulationSettings settings = new SimulationSettings();

    public SimulationSettingsBuilder duration(double duration, TimeUnits units) {
        settings.setDuration(duration, units);
        return this;
    }

    public SimulationSettingsBuilder duration(double duration) {
        settings.setDuration(duration);
        return this;
    }

    public SimulationSettingsBuilder autoDt() {
        settings.setDtAuto(true);
        return this;
    }

    public SimulationSettingsBuilder manualDt(double dt) {
        settings.setDtAuto(false);
        settings.setDtManual(dt);
        return this;
    }

    public SimulationSettingsBuilder timeScale(double scale) {
        settings.setTimeScale(scale);
        return this;
    }

    public SimulationSettingsBuilder conflictPolicy(ConflictPolicy policy) {
        settings.setConflictPolicy(policy);
        return this;
    }

    public SimulationSettingsBuilder seed(Long seed) {
        settings.setRandomSeed(seed);
        return this;
    }

    public SimulationSettings build() {
        return new SimulationSettings(settings);
    }
}
