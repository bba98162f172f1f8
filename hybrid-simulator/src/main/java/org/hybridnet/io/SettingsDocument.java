package org.hybridnet.io;

/**
 * JSON shape of {@link org.hybridnet.model.SimulationSettings}.
 */
public class SettingsDocument {

    public String time_units;
    public Double duration;
    public double time_scale = 1.0;
    public boolean dt_auto = true;
    public double dt_manual = 0.1;
    public String conflict_policy;
    public Long random_seed;
}
