package org.hybridnet.engine;

/**
 * Source of the current simulation time for behaviors.
 */
@FunctionalInterface
public interface SimulationClock {

    double now();
}
