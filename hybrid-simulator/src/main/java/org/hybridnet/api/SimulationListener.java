package org.hybridnet.api;

import org.hybridnet.engine.FiringRecord;
import org.hybridnet.engine.FlowRecord;
import org.hybridnet.model.SimulationSettings;

/**
 * Callbacks invoked synchronously by the controller at the end of each step.
 */
public interface SimulationListener {

    default void onStepExecuted(StepEvent event) {
    }

    default void onTransitionFired(FiringRecord record) {
    }

    default void onFlowIntegrated(FlowRecord record) {
    }

    default void onReset() {
    }

    default void onSettingsChanged(SimulationSettings settings) {
    }
}
