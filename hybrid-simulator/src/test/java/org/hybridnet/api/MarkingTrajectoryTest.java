package org.hybridnet.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.hybridnet.engine.SimulationController;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.SimulationSettings;
import org.hybridnet.model.TransitionParameters;
import org.junit.jupiter.api.Test;

public class MarkingTrajectoryTest {

    @Test
    public void testRecordsEveryStep() {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P1", 3);
        net.addPlace("P2", 0);
        net.addTransition("T1", TransitionParameters.immediate());
        net.addInputArc("P1", "T1");
        net.addOutputArc("T1", "P2");
        MarkingTrajectory trajectory = new MarkingTrajectory();
        SimulationController controller = new SimulationController(net,
                SimulationSettings.builder().manualDt(0.5).build(), trajectory);

        controller.run(null, 5);

        assertEquals(4, trajectory.size(), "The run ends on the first step where nothing fires");
        assertEquals(List.of(0.5, 1.0, 1.5, 2.0), trajectory.getTimes());
        assertEquals(List.of(2.0, 1.0, 0.0, 0.0), trajectory.getSeries("P1"));
        assertEquals(List.of(1.0, 2.0, 3.0, 3.0), trajectory.getSeries("P2"));
        assertEquals(3, trajectory.getFiringCount());

        controller.reset();
        assertEquals(0, trajectory.size(), "Reset clears the samples");
        assertEquals(0, trajectory.getFiringCount());
    }
}
