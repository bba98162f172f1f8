package org.hybridnet.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.TransitionParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TimedBehaviorTest {

    private final double[] now = {0.0};
    private PetriNetModel net;
    private TimedBehavior t1;

    @BeforeEach
    public void setUp() {
        now[0] = 0.0;
        net = new PetriNetModel();
        net.addPlace("P1", 1);
        net.addPlace("P2", 0);
        net.addTransition("T1", TransitionParameters.timed(2, 5));
        net.addInputArc("P1", "T1");
        net.addOutputArc("T1", "P2");
        t1 = (TimedBehavior) BehaviorFactory.create(net.getTransition("T1"), net, () -> now[0], new Random(1));
    }

    @Test
    public void testFiringWindow() {
        assertEquals("not-enabled-yet", t1.canFire().getReason(), "Not tracked before the first update");
        t1.updateEnablement(0.0);
        assertEquals(0.0, t1.getEnablementTime(), 0.0);

        for (double t = 0.0; t < 2.0 - 1e-6; t += 0.5) {
            now[0] = t;
            assertFalse(t1.canFire().isEnabled(), "Disabled before the window at t=" + t);
            assertEquals("too-early", t1.canFire().getReason());
        }
        for (double t = 2.0; t <= 5.0; t += 0.5) {
            now[0] = t;
            assertTrue(t1.canFire().isEnabled(), "Enabled inside the window at t=" + t);
        }
        now[0] = 5.5;
        assertEquals("too-late", t1.canFire().getReason());
        assertTrue(t1.isDeadlineMissed());
    }

    @Test
    public void testUrgency() {
        t1.updateEnablement(0.0);

        now[0] = 3.0;
        assertFalse(t1.isUrgent(0.1), "Plenty of time left");
        now[0] = 4.95;
        assertTrue(t1.isUrgent(0.1), "The window closes within the next step");
        assertFalse(t1.isDeadlineMissed());
        now[0] = 5.2;
        assertFalse(t1.isUrgent(0.1), "Past the deadline is missed, not urgent");
        assertTrue(t1.isDeadlineMissed());
    }

    @Test
    public void testDisablementRestartsWindow() {
        t1.updateEnablement(0.0);
        net.getPlace("P1").setMarking(0);
        t1.updateEnablement(1.0);
        assertNull(t1.getEnablementTime(), "Tracking stops when the input empties");

        net.getPlace("P1").setMarking(1);
        t1.updateEnablement(3.0);
        now[0] = 4.0;
        assertEquals("too-early", t1.canFire().getReason(), "A fresh window starts at t=3");
        now[0] = 5.0;
        assertTrue(t1.canFire().isEnabled());
    }

    @Test
    public void testFireInsideWindow() {
        t1.updateEnablement(0.0);
        now[0] = 1.0;
        FireResult early = t1.fire(t1.getInputArcs(), t1.getOutputArcs());
        assertFalse(early.isSuccess(), "Cannot fire before earliest");
        assertEquals(1.0, net.getMarking("P1"), 0.0);

        now[0] = 3.0;
        FireResult result = t1.fire(t1.getInputArcs(), t1.getOutputArcs());
        assertTrue(result.isSuccess());
        assertEquals(3.0, result.getRecord().getElapsed(), 1e-12);
        assertEquals(0.0, net.getMarking("P1"), 0.0);
        assertEquals(1.0, net.getMarking("P2"), 0.0);
        assertNull(t1.getEnablementTime(), "Firing clears the enablement");
    }

    @Test
    public void testWindowCrossedWithinOneStep() {
        net.addTransition("D1", TransitionParameters.timed(0.25, 0.25));
        net.addInputArc("P1", "D1");
        net.addOutputArc("D1", "P2");
        TimedBehavior d1 = (TimedBehavior) BehaviorFactory.create(net.getTransition("D1"), net, () -> now[0],
                new Random(1));
        d1.updateEnablement(0.0);

        now[0] = 0.1;
        assertFalse(d1.willCrossWindow(0.1), "The step ends at 0.2, before the window");
        assertTrue(d1.isWaiting());
        now[0] = 0.2;
        assertEquals("too-early", d1.canFire().getReason());
        assertTrue(d1.willCrossWindow(0.1), "The step from 0.2 to 0.3 jumps over 0.25");

        FireResult result = d1.fireAcrossWindow(0.1, d1.getInputArcs(), d1.getOutputArcs());

        assertTrue(result.isSuccess());
        assertEquals(0.25, result.getRecord().getElapsed(), 1e-12);
        assertEquals(0.0, net.getMarking("P1"), 0.0);
        assertEquals(1.0, net.getMarking("P2"), 0.0);
        assertNull(d1.getEnablementTime(), "Firing clears the enablement");
    }

    @Test
    public void testNoCrossingWhenTheStepLandsInTheWindow() {
        t1.updateEnablement(0.0);
        now[0] = 1.9;

        assertFalse(t1.willCrossWindow(0.5), "The step ends at 2.4, inside the window");
        assertFalse(t1.fireAcrossWindow(0.5, t1.getInputArcs(), t1.getOutputArcs()).isSuccess());
        assertEquals(1.0, net.getMarking("P1"), 0.0);
    }
}
