package org.hybridnet.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Random;

import org.hybridnet.model.Place;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.RateFunction;
import org.hybridnet.model.TransitionParameters;
import org.hybridnet.model.expr.RateExpression;
import org.junit.jupiter.api.Test;

public class ContinuousBehaviorTest {

    private final double[] now = {0.0};

    private PetriNetModel flow(double initial, RateFunction rate) {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P1", initial);
        net.addPlace("P2", 0);
        net.addTransition("C1", TransitionParameters.continuous(rate));
        net.addInputArc("P1", "C1");
        net.addOutputArc("C1", "P2");
        return net;
    }

    private ContinuousBehavior behavior(PetriNetModel net) {
        return (ContinuousBehavior) BehaviorFactory.create(net.getTransition("C1"), net, () -> now[0], new Random(1));
    }

    private FlowResult step(ContinuousBehavior behavior, double dt) {
        FlowResult result = behavior.integrateStep(dt, behavior.getInputArcs(), behavior.getOutputArcs());
        now[0] += dt;
        return result;
    }

    @Test
    public void testConstantRate() {
        PetriNetModel net = flow(10, RateFunction.constant(2));
        ContinuousBehavior c1 = behavior(net);

        FlowResult result = step(c1, 0.1);

        assertTrue(result.isSuccess());
        assertEquals(9.8, net.getMarking("P1"), 1e-12);
        assertEquals(0.2, net.getMarking("P2"), 1e-12);
        assertEquals(2.0, result.getRecord().getRate(), 0.0);
        assertEquals("rk4", result.getRecord().getMethod());
        assertFalse(result.getRecord().isClamped());
    }

    @Test
    public void testDepletion() {
        PetriNetModel net = flow(10, RateFunction.constant(2));
        ContinuousBehavior c1 = behavior(net);

        for (int i = 0; i < 50; i++) {
            assertTrue(c1.canFire().isEnabled(), "Still flowing at step " + i);
            assertTrue(step(c1, 0.1).isSuccess());
            assertEquals(10.0, net.getMarking("P1") + net.getMarking("P2"), 1e-9, "Mass is conserved at step " + i);
        }

        assertEquals(0.0, net.getMarking("P1"), 1e-6, "P1 is empty after 50 steps of 0.1 at rate 2");
        assertEquals(10.0, net.getMarking("P2"), 1e-6);
        assertFalse(c1.canFire().isEnabled(), "No flow out of an empty place");
        assertEquals("input-place-empty-P1", c1.canFire().getReason());
    }

    @Test
    public void testClampToEmptyInput() {
        PetriNetModel net = flow(0.1, RateFunction.constant(2));
        ContinuousBehavior c1 = behavior(net);

        FlowResult result = step(c1, 0.1);

        assertTrue(result.getRecord().isClamped(), "The requested 0.2 exceeds the 0.1 available");
        assertEquals(0.0, net.getMarking("P1"), 0.0, "The input is emptied exactly");
        assertEquals(0.1, net.getMarking("P2"), 1e-12);
    }

    @Test
    public void testOutputCapacityClamp() {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P1", 10);
        net.addPlace(new Place("P2", "tank", 0, 0.05));
        net.addTransition("C1", TransitionParameters.continuous(RateFunction.constant(2)));
        net.addInputArc("P1", "C1");
        net.addOutputArc("C1", "P2");
        ContinuousBehavior c1 = behavior(net);

        FlowResult result = step(c1, 0.1);

        assertTrue(result.getRecord().isClamped());
        assertEquals(0.05, net.getMarking("P2"), 1e-12, "Filled up to the capacity");
        assertEquals(9.95, net.getMarking("P1"), 1e-12);
    }

    @Test
    public void testFirstOrderDecayMatchesExponential() {
        PetriNetModel net = flow(1, RateExpression.parse("k * P1", Map.of("k", 1.0)));
        ContinuousBehavior c1 = behavior(net);

        for (int i = 0; i < 10; i++) {
            step(c1, 0.1);
        }

        assertEquals(Math.exp(-1), net.getMarking("P1"), 1e-5, "RK4 tracks the analytic solution of dP/dt = -P");
        assertEquals(1.0, net.getMarking("P1") + net.getMarking("P2"), 1e-12);
    }

    @Test
    public void testTimeDependentSource() {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P2", 0);
        net.addTransition("C1", TransitionParameters.continuous(RateExpression.parse("t")));
        net.addOutputArc("C1", "P2");
        ContinuousBehavior c1 = behavior(net);

        assertEquals("enabled-no-inputs", c1.canFire().getReason());
        step(c1, 1.0);

        assertEquals(0.5, net.getMarking("P2"), 1e-12, "Integral of t over [0, 1]");
    }

    @Test
    public void testZeroRate() {
        PetriNetModel net = flow(5, RateExpression.parse("max(P1 - 10, 0)"));
        ContinuousBehavior c1 = behavior(net);

        FlowResult result = step(c1, 0.1);

        assertTrue(result.isSuccess());
        assertEquals(0.0, result.getRecord().getFlow(), 0.0);
        assertEquals(5.0, net.getMarking("P1"), 0.0);
    }

    @Test
    public void testRateBounds() {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P1", 100);
        net.addPlace("P2", 0);
        net.addTransition("C1", TransitionParameters.continuous(RateExpression.parse("P1"), 0, 3));
        net.addInputArc("P1", "C1");
        net.addOutputArc("C1", "P2");
        ContinuousBehavior c1 = behavior(net);

        assertEquals(3.0, c1.evaluateCurrentRate(), 0.0, "The rate is capped at maxRate");
    }

    @Test
    public void testEvaluationFailureLeavesMarking() {
        PetriNetModel net = flow(5, RateExpression.parse("1 / P2"));
        ContinuousBehavior c1 = behavior(net);

        FlowResult result = step(c1, 0.1);

        assertFalse(result.isSuccess());
        assertTrue(result.getReason().startsWith("rate-evaluation-failed"));
        assertEquals(5.0, net.getMarking("P1"), 0.0);
        assertEquals(0.0, net.getMarking("P2"), 0.0);
    }

    @Test
    public void testPredictFlowIsReadOnly() {
        PetriNetModel net = flow(10, RateFunction.constant(2));
        ContinuousBehavior c1 = behavior(net);

        FlowResult predicted = c1.predictFlow(0.5);

        assertEquals(1.0, predicted.getRecord().getFlow(), 1e-12);
        assertEquals(10.0, net.getMarking("P1"), 0.0, "Prediction does not move anything");
    }

    @Test
    public void testThrowingRateFunction() {
        PetriNetModel net = flow(5, context -> {
            throw new IllegalStateException("lookup table missing");
        });
        ContinuousBehavior c1 = behavior(net);

        FlowResult result = step(c1, 0.1);

        assertFalse(result.isSuccess(), "The failure is reported, not thrown");
        assertTrue(result.getReason().contains("lookup table missing"));
        assertEquals(5.0, net.getMarking("P1"), 0.0);
    }

    @Test
    public void testInhibitorArc() {
        PetriNetModel net = flow(10, RateFunction.constant(1));
        net.addInhibitorArc("P2", "C1", 0.25);
        ContinuousBehavior c1 = behavior(net);

        assertTrue(c1.canFire().isEnabled());
        FlowResult result = step(c1, 0.1);
        assertEquals(0.1, net.getMarking("P2"), 1e-12);
        assertEquals(1, result.getRecord().getConsumed().size(), "Only P1 is consumed");
        step(c1, 0.1);
        step(c1, 0.1);

        assertEquals("inhibited-by-P2", c1.canFire().getReason(), "The product reached the threshold");
        assertFalse(c1.isStructurallyEnabled());
    }

    @Test
    public void testTestArc() {
        PetriNetModel net = flow(10, RateExpression.parse("2 * catalyst"));
        net.addPlace("catalyst", 0);
        net.addTestArc("catalyst", "C1", 1);
        ContinuousBehavior c1 = behavior(net);

        assertEquals("insufficient-tokens-catalyst", c1.canFire().getReason());

        net.getPlace("catalyst").setMarking(1.5);
        assertTrue(c1.canFire().isEnabled());
        FlowResult result = step(c1, 0.5);

        assertTrue(result.isSuccess());
        assertEquals(1.5, net.getMarking("catalyst"), 0.0, "The catalyst is read, not consumed");
        assertEquals(8.5, net.getMarking("P1"), 1e-12);
        assertEquals(1.5, net.getMarking("P2"), 1e-12);
    }
}
