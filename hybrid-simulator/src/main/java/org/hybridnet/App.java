package org.hybridnet;

import java.util.Map;

import org.hybridnet.api.MarkingTrajectory;
import org.hybridnet.engine.SimulationController;
import org.hybridnet.model.ConflictPolicy;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.SimulationSettings;
import org.hybridnet.model.TimeUnits;
import org.hybridnet.model.Transition;
import org.hybridnet.model.TransitionParameters;
import org.hybridnet.model.expr.RateExpression;

public class App {

    public static void main(String[] args) {
        double duration = Double.parseDouble(System.getenv().getOrDefault("HYBRID_DURATION", "60"));
        ConflictPolicy policy = ConflictPolicy.fromName(System.getenv().getOrDefault("HYBRID_POLICY", "priority"));
        String seed = System.getenv().getOrDefault("HYBRID_SEED", "42");

        SimulationSettings settings = SimulationSettings.builder()
                .duration(duration, TimeUnits.SECONDS)
                .conflictPolicy(policy)
                .seed(seed.isEmpty() ? null : Long.valueOf(seed))
                .build();

        MarkingTrajectory trajectory = new MarkingTrajectory();
        SimulationController controller = new SimulationController(buildNet(), settings, trajectory);

        int steps = controller.run();

        System.out.printf("%s%n", settings);
        System.out.printf("%d steps, %d discrete firings, t=%.3f %s%n", steps, trajectory.getFiringCount(),
                controller.getTime(), settings.getTimeUnits().getSymbol());
        for (Map.Entry<String, Double> entry : controller.getState().getMarking().entrySet()) {
            System.out.printf("%-10s %10.4f%n", entry.getKey(), entry.getValue());
        }
    }

    /**
     * Requests arrive stochastically, wait in a buffer, get admitted by an
     * immediate transition and are processed by a saturating continuous flow.
     * A timed transition drains the buffer when it stays non empty too long.
     */
    static PetriNetModel buildNet() {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("buffer", 0);
        net.addPlace("slots", 5);
        net.addPlace("work", 0);
        net.addPlace("done", 0);
        net.addPlace("dropped", 0);

        net.addTransition("arrival", TransitionParameters.stochastic(0.8, 3));
        net.addOutputArc("arrival", "buffer");

        net.addTransition(new Transition("admit", TransitionParameters.immediate()).setPriority(10));
        net.addInputArc("buffer", "admit");
        net.addInputArc("slots", "admit");
        net.addOutputArc("admit", "work");

        net.addTransition("timeout", TransitionParameters.timed(4, 6));
        net.addInputArc("buffer", "timeout");
        net.addOutputArc("timeout", "dropped");

        net.addTransition("process", TransitionParameters.continuous(
                RateExpression.parse("michaelis_menten(work, vmax, km)", Map.of("vmax", 2.0, "km", 1.5))));
        net.addInputArc("work", "process");
        net.addOutputArc("process", "done");
        net.addOutputArc("process", "slots");
        return net;
    }
}
