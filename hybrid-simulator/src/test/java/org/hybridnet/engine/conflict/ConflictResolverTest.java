package org.hybridnet.engine.conflict;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.hybridnet.engine.BehaviorFactory;
import org.hybridnet.engine.DiscreteBehavior;
import org.hybridnet.model.ConflictPolicy;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.Transition;
import org.hybridnet.model.TransitionParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ConflictResolverTest {

    private final List<String> order = List.of("T1", "T2", "T3");
    private DiscreteBehavior t1;
    private DiscreteBehavior t2;
    private DiscreteBehavior t3;

    @BeforeEach
    public void setUp() {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P", 0);
        net.addTransition(new Transition("T1", TransitionParameters.immediate()).setPriority(1));
        net.addTransition(new Transition("T2", TransitionParameters.immediate()).setPriority(5));
        net.addTransition(new Transition("T3", TransitionParameters.immediate()).setPriority(5));
        for (String id : order) {
            net.addOutputArc(id, "P");
        }
        Random random = new Random(1);
        t1 = (DiscreteBehavior) BehaviorFactory.create(net.getTransition("T1"), net, () -> 0.0, random);
        t2 = (DiscreteBehavior) BehaviorFactory.create(net.getTransition("T2"), net, () -> 0.0, random);
        t3 = (DiscreteBehavior) BehaviorFactory.create(net.getTransition("T3"), net, () -> 0.0, random);
    }

    @Test
    public void testEmptyCandidates() {
        for (ConflictPolicy policy : ConflictPolicy.values()) {
            ConflictResolver resolver = ConflictResolver.forPolicy(policy, order, new Random(1));
            assertNull(resolver.select(new ArrayList<>()), policy + " selects nothing from nothing");
            assertEquals(policy, resolver.getPolicy());
        }
    }

    @Test
    public void testPriority() {
        ConflictResolver resolver = ConflictResolver.forPolicy(ConflictPolicy.PRIORITY, order, new Random(1));

        assertEquals("T2", resolver.select(List.of(t1, t2, t3)).getId(), "Tie at priority 5 goes to the first declared");
        assertEquals("T2", resolver.select(List.of(t3, t1, t2)).getId(), "Candidate order does not matter");
        assertEquals("T1", resolver.select(List.of(t1)).getId());
    }

    @Test
    public void testRoundRobin() {
        ConflictResolver resolver = ConflictResolver.forPolicy(ConflictPolicy.ROUND_ROBIN, order, new Random(1));
        List<DiscreteBehavior> all = List.of(t1, t2, t3);

        assertEquals("T1", resolver.select(all).getId());
        assertEquals("T2", resolver.select(all).getId());
        assertEquals("T3", resolver.select(all).getId());
        assertEquals("T1", resolver.select(all).getId(), "Wraps around");
        assertEquals("T3", resolver.select(List.of(t1, t3)).getId(), "Skips the disabled T2");

        resolver.reset();
        assertEquals("T1", resolver.select(all).getId(), "Reset forgets the last index");
    }

    @Test
    public void testRandomIsSeededAndFair() {
        ConflictResolver first = ConflictResolver.forPolicy(ConflictPolicy.RANDOM, order, new Random(99));
        ConflictResolver second = ConflictResolver.forPolicy(ConflictPolicy.RANDOM, order, new Random(99));
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 300; i++) {
            DiscreteBehavior a = first.select(List.of(t1, t2, t3));
            DiscreteBehavior b = second.select(List.of(t1, t2, t3));
            assertEquals(a.getId(), b.getId(), "Same seed, same choice at draw " + i);
            seen.add(a.getId());
        }
        assertTrue(seen.containsAll(order), "Every candidate gets picked eventually");
    }
}
