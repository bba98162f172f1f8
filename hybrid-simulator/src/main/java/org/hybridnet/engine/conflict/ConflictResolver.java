package org.hybridnet.engine.conflict;

import java.util.List;
import java.util.Random;

import org.hybridnet.engine.DiscreteBehavior;
import org.hybridnet.model.ConflictPolicy;

/**
 * Picks the single discrete transition that fires in a step.
 */
public abstract class ConflictResolver {

    public static ConflictResolver forPolicy(ConflictPolicy policy, List<String> order, Random random) {
        switch (policy) {
            case PRIORITY:
                return new PriorityConflictResolver(order);
            case ROUND_ROBIN:
                return new RoundRobinConflictResolver(order);
            case RANDOM:
            default:
                return new RandomConflictResolver(random);
        }
    }

    /**
     * @return the chosen behavior, {@code null} when there is no candidate
     */
    public DiscreteBehavior select(List<DiscreteBehavior> enabled) {
        if (enabled == null || enabled.isEmpty()) {
            return null;
        }
        return applyPolicy(enabled);
    }

    protected abstract DiscreteBehavior applyPolicy(List<DiscreteBehavior> enabled);

    public abstract ConflictPolicy getPolicy();

    /**
     * Forgets any memory kept between steps.
     */
    public void reset() {
    }
}
