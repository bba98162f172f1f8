package org.hybridnet.engine.conflict;

import java.util.List;

import org.hybridnet.engine.DiscreteBehavior;
import org.hybridnet.model.ConflictPolicy;

/**
 * Highest priority wins, ties go to the transition declared first.
 */
public class PriorityConflictResolver extends ConflictResolver {

    private final List<String> order;

    public PriorityConflictResolver(List<String> order) {
        this.order = order;
    }

    @Override
    protected DiscreteBehavior applyPolicy(List<DiscreteBehavior> enabled) {
        DiscreteBehavior best = null;
        for (DiscreteBehavior candidate : enabled) {
            if (best == null || candidate.getPriority() > best.getPriority()
                    || (candidate.getPriority() == best.getPriority() && rank(candidate) < rank(best))) {
                best = candidate;
            }
        }
        return best;
    }

    private int rank(DiscreteBehavior behavior) {
        int index = order.indexOf(behavior.getId());
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    @Override
    public ConflictPolicy getPolicy() {
        return ConflictPolicy.PRIORITY;
    }
}
