package org.hybridnet.engine.conflict;

import java.util.List;

import org.hybridnet.engine.DiscreteBehavior;
import org.hybridnet.model.ConflictPolicy;

/**
 * Cycles through the discrete transitions in model order, skipping the ones
 * that are not enabled.
 */
public class RoundRobinConflictResolver extends ConflictResolver {

    private final List<String> order;
    private int lastIndex = -1;

    public RoundRobinConflictResolver(List<String> order) {
        this.order = order;
    }

    @Override
    protected DiscreteBehavior applyPolicy(List<DiscreteBehavior> enabled) {
        int size = order.size();
        for (int offset = 1; offset <= size; offset++) {
            int index = (lastIndex + offset) % size;
            String id = order.get(index);
            for (DiscreteBehavior candidate : enabled) {
                if (candidate.getId().equals(id)) {
                    lastIndex = index;
                    return candidate;
                }
            }
        }
        // candidates outside the known order
        return enabled.get(0);
    }

    @Override
    public void reset() {
        lastIndex = -1;
    }

    int getLastIndex() {
        return lastIndex;
    }

    @Override
    public ConflictPolicy getPolicy() {
        return ConflictPolicy.ROUND_ROBIN;
    }
}
