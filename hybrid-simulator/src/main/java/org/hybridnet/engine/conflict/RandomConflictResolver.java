package org.hybridnet.engine.conflict;

import java.util.List;
import java.util.Random;

import org.hybridnet.engine.DiscreteBehavior;
import org.hybridnet.model.ConflictPolicy;

public class RandomConflictResolver extends ConflictResolver {

    private final Random random;

    public RandomConflictResolver(Random random) {
        this.random = random;
    }

    @Override
    protected DiscreteBehavior applyPolicy(List<DiscreteBehavior> enabled) {
        return enabled.get(random.nextInt(enabled.size()));
    }

    @Override
    public ConflictPolicy getPolicy() {
        return ConflictPolicy.RANDOM;
    }
}
