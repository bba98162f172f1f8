package org.hybridnet.model;

/**
 * A transition of the net: identity, kind specific parameters and the static
 * attributes used by conflict resolution and guards.
 */
public class Transition {

    private final String id;
    private final String name;
    private final TransitionParameters parameters;
    private int priority = 0;
    private RateFunction guard;

    public Transition(String id, TransitionParameters parameters) {
        this(id, id, parameters);
    }

    public Transition(String id, String name, TransitionParameters parameters) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("A transition needs a non empty id");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("Transition " + id + " has no parameters");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.parameters = parameters;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TransitionKind getKind() {
        return parameters.getKind();
    }

    public TransitionParameters getParameters() {
        return parameters;
    }

    public int getPriority() {
        return priority;
    }

    public Transition setPriority(int priority) {
        this.priority = priority;
        return this;
    }

    /**
     * Optional guard, the transition is blocked while it evaluates to zero.
     */
    public RateFunction getGuard() {
        return guard;
    }

    public Transition setGuard(RateFunction guard) {
        this.guard = guard;
        return this;
    }

    @Override
    public String toString() {
        return id + " (" + parameters + ")";
    }
}
