package org.hybridnet.model;

public final class ImmediateParameters extends TransitionParameters {

    static final ImmediateParameters INSTANCE = new ImmediateParameters();

    private ImmediateParameters() {
    }

    @Override
    public TransitionKind getKind() {
        return TransitionKind.IMMEDIATE;
    }

    @Override
    public void validate() {
        // nothing to check
    }

    @Override
    public String toString() {
        return "Immediate";
    }
}
