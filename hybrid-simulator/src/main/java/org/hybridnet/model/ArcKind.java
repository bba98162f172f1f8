package org.hybridnet.model;

/**
 * How an input arc takes part in enablement and firing. Output arcs are
 * always {@link #NORMAL}.
 */
public enum ArcKind {

    /** Requires {@code weight} tokens and consumes them. */
    NORMAL,

    /** Disables the transition while the place holds {@code weight} or more. */
    INHIBITOR,

    /** Requires {@code weight} tokens without consuming them. */
    TEST;

    public boolean consumesTokens() {
        return this == NORMAL;
    }
}
