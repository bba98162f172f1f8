package org.hybridnet.model;

public enum ArcDirection {

    /** From a place into a transition. */
    INPUT,

    /** From a transition into a place. */
    OUTPUT
}
