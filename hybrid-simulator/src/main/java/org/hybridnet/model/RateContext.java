package org.hybridnet.model;

/**
 * Read-only view handed to rate functions and guards.
 */
public interface RateContext {

    /**
     * Marking of the given place.
     *
     * @throws org.hybridnet.model.expr.ExpressionException if the place is unknown
     */
    double getMarking(String placeId);

    boolean hasPlace(String placeId);

    double getTime();
}
