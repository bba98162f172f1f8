package org.hybridnet.model;

/**
 * A place of the net. The marking is a token count for discrete places and a
 * continuous quantity for flow endpoints; it is never negative.
 */
public class Place {

    private final String id;
    private final String name;
    private final double initialMarking;
    private final Double capacity;
    private double marking;

    public Place(String id, double initialMarking) {
        this(id, id, initialMarking, null);
    }

    public Place(String id, String name, double initialMarking, Double capacity) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("A place needs a non empty id");
        }
        if (initialMarking < 0) {
            throw new IllegalArgumentException("Place " + id + " cannot start with a negative marking");
        }
        if (capacity != null && capacity < initialMarking) {
            throw new IllegalArgumentException("Place " + id + " starts above its capacity");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.initialMarking = initialMarking;
        this.capacity = capacity;
        this.marking = initialMarking;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public double getMarking() {
        return marking;
    }

    public void setMarking(double marking) {
        if (marking < 0 || Double.isNaN(marking)) {
            throw new IllegalArgumentException("Place " + id + " cannot hold a marking of " + marking);
        }
        this.marking = marking;
    }

    public double getInitialMarking() {
        return initialMarking;
    }

    public Double getCapacity() {
        return capacity;
    }

    public boolean hasCapacity() {
        return capacity != null;
    }

    /**
     * Room left below the capacity, infinite for unbounded places.
     */
    public double getHeadroom() {
        return capacity == null ? Double.POSITIVE_INFINITY : capacity - marking;
    }

    void restoreInitialMarking() {
        this.marking = initialMarking;
    }

    @Override
    public String toString() {
        return id + "=" + marking;
    }
}
