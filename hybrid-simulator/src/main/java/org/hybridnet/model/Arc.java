package org.hybridnet.model;

public class Arc {

    private final String sourceId;
    private final String targetId;
    private final ArcDirection direction;
    private final ArcKind kind;
    private final double weight;

    public Arc(String sourceId, String targetId, ArcDirection direction, double weight) {
        this(sourceId, targetId, direction, ArcKind.NORMAL, weight);
    }

    public Arc(String sourceId, String targetId, ArcDirection direction, ArcKind kind, double weight) {
        if (sourceId == null || targetId == null || direction == null || kind == null) {
            throw new IllegalArgumentException("An arc needs a source, a target, a direction and a kind");
        }
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("Arc " + sourceId + " -> " + targetId + " has a negative weight");
        }
        if (direction == ArcDirection.OUTPUT && kind != ArcKind.NORMAL) {
            throw new IllegalArgumentException(kind + " arc " + sourceId + " -> " + targetId
                    + " must run from a place into a transition");
        }
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.direction = direction;
        this.kind = kind;
        this.weight = weight;
    }

    public static Arc input(String placeId, String transitionId, double weight) {
        return new Arc(placeId, transitionId, ArcDirection.INPUT, weight);
    }

    public static Arc output(String transitionId, String placeId, double weight) {
        return new Arc(transitionId, placeId, ArcDirection.OUTPUT, weight);
    }

    public static Arc inhibitor(String placeId, String transitionId, double threshold) {
        return new Arc(placeId, transitionId, ArcDirection.INPUT, ArcKind.INHIBITOR, threshold);
    }

    public static Arc test(String placeId, String transitionId, double weight) {
        return new Arc(placeId, transitionId, ArcDirection.INPUT, ArcKind.TEST, weight);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public ArcDirection getDirection() {
        return direction;
    }

    public ArcKind getKind() {
        return kind;
    }

    public double getWeight() {
        return weight;
    }

    public boolean consumesTokens() {
        return kind.consumesTokens();
    }

    /**
     * Whether the marking of this arc's place allows the transition to fire,
     * with a normal arc asking for {@code multiplier} times its weight.
     */
    public boolean isSatisfiedBy(double marking, int multiplier) {
        switch (kind) {
            case INHIBITOR:
                return marking < weight;
            case TEST:
                return marking >= weight;
            default:
                return marking >= weight * multiplier;
        }
    }

    public String getPlaceId() {
        return direction == ArcDirection.INPUT ? sourceId : targetId;
    }

    public String getTransitionId() {
        return direction == ArcDirection.INPUT ? targetId : sourceId;
    }

    @Override
    public String toString() {
        String arc = sourceId + " -(" + weight + ")-> " + targetId;
        return kind == ArcKind.NORMAL ? arc : arc + " [" + kind + "]";
    }
}
