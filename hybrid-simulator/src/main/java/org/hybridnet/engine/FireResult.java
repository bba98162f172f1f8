package org.hybridnet.engine;

/**
 * Result of {@link DiscreteBehavior#fire}. A failed firing never mutated the marking.
 */
public final class FireResult {

    private final FiringRecord record;
    private final String reason;

    private FireResult(FiringRecord record, String reason) {
        this.record = record;
        this.reason = reason;
    }

    public static FireResult success(FiringRecord record) {
        return new FireResult(record, "fired");
    }

    public static FireResult failure(String reason) {
        return new FireResult(null, reason);
    }

    public boolean isSuccess() {
        return record != null;
    }

    public FiringRecord getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSuccess() ? record.toString() : "FireError(" + reason + ")";
    }
}
