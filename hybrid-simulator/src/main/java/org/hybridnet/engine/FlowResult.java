package org.hybridnet.engine;

/**
 * Result of {@link ContinuousBehavior#integrateStep}. A failed integration
 * never mutated the marking.
 */
public final class FlowResult {

    private final FlowRecord record;
    private final String reason;

    private FlowResult(FlowRecord record, String reason) {
        this.record = record;
        this.reason = reason;
    }

    public static FlowResult success(FlowRecord record) {
        return new FlowResult(record, "integrated");
    }

    public static FlowResult failure(String reason) {
        return new FlowResult(null, reason);
    }

    public boolean isSuccess() {
        return record != null;
    }

    public FlowRecord getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSuccess() ? record.toString() : "FlowError(" + reason + ")";
    }
}
