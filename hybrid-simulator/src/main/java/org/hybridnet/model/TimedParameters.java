package org.hybridnet.model;

/**
 * Firing window {@code [earliest, latest]} measured from the enablement time.
 * {@code latest} may be {@link Double#POSITIVE_INFINITY}.
 */
public final class TimedParameters extends TransitionParameters {

    private final double earliest;
    private final double latest;

    public TimedParameters(double earliest, double latest) {
        this.earliest = earliest;
        this.latest = latest;
    }

    public double getEarliest() {
        return earliest;
    }

    public double getLatest() {
        return latest;
    }

    @Override
    public TransitionKind getKind() {
        return TransitionKind.TIMED;
    }

    @Override
    public void validate() {
        if (Double.isNaN(earliest) || earliest < 0) {
            throw new ModelConfigurationException("Earliest firing time cannot be negative: " + earliest);
        }
        if (Double.isNaN(latest) || latest < earliest) {
            throw new ModelConfigurationException("Latest firing time (" + latest + ") must be >= earliest (" + earliest + ")");
        }
    }

    @Override
    public String toString() {
        return "Timed[" + earliest + ", " + latest + "]";
    }
}
