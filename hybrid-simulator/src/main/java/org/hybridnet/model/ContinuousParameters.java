package org.hybridnet.model;

public final class ContinuousParameters extends TransitionParameters {

    private final RateFunction rateFunction;
    private final double minRate;
    private final double maxRate;

    public ContinuousParameters(RateFunction rateFunction, double minRate, double maxRate) {
        this.rateFunction = rateFunction;
        this.minRate = minRate;
        this.maxRate = maxRate;
    }

    public RateFunction getRateFunction() {
        return rateFunction;
    }

    public double getMinRate() {
        return minRate;
    }

    public double getMaxRate() {
        return maxRate;
    }

    public double clamp(double rate) {
        return Math.max(minRate, Math.min(maxRate, rate));
    }

    @Override
    public TransitionKind getKind() {
        return TransitionKind.CONTINUOUS;
    }

    @Override
    public void validate() {
        if (rateFunction == null) {
            throw new ModelConfigurationException("A continuous transition needs a rate function");
        }
        if (Double.isNaN(minRate) || minRate < 0) {
            throw new ModelConfigurationException("Minimum rate cannot be negative: " + minRate);
        }
        if (Double.isNaN(maxRate) || maxRate < minRate) {
            throw new ModelConfigurationException("Maximum rate (" + maxRate + ") must be >= minimum rate (" + minRate + ")");
        }
    }

    @Override
    public String toString() {
        return "Continuous[" + rateFunction + ", " + minRate + ".." + maxRate + "]";
    }
}
