package org.hybridnet.model;

public final class StochasticParameters extends TransitionParameters {

    public static final int DEFAULT_MAX_BURST = 8;

    private final double rate;
    private final int maxBurst;

    public StochasticParameters(double rate, int maxBurst) {
        this.rate = rate;
        this.maxBurst = maxBurst;
    }

    public double getRate() {
        return rate;
    }

    public int getMaxBurst() {
        return maxBurst;
    }

    public double getMeanDelay() {
        return 1.0 / rate;
    }

    @Override
    public TransitionKind getKind() {
        return TransitionKind.STOCHASTIC;
    }

    @Override
    public void validate() {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new ModelConfigurationException("Stochastic rate must be positive and finite: " + rate);
        }
        if (maxBurst < 1) {
            throw new ModelConfigurationException("Max burst must be >= 1: " + maxBurst);
        }
    }

    @Override
    public String toString() {
        return "Stochastic[rate=" + rate + ", maxBurst=" + maxBurst + "]";
    }
}
