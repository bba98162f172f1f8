package org.hybridnet.model;

/**
 * Kind specific parameters of a transition. The set of subclasses is closed:
 * one per {@link TransitionKind}.
 */
public abstract class TransitionParameters {

    TransitionParameters() {
    }

    public abstract TransitionKind getKind();

    /**
     * Checks the parameters and throws {@link ModelConfigurationException} when
     * they cannot be simulated.
     */
    public abstract void validate();

    public static ImmediateParameters immediate() {
        return ImmediateParameters.INSTANCE;
    }

    public static TimedParameters timed(double earliest, double latest) {
        return new TimedParameters(earliest, latest);
    }

    public static StochasticParameters stochastic(double rate) {
        return new StochasticParameters(rate, StochasticParameters.DEFAULT_MAX_BURST);
    }

    public static StochasticParameters stochastic(double rate, int maxBurst) {
        return new StochasticParameters(rate, maxBurst);
    }

    public static ContinuousParameters continuous(RateFunction rateFunction) {
        return new ContinuousParameters(rateFunction, 0.0, Double.POSITIVE_INFINITY);
    }

    public static ContinuousParameters continuous(RateFunction rateFunction, double minRate, double maxRate) {
        return new ContinuousParameters(rateFunction, minRate, maxRate);
    }
}
