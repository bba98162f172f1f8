package org.hybridnet.model;

/**
 * Instantaneous flow rate of a continuous transition.
 */
@FunctionalInterface
public interface RateFunction {

    double evaluate(RateContext context);

    static RateFunction constant(double rate) {
        return new RateFunction() {
            @Override
            public double evaluate(RateContext context) {
                return rate;
            }

            @Override
            public String toString() {
                return Double.toString(rate);
            }
        };
    }
}
