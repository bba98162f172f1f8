package org.hybridnet.engine;

import java.util.List;
import java.util.Random;

import org.hybridnet.model.Arc;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.StochasticParameters;
import org.hybridnet.model.Transition;

/**
 * Exponentially delayed transition that moves a random burst of tokens.
 * Delay and burst are sampled once per enablement.
 */
public class StochasticBehavior extends DiscreteBehavior {

    private final StochasticParameters parameters;
    private final Random random;
    private Double scheduledFireTime;
    private Integer sampledBurst;

    public StochasticBehavior(Transition transition, PetriNetModel model, SimulationClock clock, Random random) {
        super(transition, model, clock);
        this.parameters = (StochasticParameters) transition.getParameters();
        this.random = random;
    }

    @Override
    public void setEnablementTime(double time) {
        super.setEnablementTime(time);
        double delay = -Math.log(1.0 - random.nextDouble()) / parameters.getRate();
        scheduledFireTime = time + delay;
        sampledBurst = random.nextInt(parameters.getMaxBurst()) + 1;
    }

    @Override
    public void clearEnablement() {
        super.clearEnablement();
        scheduledFireTime = null;
        sampledBurst = null;
    }

    @Override
    public Enablement canFire() {
        Enablement guard = checkGuard();
        if (guard != null) {
            return guard;
        }
        if (scheduledFireTime == null) {
            return Enablement.disabled("not-scheduled");
        }
        double now = clock.now();
        if (now < scheduledFireTime) {
            return Enablement.disabled("too-early (remaining=" + (scheduledFireTime - now) + ")");
        }
        Enablement tokens = checkTokens(locality.getInputArcs(), sampledBurst, "insufficient-tokens-for-burst-");
        if (tokens != null) {
            return tokens;
        }
        return locality.isSource() ? Enablement.ENABLED_NO_INPUTS : Enablement.ENABLED;
    }

    @Override
    public FireResult fire(List<Arc> inputs, List<Arc> outputs) {
        Enablement enablement = canFire();
        if (!enablement.isEnabled()) {
            return FireResult.failure(enablement.getReason());
        }
        int burst = sampledBurst;
        double elapsed = clock.now() - getEnablementTime();
        FireResult result = transfer(inputs, outputs, burst, clock.now());
        if (result.isSuccess()) {
            result.getRecord().withBurst(burst).withElapsed(elapsed);
            clearEnablement();
        }
        return result;
    }

    @Override
    public boolean isWaiting() {
        return scheduledFireTime != null && clock.now() < scheduledFireTime;
    }

    /**
     * Draws a new burst, the scheduled time stays put.
     */
    public int resampleBurst() {
        sampledBurst = random.nextInt(parameters.getMaxBurst()) + 1;
        return sampledBurst;
    }

    public Double getScheduledFireTime() {
        return scheduledFireTime;
    }

    public Integer getSampledBurst() {
        return sampledBurst;
    }

    public double getRate() {
        return parameters.getRate();
    }

    @Override
    public String getTypeName() {
        return "Stochastic";
    }
}
