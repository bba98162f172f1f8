package org.hybridnet.engine;

/**
 * Answer of {@link TransitionBehavior#canFire()}. The reason is a short code
 * for diagnostics only; callers branch on {@link #isEnabled()}.
 */
public final class Enablement {

    public static final Enablement ENABLED = new Enablement(true, "enabled");
    public static final Enablement ENABLED_NO_INPUTS = new Enablement(true, "enabled-no-inputs");

    private final boolean enabled;
    private final String reason;

    private Enablement(boolean enabled, String reason) {
        this.enabled = enabled;
        this.reason = reason;
    }

    public static Enablement enabled(String reason) {
        return new Enablement(true, reason);
    }

    public static Enablement disabled(String reason) {
        return new Enablement(false, reason);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return (enabled ? "enabled: " : "disabled: ") + reason;
    }
}
