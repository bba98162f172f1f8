package org.hybridnet.model;

import java.util.Locale;

public enum TransitionKind {

    IMMEDIATE(true),
    TIMED(true),
    STOCHASTIC(true),
    CONTINUOUS(false);

    private final boolean discrete;

    TransitionKind(boolean discrete) {
        this.discrete = discrete;
    }

    public boolean isDiscrete() {
        return discrete;
    }

    public static TransitionKind fromName(String name) {
        if (name == null) {
            throw new ModelConfigurationException("Missing transition kind");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ModelConfigurationException("Unknown transition kind: " + name, e);
        }
    }
}
