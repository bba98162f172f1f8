package org.hybridnet.model;

import java.util.Locale;

public enum ConflictPolicy {

    RANDOM,
    PRIORITY,
    ROUND_ROBIN;

    public static ConflictPolicy fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Missing conflict policy");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("ROUNDROBIN")) {
            return ROUND_ROBIN;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ModelConfigurationException("Unknown conflict policy: " + name, e);
        }
    }
}
