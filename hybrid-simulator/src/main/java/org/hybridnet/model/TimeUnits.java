package org.hybridnet.model;

import java.util.Locale;

public enum TimeUnits {

    MILLISECONDS("ms", 0.001),
    SECONDS("s", 1.0),
    MINUTES("min", 60.0),
    HOURS("h", 3600.0),
    DAYS("d", 86400.0);

    private final String symbol;
    private final double seconds;

    TimeUnits(String symbol, double seconds) {
        this.symbol = symbol;
        this.seconds = seconds;
    }

    public String getSymbol() {
        return symbol;
    }

    public double toSeconds(double value) {
        return value * seconds;
    }

    public double fromSeconds(double value) {
        return value / seconds;
    }

    /**
     * Accepts the enum name, the full lower case name or the symbol.
     */
    public static TimeUnits fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Missing time unit");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (TimeUnits unit : values()) {
            if (unit.name().toLowerCase(Locale.ROOT).equals(normalized) || unit.symbol.equals(normalized)) {
                return unit;
            }
        }
        throw new ModelConfigurationException("Unknown time unit: " + name);
    }
}
