package com.supplychain.pipeline.domain;

import java.util.Locale;

/**
 * Kind of signal. Drives the base risk multiplier and sector adjustments.
 */
public enum EventType {
    NEWS("news"),
    WEATHER("weather"),
    ECONOMIC("economic"),
    GEOPOLITICAL("geopolitical"),
    SHIPPING("shipping"),
    NATURAL_DISASTER("natural_disaster"),
    CYBER_ATTACK("cyber_attack"),
    PANDEMIC("pandemic"),
    /** Any label we do not recognise. */
    OTHER("other");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps a collector label to a type. Unknown or missing labels become {@link #OTHER}.
     */
    public static EventType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String key = label.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (EventType type : values()) {
            if (type.label.equals(key)) {
                return type;
            }
        }
        return OTHER;
    }
}
