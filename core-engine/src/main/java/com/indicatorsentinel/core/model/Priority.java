package com.indicatorsentinel.core.model;

import java.util.Locale;

/**
 * Ordinal weight of an indicator. Higher weights are dispatched first when
 * several indicators fall due in the same tick.
 *
 * @since 1.0.0
 */
public enum Priority {

    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * @param code priority name (case-insensitive)
     * @return the matching priority
     * @throws IllegalArgumentException if the code is {@code null} or unknown
     */
    public static Priority fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Priority must not be blank");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: '" + code
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
