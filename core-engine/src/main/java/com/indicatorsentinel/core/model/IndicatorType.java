package com.indicatorsentinel.core.model;

import java.util.Locale;

/**
 * Kind of rule applied when an indicator is evaluated.
 *
 * <p>
 * Each type is paired with exactly one {@link IndicatorConfig} variant; the
 * evaluator dispatches on this tag, never on free-form strings.
 * </p>
 *
 * @since 1.0.0
 */
public enum IndicatorType {

    /** Static comparison of the current value against a fixed threshold. */
    THRESHOLD("threshold"),

    /** Relative deviation of a success rate from its baseline, volume gated. */
    SUCCESS_RATE("success_rate"),

    /** Relative deviation of a transaction count from its baseline, volume gated. */
    TRANSACTION_VOLUME("transaction_volume"),

    /** Relative deviation over a longer window, no volume gate. */
    TREND_ANALYSIS("trend_analysis");

    private final String code;

    IndicatorType(String code) {
        this.code = code;
    }

    /**
     * @return the configuration code, e.g. {@code success_rate}
     */
    public String code() {
        return code;
    }

    /**
     * Resolve a type from its configuration code (case-insensitive).
     *
     * @param code configuration code
     * @return the matching type
     * @throws IllegalArgumentException if the code is {@code null} or unknown
     */
    public static IndicatorType fromCode(String code) {
        if (code != null) {
            String normalised = code.trim().toLowerCase(Locale.ROOT);
            for (IndicatorType type : values()) {
                if (type.code.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown indicator type: '" + code
                + "'. Supported: threshold, success_rate, transaction_volume, trend_analysis");
    }
}
