package com.indicatorsentinel.core.model;

import java.util.Locale;

/**
 * Comparison applied by {@code threshold} indicators.
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    GT("gt") {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT("lt") {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double value, double threshold) {
            return value == threshold;
        }
    };

    private final String code;

    ComparisonOperator(String code) {
        this.code = code;
    }

    /**
     * Apply the comparison as {@code value <op> threshold}.
     *
     * @param value     the observed value
     * @param threshold the configured threshold
     * @return {@code true} if the comparison holds
     */
    public abstract boolean test(double value, double threshold);

    public String code() {
        return code;
    }

    /**
     * @param code one of {@code gt, gte, lt, lte, eq} (case-insensitive)
     * @return the matching operator
     * @throws IllegalArgumentException if the code is {@code null} or unknown
     */
    public static ComparisonOperator fromCode(String code) {
        if (code != null) {
            String normalised = code.trim().toLowerCase(Locale.ROOT);
            for (ComparisonOperator op : values()) {
                if (op.code.equals(normalised)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + code
                + "'. Supported: gt, gte, lt, lte, eq");
    }
}
