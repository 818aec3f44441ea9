package com.indicatorsentinel.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Type-specific configuration of an {@link Indicator}.
 *
 * <p>
 * The set of variants is closed: {@link ThresholdConfig} for
 * {@link IndicatorType#THRESHOLD}, {@link VolumeDeviationConfig} for
 * {@link IndicatorType#SUCCESS_RATE} and
 * {@link IndicatorType#TRANSACTION_VOLUME}, and {@link TrendConfig} for
 * {@link IndicatorType#TREND_ANALYSIS}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class IndicatorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    IndicatorConfig() {
        // closed hierarchy
    }

    /**
     * @param type indicator type
     * @return {@code true} if this variant is the configuration for {@code type}
     */
    public abstract boolean supports(IndicatorType type);

    /**
     * Window, in minutes, the metric collector should compute the current and
     * baseline values over.
     *
     * @param frequencyMinutes the owning indicator's frequency, used by variants
     *                         without an explicit window
     * @return window length in minutes
     */
    public abstract int windowMinutes(int frequencyMinutes);

    /**
     * Check value ranges and append problems to the supplied lists.
     *
     * @param indicatorName name used in messages
     * @param errors        receives blocking problems
     * @param warnings      receives non-blocking problems
     */
    public abstract void validate(String indicatorName, List<String> errors, List<String> warnings);
}
