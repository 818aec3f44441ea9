package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.model.IndicatorConfig;
import com.indicatorsentinel.core.model.IndicatorType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatches an evaluation to the {@link IndicatorEvaluator} registered for
 * the indicator's type.
 *
 * <p>
 * This is the single point of extension when adding new indicator types:
 * add the type tag, its configuration variant, and register the evaluator
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public class Evaluator {

    /** Severity used for {@code threshold} breaches when none is configured. */
    public static final Severity DEFAULT_THRESHOLD_SEVERITY = Severity.MEDIUM;

    private final Map<IndicatorType, IndicatorEvaluator> evaluators = new EnumMap<>(IndicatorType.class);

    public Evaluator() {
        this(DEFAULT_THRESHOLD_SEVERITY);
    }

    /**
     * @param thresholdSeverity severity reported by {@code threshold} indicators
     */
    public Evaluator(Severity thresholdSeverity) {
        VolumeDeviationEvaluator volume = new VolumeDeviationEvaluator();
        evaluators.put(IndicatorType.THRESHOLD, new ThresholdEvaluator(thresholdSeverity));
        evaluators.put(IndicatorType.SUCCESS_RATE, volume);
        evaluators.put(IndicatorType.TRANSACTION_VOLUME, volume);
        evaluators.put(IndicatorType.TREND_ANALYSIS, new TrendEvaluator());
    }

    /**
     * @param type          indicator type tag
     * @param config        matching configuration variant
     * @param currentValue  current reading
     * @param baselineValue historical baseline, may be {@code null}
     * @return the evaluation result
     * @throws NullPointerException     if {@code type} or {@code config} is
     *                                  {@code null}
     * @throws IllegalArgumentException if {@code config} does not match
     *                                  {@code type}
     */
    public EvaluationResult evaluate(IndicatorType type, IndicatorConfig config,
            double currentValue, Double baselineValue) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (!config.supports(type)) {
            throw new IllegalArgumentException("Configuration " + config + " does not match type " + type.code());
        }
        return evaluators.get(type).evaluate(config, currentValue, baselineValue);
    }

    /**
     * Convenience overload taking type and configuration from the indicator.
     */
    public EvaluationResult evaluate(Indicator indicator, double currentValue, Double baselineValue) {
        Objects.requireNonNull(indicator, "indicator must not be null");
        return evaluate(indicator.getType(), indicator.getConfig(), currentValue, baselineValue);
    }
}
