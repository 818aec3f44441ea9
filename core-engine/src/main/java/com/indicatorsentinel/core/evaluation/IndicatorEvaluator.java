package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.IndicatorConfig;

/**
 * Contract for the type-specific alert rules.
 * <p>
 * Implementations are pure and stateless: the same inputs always produce the
 * same result, and malformed numeric input yields a non-alerting result
 * rather than an exception.
 * </p>
 */
public interface IndicatorEvaluator {

    /**
     * @param config        type-specific configuration, already validated
     * @param currentValue  current reading
     * @param baselineValue historical baseline, may be {@code null}
     * @return deviation, alert decision and severity
     * @throws IllegalArgumentException if {@code config} is not the variant this
     *                                  evaluator handles
     */
    EvaluationResult evaluate(IndicatorConfig config, double currentValue, Double baselineValue);
}
