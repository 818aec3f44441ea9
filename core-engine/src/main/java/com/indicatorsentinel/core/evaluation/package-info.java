/**
 * Pure evaluation rules for each indicator type.
 *
 * <p>
 * {@link com.indicatorsentinel.core.evaluation.Evaluator} dispatches on the
 * {@link com.indicatorsentinel.core.model.IndicatorType} tag to:
 * </p>
 * <ul>
 * <li>{@link com.indicatorsentinel.core.evaluation.ThresholdEvaluator}</li>
 * <li>{@link com.indicatorsentinel.core.evaluation.VolumeDeviationEvaluator}</li>
 * <li>{@link com.indicatorsentinel.core.evaluation.TrendEvaluator}</li>
 * </ul>
 * <p>
 * Severity buckets are defined by
 * {@link com.indicatorsentinel.core.evaluation.Severity#fromDeviation(double)}.
 * </p>
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.evaluation;
