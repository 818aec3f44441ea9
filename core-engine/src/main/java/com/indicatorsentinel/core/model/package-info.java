/**
 * Domain model of monitored indicators.
 *
 * <p>
 * {@link com.indicatorsentinel.core.model.Indicator} carries an
 * {@link com.indicatorsentinel.core.model.IndicatorType} tag and the matching
 * {@link com.indicatorsentinel.core.model.IndicatorConfig} variant:
 * </p>
 * <ul>
 * <li>{@link com.indicatorsentinel.core.model.ThresholdConfig}: fixed
 * comparison</li>
 * <li>{@link com.indicatorsentinel.core.model.VolumeDeviationConfig}:
 * baseline deviation with a minimum volume gate</li>
 * <li>{@link com.indicatorsentinel.core.model.TrendConfig}: baseline
 * deviation over a long window</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.model;
