/**
 * Loading and validation of indicator definitions.
 *
 * <p>
 * Definitions are read from YAML by
 * {@link com.indicatorsentinel.core.config.IndicatorsLoader} and checked by
 * {@link com.indicatorsentinel.core.config.IndicatorValidator}; invalid
 * definitions raise
 * {@link com.indicatorsentinel.core.config.IndicatorValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.config;
