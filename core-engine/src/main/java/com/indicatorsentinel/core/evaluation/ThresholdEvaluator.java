package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.IndicatorConfig;
import com.indicatorsentinel.core.model.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Threshold evaluator.
 *
 * <p>
 * Alerts when {@code current <operator> thresholdValue} holds. There is no
 * deviation gradient, so the deviation is always {@code null} and the
 * severity is the configured default.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdEvaluator implements IndicatorEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdEvaluator.class);

    private final Severity breachSeverity;

    /**
     * @param breachSeverity severity reported for every evaluation
     */
    public ThresholdEvaluator(Severity breachSeverity) {
        this.breachSeverity = Objects.requireNonNull(breachSeverity, "breachSeverity must not be null");
    }

    @Override
    public EvaluationResult evaluate(IndicatorConfig config, double currentValue, Double baselineValue) {
        if (!(config instanceof ThresholdConfig threshold)) {
            throw new IllegalArgumentException("ThresholdEvaluator cannot evaluate " + config);
        }
        if (!Double.isFinite(currentValue)) {
            LOG.debug("Threshold evaluation skipped: non-finite current value {}", currentValue);
            return new EvaluationResult(null, false, breachSeverity);
        }

        boolean breached = threshold.getOperator().test(currentValue, threshold.getThresholdValue());
        if (breached) {
            LOG.debug("Threshold breached: {} {} {}", currentValue,
                    threshold.getOperator().code(), threshold.getThresholdValue());
        }
        return new EvaluationResult(null, breached, breachSeverity);
    }
}
