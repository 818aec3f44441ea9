package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.DeviationConfig;
import com.indicatorsentinel.core.model.IndicatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Base for evaluators that compare a reading with its baseline.
 *
 * <p>
 * The deviation is {@code (current - baseline) / baseline * 100}; an alert
 * fires when its absolute value reaches the configured
 * {@code deviationPercent}. An absent or zero baseline yields no deviation
 * and no alert.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class BaselineDeviationEvaluator implements IndicatorEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineDeviationEvaluator.class);

    @Override
    public EvaluationResult evaluate(IndicatorConfig config, double currentValue, Double baselineValue) {
        if (!(config instanceof DeviationConfig deviationConfig) || !accepts(deviationConfig)) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " cannot evaluate " + config);
        }

        OptionalDouble deviation = DeviationCalculator.deviationPercent(currentValue, baselineValue);
        if (deviation.isEmpty()) {
            LOG.debug("Deviation not computable: current={} baseline={}", currentValue, baselineValue);
            return EvaluationResult.indeterminate();
        }

        double value = deviation.getAsDouble();
        Severity severity = Severity.fromDeviation(value);
        if (!isAlertable(deviationConfig, currentValue)) {
            return new EvaluationResult(value, false, severity);
        }

        boolean breached = Math.abs(value) >= deviationConfig.getDeviationPercent();
        return new EvaluationResult(value, breached, severity);
    }

    /**
     * @param config the deviation configuration
     * @return {@code true} if {@code config} is the variant this evaluator handles
     */
    protected abstract boolean accepts(DeviationConfig config);

    /**
     * Gate applied before the deviation comparison.
     *
     * @param config       the deviation configuration
     * @param currentValue current reading
     * @return {@code false} to suppress alerting for this reading
     */
    protected boolean isAlertable(DeviationConfig config, double currentValue) {
        return true;
    }
}
