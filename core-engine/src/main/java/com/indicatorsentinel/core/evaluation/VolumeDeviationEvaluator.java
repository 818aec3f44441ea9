package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.DeviationConfig;
import com.indicatorsentinel.core.model.VolumeDeviationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluator for {@code success_rate} and {@code transaction_volume}
 * indicators.
 *
 * <p>
 * Readings below {@code minimumThreshold} never alert: the volume is too low
 * for the deviation to be meaningful. The deviation is still reported.
 * </p>
 *
 * @since 1.0.0
 */
public class VolumeDeviationEvaluator extends BaselineDeviationEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(VolumeDeviationEvaluator.class);

    @Override
    protected boolean accepts(DeviationConfig config) {
        return config instanceof VolumeDeviationConfig;
    }

    @Override
    protected boolean isAlertable(DeviationConfig config, double currentValue) {
        double minimum = ((VolumeDeviationConfig) config).getMinimumThreshold();
        if (currentValue < minimum) {
            LOG.debug("Volume gate: current={} below minimumThreshold={}", currentValue, minimum);
            return false;
        }
        return true;
    }
}
