package com.indicatorsentinel.core.evaluation;

import com.indicatorsentinel.core.model.DeviationConfig;
import com.indicatorsentinel.core.model.TrendConfig;

/**
 * Evaluator for {@code trend_analysis} indicators.
 *
 * <p>
 * Uses the plain deviation rule. The configured window only changes what the
 * collector returns as current and baseline values.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendEvaluator extends BaselineDeviationEvaluator {

    @Override
    protected boolean accepts(DeviationConfig config) {
        return config instanceof TrendConfig;
    }
}
