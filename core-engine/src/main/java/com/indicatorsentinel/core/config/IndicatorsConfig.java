package com.indicatorsentinel.core.config;

import com.indicatorsentinel.core.model.Indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the indicators YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * indicators:
 *   - id: 1
 *     name: Checkout volume
 *     owner: payments
 *     frequency: 5
 *     type: transaction_volume
 *     sourceRef: checkout_count
 *     deviationPercent: 20
 *     lastMinutes: 30
 *     minimumThreshold: 50
 * </pre>
 *
 * @since 1.0.0
 */
public class IndicatorsConfig {

    private List<IndicatorDefinition> indicators = new ArrayList<>();

    /**
     * @return unmodifiable list of indicator definitions
     */
    public List<IndicatorDefinition> getIndicators() {
        return Collections.unmodifiableList(indicators);
    }

    /**
     * Set the definitions (used by SnakeYAML during deserialization).
     *
     * @param indicators the definitions
     */
    public void setIndicators(List<IndicatorDefinition> indicators) {
        this.indicators = indicators != null ? new ArrayList<>(indicators) : new ArrayList<>();
    }

    /**
     * Convert every definition into a validated {@link Indicator}.
     *
     * <p>
     * All definitions are checked before failing, so one exception reports
     * every problem in the file. Duplicate ids are rejected.
     * </p>
     *
     * @return unmodifiable list of indicators, in file order
     * @throws IndicatorValidationException if one or more definitions are invalid
     */
    public List<Indicator> toIndicators() {
        List<String> errors = new ArrayList<>();
        List<Indicator> result = new ArrayList<>();
        Set<Integer> seenIds = new HashSet<>();

        for (int i = 0; i < indicators.size(); i++) {
            IndicatorDefinition definition = Objects.requireNonNull(indicators.get(i),
                    "Indicator definition at index " + i + " is null");
            try {
                Indicator indicator = definition.toIndicator();
                if (!seenIds.add(indicator.getId())) {
                    errors.add("Duplicate indicator id " + indicator.getId() + " ('" + indicator.getName() + "')");
                } else {
                    result.add(indicator);
                }
            } catch (IndicatorValidationException e) {
                errors.addAll(e.getErrors());
            }
        }

        if (!errors.isEmpty()) {
            throw new IndicatorValidationException("Indicators configuration validation failed", errors);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "IndicatorsConfig{indicators=" + indicators + '}';
    }
}
