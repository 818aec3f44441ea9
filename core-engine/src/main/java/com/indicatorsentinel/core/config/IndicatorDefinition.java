package com.indicatorsentinel.core.config;

import com.indicatorsentinel.core.model.ComparisonOperator;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.model.IndicatorConfig;
import com.indicatorsentinel.core.model.IndicatorType;
import com.indicatorsentinel.core.model.Priority;
import com.indicatorsentinel.core.model.ThresholdConfig;
import com.indicatorsentinel.core.model.TrendConfig;
import com.indicatorsentinel.core.model.VolumeDeviationConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable binding of one indicator entry in the YAML configuration.
 *
 * <p>
 * Fields are boxed so that absent keys can be told apart from zero values.
 * Which type-specific fields are required depends on {@code type}:
 * </p>
 * <ul>
 * <li>{@code threshold}: {@code thresholdValue}, {@code comparisonOperator}</li>
 * <li>{@code success_rate}, {@code transaction_volume}:
 * {@code deviationPercent}, {@code lastMinutes}, {@code minimumThreshold}</li>
 * <li>{@code trend_analysis}: {@code deviationPercent}, {@code lastMinutes}</li>
 * </ul>
 *
 * <p>
 * Call {@link #toIndicator()} to validate and convert.
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorDefinition {

    private Integer id;
    private String name;
    private String owner;
    private Boolean active = Boolean.TRUE;
    private String priority = "medium";
    private Integer frequency;
    private String type;
    private String sourceRef;

    // --- threshold ---
    private Double thresholdValue;
    private String comparisonOperator;

    // --- deviation types ---
    private Double deviationPercent;
    private Integer lastMinutes;
    private Double minimumThreshold;

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * Check required fields for the declared type, build the indicator and
     * run range validation on it.
     *
     * @return a valid {@link Indicator} that has never run
     * @throws IndicatorValidationException if any field is missing or invalid
     */
    public Indicator toIndicator() {
        List<String> errors = new ArrayList<>();
        String label = name != null ? name : String.valueOf(id);

        if (id == null) {
            errors.add("Indicator '" + label + "' requires 'id'");
        }
        if (frequency == null) {
            errors.add("Indicator '" + label + "' requires 'frequency'");
        }

        Priority parsedPriority = null;
        try {
            parsedPriority = Priority.fromCode(priority);
        } catch (IllegalArgumentException e) {
            errors.add("Indicator '" + label + "': " + e.getMessage());
        }

        IndicatorType parsedType = null;
        if (type == null || type.isBlank()) {
            errors.add("Indicator '" + label + "' requires 'type'");
        } else {
            try {
                parsedType = IndicatorType.fromCode(type);
            } catch (IllegalArgumentException e) {
                errors.add("Indicator '" + label + "': " + e.getMessage());
            }
        }

        IndicatorConfig config = parsedType == null ? null : buildConfig(parsedType, label, errors);

        if (!errors.isEmpty()) {
            throw new IndicatorValidationException("Invalid indicator definition", errors);
        }

        Indicator indicator = Indicator.builder()
                .id(id)
                .name(name)
                .owner(owner)
                .active(active == null || active)
                .priority(parsedPriority)
                .frequencyMinutes(frequency)
                .type(parsedType)
                .config(config)
                .sourceRef(sourceRef)
                .build();
        IndicatorValidator.requireValid(indicator);
        return indicator;
    }

    private IndicatorConfig buildConfig(IndicatorType parsedType, String label, List<String> errors) {
        switch (parsedType) {
            case THRESHOLD -> {
                requirePresent(thresholdValue, "thresholdValue", label, errors);
                ComparisonOperator operator = null;
                if (comparisonOperator == null || comparisonOperator.isBlank()) {
                    errors.add("Threshold indicator '" + label + "' requires 'comparisonOperator'");
                } else {
                    try {
                        operator = ComparisonOperator.fromCode(comparisonOperator);
                    } catch (IllegalArgumentException e) {
                        errors.add("Threshold indicator '" + label + "': " + e.getMessage());
                    }
                }
                return thresholdValue != null && operator != null
                        ? new ThresholdConfig(thresholdValue, operator)
                        : null;
            }
            case SUCCESS_RATE, TRANSACTION_VOLUME -> {
                requirePresent(deviationPercent, "deviationPercent", label, errors);
                requirePresent(lastMinutes, "lastMinutes", label, errors);
                requirePresent(minimumThreshold, "minimumThreshold", label, errors);
                return deviationPercent != null && lastMinutes != null && minimumThreshold != null
                        ? new VolumeDeviationConfig(deviationPercent, lastMinutes, minimumThreshold)
                        : null;
            }
            case TREND_ANALYSIS -> {
                requirePresent(deviationPercent, "deviationPercent", label, errors);
                requirePresent(lastMinutes, "lastMinutes", label, errors);
                return deviationPercent != null && lastMinutes != null
                        ? new TrendConfig(deviationPercent, lastMinutes)
                        : null;
            }
            default -> throw new IllegalStateException("Unhandled indicator type: " + parsedType);
        }
    }

    private void requirePresent(Object value, String field, String label, List<String> errors) {
        if (value == null) {
            errors.add(type + " indicator '" + label + "' requires '" + field + "'");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public Integer getId() {
        return id;
    }

    public void setId(Integer id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public Integer getFrequency() {
        return frequency;
    }

    public void setFrequency(Integer frequency) {
        this.frequency = frequency;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public void setSourceRef(String sourceRef) {
        this.sourceRef = sourceRef;
    }

    public Double getThresholdValue() {
        return thresholdValue;
    }

    public void setThresholdValue(Double thresholdValue) {
        this.thresholdValue = thresholdValue;
    }

    public String getComparisonOperator() {
        return comparisonOperator;
    }

    public void setComparisonOperator(String comparisonOperator) {
        this.comparisonOperator = comparisonOperator;
    }

    public Double getDeviationPercent() {
        return deviationPercent;
    }

    public void setDeviationPercent(Double deviationPercent) {
        this.deviationPercent = deviationPercent;
    }

    public Integer getLastMinutes() {
        return lastMinutes;
    }

    public void setLastMinutes(Integer lastMinutes) {
        this.lastMinutes = lastMinutes;
    }

    public Double getMinimumThreshold() {
        return minimumThreshold;
    }

    public void setMinimumThreshold(Double minimumThreshold) {
        this.minimumThreshold = minimumThreshold;
    }

    @Override
    public String toString() {
        return "IndicatorDefinition{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", frequency=" + frequency +
                '}';
    }
}
