package com.indicatorsentinel.core.config;

import com.indicatorsentinel.core.model.Indicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Business-rule validation of {@link Indicator} instances.
 *
 * @since 1.0.0
 */
public final class IndicatorValidator {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorValidator.class);

    private IndicatorValidator() {
        // utility class, not instantiable
    }

    /**
     * Validate an indicator without side effects.
     *
     * @param indicator the indicator; must not be {@code null}
     * @return errors and warnings found
     */
    public static ValidationResult validate(Indicator indicator) {
        Objects.requireNonNull(indicator, "Indicator must not be null");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String label = indicator.getName() != null ? indicator.getName() : "#" + indicator.getId();

        if (indicator.getId() <= 0) {
            errors.add("Indicator '" + label + "' requires a positive 'id', got: " + indicator.getId());
        }
        if (isBlank(indicator.getName())) {
            errors.add("Indicator #" + indicator.getId() + " requires 'name'");
        }
        if (isBlank(indicator.getOwner())) {
            errors.add("Indicator '" + label + "' requires 'owner'");
        }
        if (isBlank(indicator.getSourceRef())) {
            errors.add("Indicator '" + label + "' requires 'sourceRef'");
        }
        if (indicator.getFrequencyMinutes() <= 0) {
            errors.add("Indicator '" + label + "' requires 'frequency' > 0, got: "
                    + indicator.getFrequencyMinutes());
        }

        if (!indicator.getConfig().supports(indicator.getType())) {
            errors.add("Indicator '" + label + "' of type '" + indicator.getType().code()
                    + "' cannot use " + indicator.getConfig().getClass().getSimpleName());
        } else {
            indicator.getConfig().validate(label, errors, warnings);
        }

        return new ValidationResult(errors, warnings);
    }

    /**
     * Validate an indicator, log its warnings and reject it if it has errors.
     *
     * @param indicator the indicator; must not be {@code null}
     * @return the validation result (always valid)
     * @throws IndicatorValidationException if any error was found
     */
    public static ValidationResult requireValid(Indicator indicator) {
        ValidationResult result = validate(indicator);
        for (String warning : result.getWarnings()) {
            LOG.warn("Indicator configuration warning: {}", warning);
        }
        if (!result.isValid()) {
            throw new IndicatorValidationException("Invalid indicator", result.getErrors());
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
