package com.indicatorsentinel.core.config;

import java.util.List;

/**
 * Outcome of validating one indicator: blocking errors and advisory warnings.
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + errors + ", warnings=" + warnings + '}';
    }
}
