package com.indicatorsentinel.core.config;

import java.util.List;

/**
 * Thrown when an indicator definition is missing required fields for its
 * type or holds values outside their legal ranges.
 *
 * <p>
 * Raised synchronously at create/update or load time; an indicator that
 * fails validation is never stored and therefore never dispatched.
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorValidationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public IndicatorValidationException(String message, List<String> errors) {
        super(message + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return every validation error, in discovery order
     */
    public List<String> getErrors() {
        return errors;
    }
}
