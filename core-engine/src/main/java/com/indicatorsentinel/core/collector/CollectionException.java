package com.indicatorsentinel.core.collector;

/**
 * Raised when a metric value cannot be collected, including when the
 * collection deadline expires.
 *
 * <p>
 * Not fatal: the executor records a failed run and the indicator stays
 * scheduled for its next natural due time.
 * </p>
 *
 * @since 1.0.0
 */
public class CollectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
