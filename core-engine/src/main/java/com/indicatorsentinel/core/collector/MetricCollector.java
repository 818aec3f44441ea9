package com.indicatorsentinel.core.collector;

import java.time.Instant;

/**
 * Computes the current and baseline values for an indicator's source.
 *
 * <p>
 * How values are computed is entirely up to the implementation. The executor
 * bounds every call with a timeout; implementations should also honour
 * {@code deadline} and thread interruption where they can.
 * </p>
 */
public interface MetricCollector {

    /**
     * @param sourceRef     opaque handle from the indicator definition
     * @param windowMinutes window the values should cover
     * @param deadline      instant after which the result is discarded
     * @return the collected values, or a failure result
     * @throws CollectionException if collection fails
     */
    CollectionResult collect(String sourceRef, int windowMinutes, Instant deadline);
}
