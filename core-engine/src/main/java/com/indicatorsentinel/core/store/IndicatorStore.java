package com.indicatorsentinel.core.store;

import com.indicatorsentinel.core.model.Indicator;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of indicator definitions and sink for last-run timestamps.
 *
 * <p>
 * Implementations must validate on {@link #save(Indicator)} so that an
 * indicator with an invalid configuration is never returned to the scheduler.
 * </p>
 */
public interface IndicatorStore {

    /**
     * @return point-in-time copy of every indicator, ordered by id
     */
    List<Indicator> findAll();

    /**
     * @return point-in-time copy of the active indicators, ordered by id
     */
    default List<Indicator> findActive() {
        return findAll().stream().filter(Indicator::isActive).toList();
    }

    Optional<Indicator> findById(int id);

    /**
     * Create or replace an indicator.
     *
     * @param indicator the indicator
     * @return the stored indicator
     * @throws com.indicatorsentinel.core.config.IndicatorValidationException
     *         if the indicator is invalid
     */
    Indicator save(Indicator indicator);

    /**
     * Record that the indicator ran at {@code lastRun}.
     *
     * @param id      indicator id
     * @param lastRun run timestamp
     * @throws IllegalArgumentException if no indicator has that id
     */
    void updateLastRun(int id, Instant lastRun);
}
