package com.indicatorsentinel.core.store;

import com.indicatorsentinel.core.config.IndicatorValidator;
import com.indicatorsentinel.core.model.Indicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link IndicatorStore} backed by a {@link ConcurrentHashMap}.
 *
 * @since 1.0.0
 */
public class InMemoryIndicatorStore implements IndicatorStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryIndicatorStore.class);

    private final ConcurrentMap<Integer, Indicator> indicators = new ConcurrentHashMap<>();

    public InMemoryIndicatorStore() {
    }

    /**
     * @param initial indicators to store; each is validated
     */
    public InMemoryIndicatorStore(Collection<Indicator> initial) {
        Objects.requireNonNull(initial, "initial indicators must not be null");
        initial.forEach(this::save);
    }

    @Override
    public List<Indicator> findAll() {
        return indicators.values().stream()
                .sorted(Comparator.comparingInt(Indicator::getId))
                .toList();
    }

    @Override
    public Optional<Indicator> findById(int id) {
        return Optional.ofNullable(indicators.get(id));
    }

    @Override
    public Indicator save(Indicator indicator) {
        Objects.requireNonNull(indicator, "Indicator must not be null");
        IndicatorValidator.requireValid(indicator);
        Indicator previous = indicators.put(indicator.getId(), indicator);
        LOG.debug("{} indicator {} ('{}')", previous == null ? "Created" : "Updated",
                indicator.getId(), indicator.getName());
        return indicator;
    }

    @Override
    public void updateLastRun(int id, Instant lastRun) {
        Objects.requireNonNull(lastRun, "lastRun must not be null");
        Indicator updated = indicators.computeIfPresent(id, (key, current) -> current.withLastRun(lastRun));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown indicator id: " + id);
        }
    }
}
