package com.indicatorsentinel.core.store;

import com.indicatorsentinel.core.config.IndicatorValidationException;
import com.indicatorsentinel.core.model.ComparisonOperator;
import com.indicatorsentinel.core.model.Indicator;
import com.indicatorsentinel.core.support.TestIndicators;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryIndicatorStore}.
 */
class InMemoryIndicatorStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("Should list indicators by id and filter the active ones")
    void findAllAndActive() {
        InMemoryIndicatorStore store = new InMemoryIndicatorStore(List.of(
                TestIndicators.successRate(3, 10, 0).build(),
                TestIndicators.threshold(1, 5, ComparisonOperator.GT).active(false).build(),
                TestIndicators.trend(2, 10, 60).build()));

        assertThat(store.findAll()).extracting(Indicator::getId).containsExactly(1, 2, 3);
        assertThat(store.findActive()).extracting(Indicator::getId).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Should reject an invalid indicator on save")
    void rejectsInvalid() {
        InMemoryIndicatorStore store = new InMemoryIndicatorStore();
        Indicator invalid = TestIndicators.threshold(1, 5, ComparisonOperator.GT).owner(" ").build();

        assertThatThrownBy(() -> store.save(invalid)).isInstanceOf(IndicatorValidationException.class);
        assertThat(store.findById(1)).isEmpty();
    }

    @Test
    @DisplayName("Should write back the last run and reject unknown ids")
    void updateLastRun() {
        InMemoryIndicatorStore store = new InMemoryIndicatorStore(
                List.of(TestIndicators.successRate(1, 10, 0).build()));

        store.updateLastRun(1, NOW);

        assertThat(store.findById(1)).hasValueSatisfying(i -> assertThat(i.getLastRun()).isEqualTo(NOW));
        assertThatThrownBy(() -> store.updateLastRun(99, NOW)).isInstanceOf(IllegalArgumentException.class);
    }
}
