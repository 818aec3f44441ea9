package com.indicatorsentinel.core.alert;

import com.indicatorsentinel.core.evaluation.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryAlertStateStore}.
 */
class InMemoryAlertStateStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryAlertStateStore store = new InMemoryAlertStateStore();

    @Test
    @DisplayName("Should report None for an indicator that never alerted")
    void noneByDefault() {
        assertThat(store.get(42).getStatus()).isEqualTo(AlertStatus.NONE);
        store.transition(42, false, Severity.LOW, null, NOW);

        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should create the row on the first alerting evaluation")
    void lazyCreation() {
        store.transition(7, true, Severity.HIGH, 30.0, NOW);

        assertThat(store.snapshot()).singleElement()
                .satisfies(state -> assertThat(state.getStatus()).isEqualTo(AlertStatus.TRIGGERED));
    }

    @Test
    @DisplayName("Should ignore an evaluation older than the stored state")
    void staleEvaluationIgnored() {
        store.transition(7, true, Severity.HIGH, 30.0, NOW);

        TransitionOutcome late = store.transition(7, false, null, null, NOW.minusSeconds(60));

        assertThat(late.getTransition()).isEqualTo(AlertTransition.UNCHANGED);
        assertThat(store.get(7).getStatus()).isEqualTo(AlertStatus.TRIGGERED);

        store.transition(7, false, null, null, NOW.plusSeconds(120));
        TransitionOutcome lateBreach = store.transition(7, true, Severity.CRITICAL, 80.0, NOW.plusSeconds(60));

        assertThat(lateBreach.isNewAlert()).isFalse();
        assertThat(store.get(7).getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(store.get(7).getResolvedTime()).isEqualTo(NOW.plusSeconds(120));
    }

    @Test
    @DisplayName("Should produce exactly one new alert when many threads breach the same indicator")
    void concurrentTransitionsSerialize() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<TransitionOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> store.transition(1, true, Severity.HIGH, 30.0, NOW));
            }
            int newAlerts = 0;
            for (Future<TransitionOutcome> f : pool.invokeAll(tasks)) {
                if (f.get().isNewAlert()) {
                    newAlerts++;
                }
            }

            assertThat(newAlerts).isEqualTo(1);
            assertThat(store.get(1).isTriggered()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }
}
