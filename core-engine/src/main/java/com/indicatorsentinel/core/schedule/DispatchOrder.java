package com.indicatorsentinel.core.schedule;

import com.indicatorsentinel.core.model.Indicator;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Due predicate and dispatch ordering shared by the scheduler, the query
 * surface and the dashboard.
 *
 * <p>
 * Order: priority (critical first), then how long the indicator has been
 * overdue (never-run indicators first), then id.
 * </p>
 */
public final class DispatchOrder {

    private DispatchOrder() {
        // utility class
    }

    /**
     * @param indicators candidate indicators
     * @param now        evaluation time
     * @return the active, due indicators in dispatch order
     */
    public static List<Indicator> dueIndicators(Collection<Indicator> indicators, Instant now) {
        return indicators.stream()
                .filter(indicator -> indicator.isDue(now))
                .sorted(comparator(now))
                .toList();
    }

    static Comparator<Indicator> comparator(Instant now) {
        return Comparator.<Indicator>comparingInt(indicator -> indicator.getPriority().weight()).reversed()
                .thenComparing(indicator -> overdueBy(indicator, now), Comparator.reverseOrder())
                .thenComparingInt(Indicator::getId);
    }

    private static Duration overdueBy(Indicator indicator, Instant now) {
        Instant nextRun = indicator.nextRunAt();
        if (nextRun == null) {
            // never ran: more overdue than anything that has
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
        return Duration.between(nextRun, now);
    }
}
