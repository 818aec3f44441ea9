package com.indicatorsentinel.core.ledger;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of {@link ExecutionRecord}s.
 *
 * <p>
 * The core only appends and reads; retention and deletion belong to the
 * persistence layer. Implementations propagate storage failures to the
 * caller.
 * </p>
 */
public interface ExecutionLedger {

    /**
     * @param record the record to append; must not be {@code null}
     */
    void append(ExecutionRecord record);

    /**
     * @param query filter criteria
     * @return matching records, newest first, at most {@code query.getLimit()}
     */
    List<ExecutionRecord> query(ExecutionQuery query);

    /**
     * @param from window start, inclusive
     * @param to   window end, inclusive
     * @return every record within the window, oldest first
     */
    List<ExecutionRecord> between(Instant from, Instant to);
}
