package com.indicatorsentinel.core.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link ExecutionLedger} kept in memory.
 *
 * <p>
 * Appends take the write lock and reads take the read lock, so every read
 * sees a consistent prefix of the appended records.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryExecutionLedger implements ExecutionLedger {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryExecutionLedger.class);

    private final List<ExecutionRecord> records = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void append(ExecutionRecord record) {
        Objects.requireNonNull(record, "ExecutionRecord must not be null");
        lock.writeLock().lock();
        try {
            records.add(record);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.trace("Appended {}", record);
    }

    @Override
    public List<ExecutionRecord> query(ExecutionQuery query) {
        Objects.requireNonNull(query, "ExecutionQuery must not be null");
        lock.readLock().lock();
        try {
            return records.stream()
                    .filter(query::matches)
                    .sorted(Comparator.comparing(ExecutionRecord::getTimestamp).reversed())
                    .limit(query.getLimit())
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ExecutionRecord> between(Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        lock.readLock().lock();
        try {
            return records.stream()
                    .filter(r -> r.within(from, to))
                    .sorted(Comparator.comparing(ExecutionRecord::getTimestamp))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of records appended so far
     */
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
