package com.indicatorsentinel.core.ledger;

import java.time.Instant;

/**
 * Filter for execution history lookups. Unset criteria match everything.
 *
 * @since 1.0.0
 */
public final class ExecutionQuery {

    /** Cap applied when no limit is given. */
    public static final int DEFAULT_LIMIT = 100;

    private final Integer indicatorId;
    private final Instant from;
    private final Instant to;
    private final Boolean success;
    private final int limit;

    private ExecutionQuery(Builder b) {
        if (b.from != null && b.to != null && b.from.isAfter(b.to)) {
            throw new IllegalArgumentException("'from' must not be after 'to': " + b.from + " > " + b.to);
        }
        if (b.limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + b.limit);
        }
        this.indicatorId = b.indicatorId;
        this.from = b.from;
        this.to = b.to;
        this.success = b.success;
        this.limit = b.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a query matching every record, capped at {@value #DEFAULT_LIMIT}
     */
    public static ExecutionQuery all() {
        return builder().build();
    }

    /**
     * @param record candidate record
     * @return {@code true} if the record satisfies every set criterion
     */
    public boolean matches(ExecutionRecord record) {
        if (indicatorId != null && record.getIndicatorId() != indicatorId) {
            return false;
        }
        if (from != null && record.getTimestamp().isBefore(from)) {
            return false;
        }
        if (to != null && record.getTimestamp().isAfter(to)) {
            return false;
        }
        return success == null || record.isSuccess() == success;
    }

    public Integer getIndicatorId() {
        return indicatorId;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public Boolean getSuccess() {
        return success;
    }

    public int getLimit() {
        return limit;
    }

    public static class Builder {
        private Integer indicatorId;
        private Instant from;
        private Instant to;
        private Boolean success;
        private int limit = DEFAULT_LIMIT;

        public Builder indicatorId(Integer indicatorId) {
            this.indicatorId = indicatorId;
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder success(Boolean success) {
            this.success = success;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code from} is after {@code to} or
         *                                  {@code limit < 1}
         */
        public ExecutionQuery build() {
            return new ExecutionQuery(this);
        }
    }

    @Override
    public String toString() {
        return "ExecutionQuery{" +
                "indicatorId=" + indicatorId +
                ", from=" + from +
                ", to=" + to +
                ", success=" + success +
                ", limit=" + limit +
                '}';
    }
}
