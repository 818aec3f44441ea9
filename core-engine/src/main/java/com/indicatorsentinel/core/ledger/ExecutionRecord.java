package com.indicatorsentinel.core.ledger;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one indicator run.
 *
 * <p>
 * Created exactly once per run by the executor and immutable once appended
 * to the {@link ExecutionLedger}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp} and {@code duration} are
 * required; a failed record must carry an error message.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExecutionRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int indicatorId;
    private final Instant timestamp;
    private final Double currentValue;
    private final Double baselineValue;
    private final Double deviationPercent;
    private final boolean success;
    private final String errorMessage;
    private final Duration duration;

    private ExecutionRecord(Builder b) {
        this.indicatorId = b.indicatorId;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.currentValue = b.currentValue;
        this.baselineValue = b.baselineValue;
        this.deviationPercent = b.deviationPercent;
        this.success = b.success;
        this.errorMessage = b.errorMessage;
        this.duration = Objects.requireNonNull(b.duration, "duration must not be null");
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("A failed execution record requires an error message");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ExecutionRecord} instances.
     */
    public static class Builder {
        private int indicatorId;
        private Instant timestamp;
        private Double currentValue;
        private Double baselineValue;
        private Double deviationPercent;
        private boolean success;
        private String errorMessage;
        private Duration duration = Duration.ZERO;

        public Builder indicatorId(int indicatorId) {
            this.indicatorId = indicatorId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder currentValue(Double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder baselineValue(Double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder deviationPercent(Double deviationPercent) {
            this.deviationPercent = deviationPercent;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        /**
         * @return a new {@link ExecutionRecord}
         * @throws NullPointerException     if {@code timestamp} or {@code duration}
         *                                  is {@code null}
         * @throws IllegalArgumentException if a failed record has no error message
         */
        public ExecutionRecord build() {
            return new ExecutionRecord(this);
        }
    }

    /**
     * @param from window start, inclusive
     * @param to   window end, inclusive
     * @return {@code true} if this record's timestamp lies within the window
     */
    public boolean within(Instant from, Instant to) {
        return !timestamp.isBefore(from) && !timestamp.isAfter(to);
    }

    public int getIndicatorId() {
        return indicatorId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the collected value, or {@code null} if collection failed
     */
    public Double getCurrentValue() {
        return currentValue;
    }

    public Double getBaselineValue() {
        return baselineValue;
    }

    public Double getDeviationPercent() {
        return deviationPercent;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExecutionRecord that))
            return false;
        return indicatorId == that.indicatorId
                && success == that.success
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(currentValue, that.currentValue)
                && Objects.equals(baselineValue, that.baselineValue)
                && Objects.equals(deviationPercent, that.deviationPercent)
                && Objects.equals(errorMessage, that.errorMessage)
                && Objects.equals(duration, that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indicatorId, timestamp, currentValue, baselineValue, deviationPercent,
                success, errorMessage, duration);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{" +
                "indicatorId=" + indicatorId +
                ", timestamp=" + timestamp +
                ", currentValue=" + currentValue +
                ", baselineValue=" + baselineValue +
                ", deviationPercent=" + deviationPercent +
                ", success=" + success +
                ", errorMessage='" + errorMessage + '\'' +
                ", duration=" + duration +
                '}';
    }
}
