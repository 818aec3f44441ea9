package com.indicatorsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A monitored metric definition.
 *
 * <p>
 * Instances are immutable. The scheduler and executor never mutate an
 * indicator; the last-run timestamp is written back through the indicator
 * store, which replaces the stored instance with {@link #withLastRun(Instant)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. The builder only enforces that {@code type} and
 * {@code config} are present; range and required-field checks are done by
 * {@link com.indicatorsentinel.core.config.IndicatorValidator} when the
 * indicator is created or updated in a store.
 * </p>
 *
 * @since 1.0.0
 */
public final class Indicator implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;
    private final String name;
    private final String owner;
    private final boolean active;
    private final Priority priority;
    private final int frequencyMinutes;
    private final Instant lastRun;
    private final IndicatorType type;
    private final IndicatorConfig config;
    private final String sourceRef;

    private Indicator(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.owner = b.owner;
        this.active = b.active;
        this.priority = b.priority != null ? b.priority : Priority.MEDIUM;
        this.frequencyMinutes = b.frequencyMinutes;
        this.lastRun = b.lastRun;
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.config = Objects.requireNonNull(b.config, "config must not be null");
        this.sourceRef = b.sourceRef;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this indicator's values
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .owner(owner)
                .active(active)
                .priority(priority)
                .frequencyMinutes(frequencyMinutes)
                .lastRun(lastRun)
                .type(type)
                .config(config)
                .sourceRef(sourceRef);
    }

    /**
     * @param lastRun new last-run timestamp
     * @return a copy of this indicator with {@code lastRun} replaced
     */
    public Indicator withLastRun(Instant lastRun) {
        return toBuilder().lastRun(lastRun).build();
    }

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------

    public Duration getFrequency() {
        return Duration.ofMinutes(frequencyMinutes);
    }

    /**
     * @return earliest instant of the next run, or {@code null} if the
     *         indicator has never run
     */
    public Instant nextRunAt() {
        return lastRun == null ? null : lastRun.plus(getFrequency());
    }

    /**
     * Due predicate: {@code active AND (lastRun == null OR now - lastRun >= frequency)}.
     * An elapsed interval exactly equal to the frequency counts as due.
     *
     * @param now evaluation time
     * @return {@code true} if the indicator should run at {@code now}
     */
    public boolean isDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (!active) {
            return false;
        }
        return lastRun == null || !now.isBefore(nextRunAt());
    }

    /**
     * @return collection window in minutes for this indicator's type
     */
    public int windowMinutes() {
        return config.windowMinutes(frequencyMinutes);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isActive() {
        return active;
    }

    public Priority getPriority() {
        return priority;
    }

    public int getFrequencyMinutes() {
        return frequencyMinutes;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public IndicatorType getType() {
        return type;
    }

    public IndicatorConfig getConfig() {
        return config;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private int id;
        private String name;
        private String owner;
        private boolean active = true;
        private Priority priority = Priority.MEDIUM;
        private int frequencyMinutes;
        private Instant lastRun;
        private IndicatorType type;
        private IndicatorConfig config;
        private String sourceRef;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder frequencyMinutes(int frequencyMinutes) {
            this.frequencyMinutes = frequencyMinutes;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder type(IndicatorType type) {
            this.type = type;
            return this;
        }

        public Builder config(IndicatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder sourceRef(String sourceRef) {
            this.sourceRef = sourceRef;
            return this;
        }

        /**
         * @return a new {@link Indicator}
         * @throws NullPointerException if {@code type} or {@code config} is
         *                              {@code null}
         */
        public Indicator build() {
            return new Indicator(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Indicator that))
            return false;
        return id == that.id
                && active == that.active
                && frequencyMinutes == that.frequencyMinutes
                && Objects.equals(name, that.name)
                && Objects.equals(owner, that.owner)
                && priority == that.priority
                && Objects.equals(lastRun, that.lastRun)
                && type == that.type
                && Objects.equals(config, that.config)
                && Objects.equals(sourceRef, that.sourceRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, owner, active, priority, frequencyMinutes, lastRun, type, config, sourceRef);
    }

    @Override
    public String toString() {
        return "Indicator{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", owner='" + owner + '\'' +
                ", active=" + active +
                ", priority=" + priority +
                ", frequencyMinutes=" + frequencyMinutes +
                ", lastRun=" + lastRun +
                ", type=" + type.code() +
                ", config=" + config +
                '}';
    }
}
