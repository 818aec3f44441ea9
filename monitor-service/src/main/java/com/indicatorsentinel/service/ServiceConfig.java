package com.indicatorsentinel.service;

import com.indicatorsentinel.core.evaluation.Severity;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration for the Indicator Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configurable through Deployment env vars, Docker {@code -e}
 * flags or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------
    private final Duration tickInterval;
    private final int workerPoolSize;
    private final Duration collectionTimeout;
    private final Duration leaseGrace;

    // ---------------------------------------------------------------
    // Evaluation / dashboard
    // ---------------------------------------------------------------
    private final Severity thresholdSeverity;
    private final Duration dashboardWindow;

    // ---------------------------------------------------------------
    // Indicators
    // ---------------------------------------------------------------
    private final String indicatorsConfigPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaNotificationTopic;

    private ServiceConfig(Builder b) {
        this.tickInterval = Duration.ofSeconds(b.tickIntervalSeconds);
        this.workerPoolSize = b.workerPoolSize;
        this.collectionTimeout = Duration.ofSeconds(b.collectionTimeoutSeconds);
        this.leaseGrace = Duration.ofSeconds(b.leaseGraceSeconds);
        this.thresholdSeverity = b.thresholdSeverity;
        this.dashboardWindow = Duration.ofMinutes(b.dashboardWindowMinutes);
        this.indicatorsConfigPath = b.indicatorsConfigPath;
        this.healthPort = b.healthPort;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaNotificationTopic = b.kafkaNotificationTopic;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     */
    static ServiceConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .tickIntervalSeconds(parseLong(env, "TICK_INTERVAL_SECONDS", "60"))
                    .workerPoolSize(parseInt(env, "WORKER_POOL_SIZE", "5"))
                    .collectionTimeoutSeconds(parseLong(env, "COLLECTION_TIMEOUT_SECONDS", "30"))
                    .leaseGraceSeconds(parseLong(env, "LEASE_GRACE_SECONDS", "60"))
                    .thresholdSeverity(parseSeverity(env, "THRESHOLD_DEFAULT_SEVERITY", "medium"))
                    .dashboardWindowMinutes(parseLong(env, "DASHBOARD_WINDOW_MINUTES", "60"))
                    .indicatorsConfigPath(value(env, "INDICATORS_CONFIG_PATH", ""))
                    .healthPort(parseInt(env, "HEALTH_PORT", "8080"))
                    .kafkaBootstrapServers(value(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaNotificationTopic(value(env, "KAFKA_NOTIFICATION_TOPIC", "indicator-alerts"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties} for alert notifications.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("client.id", "indicator-sentinel");
        props.setProperty("acks", "all");
        props.setProperty("linger.ms", "10");
        return props;
    }

    /**
     * Lease lifetime: a run that holds its lease longer than the collection
     * timeout plus the grace period is considered stuck.
     */
    public Duration leaseTtl() {
        return collectionTimeout.plus(leaseGrace);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Duration getTickInterval() {
        return tickInterval;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public Duration getCollectionTimeout() {
        return collectionTimeout;
    }

    public Duration getLeaseGrace() {
        return leaseGrace;
    }

    public Severity getThresholdSeverity() {
        return thresholdSeverity;
    }

    public Duration getDashboardWindow() {
        return dashboardWindow;
    }

    public String getIndicatorsConfigPath() {
        return indicatorsConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaNotificationTopic() {
        return kafkaNotificationTopic;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that every duration and the pool size are
     * positive, the lease grace is not negative, the port is in [1, 65535]
     * and the topic name is not blank.
     * </p>
     */
    public static class Builder {
        private long tickIntervalSeconds = 60;
        private int workerPoolSize = 5;
        private long collectionTimeoutSeconds = 30;
        private long leaseGraceSeconds = 60;
        private Severity thresholdSeverity = Severity.MEDIUM;
        private long dashboardWindowMinutes = 60;
        private String indicatorsConfigPath = "";
        private int healthPort = 8080;
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaNotificationTopic = "indicator-alerts";

        public Builder tickIntervalSeconds(long v) {
            this.tickIntervalSeconds = v;
            return this;
        }

        public Builder workerPoolSize(int v) {
            this.workerPoolSize = v;
            return this;
        }

        public Builder collectionTimeoutSeconds(long v) {
            this.collectionTimeoutSeconds = v;
            return this;
        }

        public Builder leaseGraceSeconds(long v) {
            this.leaseGraceSeconds = v;
            return this;
        }

        public Builder thresholdSeverity(Severity v) {
            this.thresholdSeverity = v;
            return this;
        }

        public Builder dashboardWindowMinutes(long v) {
            this.dashboardWindowMinutes = v;
            return this;
        }

        public Builder indicatorsConfigPath(String v) {
            this.indicatorsConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaNotificationTopic(String v) {
            this.kafkaNotificationTopic = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(thresholdSeverity, "thresholdSeverity required");
            Objects.requireNonNull(indicatorsConfigPath, "indicatorsConfigPath required");
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaNotificationTopic, "kafkaNotificationTopic");

            requirePositive(tickIntervalSeconds, "tickIntervalSeconds");
            requirePositive(workerPoolSize, "workerPoolSize");
            requirePositive(collectionTimeoutSeconds, "collectionTimeoutSeconds");
            requirePositive(dashboardWindowMinutes, "dashboardWindowMinutes");
            if (leaseGraceSeconds < 0) {
                throw new IllegalArgumentException("leaseGraceSeconds must be >= 0, got: " + leaseGraceSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new ServiceConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseInt(Map<String, String> env, String name, String defaultValue) {
        return Integer.parseInt(value(env, name, defaultValue));
    }

    private static long parseLong(Map<String, String> env, String name, String defaultValue) {
        return Long.parseLong(value(env, name, defaultValue));
    }

    private static Severity parseSeverity(Map<String, String> env, String name, String defaultValue) {
        String raw = value(env, name, defaultValue);
        try {
            return Severity.fromCode(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for " + name + ": " + raw, e);
        }
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "tickInterval=" + tickInterval +
                ", workerPoolSize=" + workerPoolSize +
                ", collectionTimeout=" + collectionTimeout +
                ", leaseGrace=" + leaseGrace +
                ", thresholdSeverity=" + thresholdSeverity +
                ", dashboardWindow=" + dashboardWindow +
                ", indicatorsConfigPath='" + indicatorsConfigPath + '\'' +
                ", healthPort=" + healthPort +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaNotificationTopic='" + kafkaNotificationTopic + '\'' +
                '}';
    }
}
