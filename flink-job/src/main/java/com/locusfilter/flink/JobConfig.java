package com.locusfilter.flink;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kafka, Flink and health-probe settings of the streaming job.
 *
 * <p>
 * Filter settings are not held here: the filters file is resolved by
 * {@link com.locusfilter.core.config.FilterConfigLoader} and the invocation
 * budget by {@link com.locusfilter.core.runner.RunnerConfig#fromEnvironment}.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>{@code localhost:9092}</td></tr>
 * <tr><td>{@code KAFKA_LOCI_TOPIC}</td><td>{@code loci}</td></tr>
 * <tr><td>{@code KAFKA_REPORTS_TOPIC}</td><td>{@code filter-reports}</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>{@code locus-filter}</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>{@code 1}</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>{@code 60000}</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>{@code 8080}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_BOOTSTRAP_SERVERS = "KAFKA_BOOTSTRAP_SERVERS";
    public static final String ENV_LOCI_TOPIC = "KAFKA_LOCI_TOPIC";
    public static final String ENV_REPORTS_TOPIC = "KAFKA_REPORTS_TOPIC";
    public static final String ENV_GROUP_ID = "KAFKA_GROUP_ID";
    public static final String ENV_PARALLELISM = "FLINK_PARALLELISM";
    public static final String ENV_CHECKPOINT_INTERVAL_MS = "FLINK_CHECKPOINT_INTERVAL_MS";
    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";

    private final String bootstrapServers;
    private final String lociTopic;
    private final String reportsTopic;
    private final String groupId;
    private final int parallelism;
    private final Duration checkpointInterval;
    private final int healthPort;

    private JobConfig(Map<String, String> env, List<String> errors) {
        this.bootstrapServers = text(env, ENV_BOOTSTRAP_SERVERS, "localhost:9092");
        this.lociTopic = text(env, ENV_LOCI_TOPIC, "loci");
        this.reportsTopic = text(env, ENV_REPORTS_TOPIC, "filter-reports");
        this.groupId = text(env, ENV_GROUP_ID, "locus-filter");
        this.parallelism = (int) number(env, ENV_PARALLELISM, 1, 1, 32_768, errors);
        this.checkpointInterval = Duration.ofMillis(
                number(env, ENV_CHECKPOINT_INTERVAL_MS, 60_000, 1, Long.MAX_VALUE, errors));
        this.healthPort = (int) number(env, ENV_HEALTH_PORT, 8080, 1, 65_535, errors);

        if (lociTopic.equals(reportsTopic)) {
            errors.add("Loci and reports topics must differ, both are '" + lociTopic + "'");
        }
    }

    /**
     * Resolve the job settings from the process environment.
     *
     * @return validated configuration
     * @throws IllegalStateException if any variable is malformed or out of
     *                               range; every problem is listed
     */
    public static JobConfig fromEnvironment() {
        return from(System.getenv());
    }

    /**
     * Resolve the job settings from a variable map. Unset or blank entries
     * take their defaults.
     *
     * @param env variable name to value
     * @return validated configuration
     * @throws IllegalStateException if any variable is malformed or out of
     *                               range; every problem is listed
     */
    static JobConfig from(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment map must not be null");
        List<String> errors = new ArrayList<>();
        JobConfig config = new JobConfig(env, errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Job configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
        return config;
    }

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public String getLociTopic() {
        return lociTopic;
    }

    public String getReportsTopic() {
        return reportsTopic;
    }

    public String getGroupId() {
        return groupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Duration getCheckpointInterval() {
        return checkpointInterval;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private static String text(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static long number(Map<String, String> env, String name, long defaultValue,
            long min, long max, List<String> errors) {
        String raw = text(env, name, null);
        if (raw == null) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            errors.add(name + " must be a whole number, got: '" + raw + "'");
            return defaultValue;
        }
        if (value < min || value > max) {
            errors.add(name + " must be in [" + min + ", " + max + "], got: " + value);
            return defaultValue;
        }
        return value;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "bootstrapServers='" + bootstrapServers + '\'' +
                ", lociTopic='" + lociTopic + '\'' +
                ", reportsTopic='" + reportsTopic + '\'' +
                ", groupId='" + groupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointInterval=" + checkpointInterval +
                ", healthPort=" + healthPort +
                '}';
    }
}
