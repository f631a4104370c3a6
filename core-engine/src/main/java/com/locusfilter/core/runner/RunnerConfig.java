package com.locusfilter.core.runner;

import com.locusfilter.core.context.StreamRegistry;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration for a {@link FilterRunner}.
 *
 * <p>
 * Use {@link #fromEnvironment(StreamRegistry)} to resolve the tunables from
 * environment variables, or the {@link Builder} for programmatic / test
 * scenarios. The stream registry always comes from the filters
 * configuration, never from the environment.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Wall-clock budget per invocation, in milliseconds. {@code 0} disables it. */
    public static final String ENV_TIMEOUT_MS = "FILTER_TIMEOUT_MS";

    /** Worker threads used by batch runs. */
    public static final String ENV_BATCH_PARALLELISM = "FILTER_BATCH_PARALLELISM";

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration invocationTimeout;
    private final int batchParallelism;
    private final StreamRegistry streamRegistry;

    private RunnerConfig(Builder b) {
        this.invocationTimeout = b.invocationTimeout;
        this.batchParallelism = b.batchParallelism;
        this.streamRegistry = b.streamRegistry;
    }

    /**
     * Build a configuration from environment variables.
     *
     * @param streamRegistry streams filters may publish to
     * @return validated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static RunnerConfig fromEnvironment(StreamRegistry streamRegistry) {
        try {
            Builder builder = builder().streamRegistry(streamRegistry);
            String timeout = env(ENV_TIMEOUT_MS);
            if (timeout != null) {
                builder.invocationTimeout(Duration.ofMillis(Long.parseLong(timeout)));
            }
            String parallelism = env(ENV_BATCH_PARALLELISM);
            if (parallelism != null) {
                builder.batchParallelism(Integer.parseInt(parallelism));
            }
            return builder.build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return per-invocation budget; {@link Duration#ZERO} means unlimited
     */
    public Duration getInvocationTimeout() {
        return invocationTimeout;
    }

    public boolean hasInvocationTimeout() {
        return !invocationTimeout.isZero();
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    public StreamRegistry getStreamRegistry() {
        return streamRegistry;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     */
    public static class Builder {
        private Duration invocationTimeout = DEFAULT_TIMEOUT;
        private int batchParallelism = Runtime.getRuntime().availableProcessors();
        private StreamRegistry streamRegistry;

        public Builder invocationTimeout(Duration v) {
            this.invocationTimeout = v;
            return this;
        }

        public Builder batchParallelism(int v) {
            this.batchParallelism = v;
            return this;
        }

        public Builder streamRegistry(StreamRegistry v) {
            this.streamRegistry = v;
            return this;
        }

        /**
         * @return validated configuration
         * @throws NullPointerException     if the stream registry or timeout is
         *                                  missing
         * @throws IllegalArgumentException if a value is out of range
         */
        public RunnerConfig build() {
            Objects.requireNonNull(streamRegistry, "streamRegistry required");
            Objects.requireNonNull(invocationTimeout, "invocationTimeout required");
            if (invocationTimeout.isNegative()) {
                throw new IllegalArgumentException(
                        "invocationTimeout must not be negative, got: " + invocationTimeout);
            }
            if (batchParallelism < 1) {
                throw new IllegalArgumentException(
                        "batchParallelism must be >= 1, got: " + batchParallelism);
            }
            return new RunnerConfig(this);
        }
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "invocationTimeout=" + invocationTimeout +
                ", batchParallelism=" + batchParallelism +
                ", streams=" + streamRegistry.getStreamNames() +
                '}';
    }
}
