package io.xrdflow.core;

import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.execution.FailurePolicy;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/// Configuration of scan processing.
///
/// ### Default Values
/// - `workerCount`: number of available processors
/// - `failurePolicy`: {@link FailurePolicy#ABORT}
/// - `frameTimeout`: 5 minutes without any completed frame
///
/// ### Property keys
/// {@link #fromProperties(Properties)} reads `xrdflow.workers`, `xrdflow.failure-policy`
/// (`abort` or `skip`) and `xrdflow.frame-timeout-seconds`.
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ProcessingFactory}
/// and do not modify afterwards.
///
/// @see ProcessingFactory
/// @see Builder
public class ProcessingConfig {

    public static final String WORKERS_KEY = "xrdflow.workers";
    public static final String FAILURE_POLICY_KEY = "xrdflow.failure-policy";
    public static final String FRAME_TIMEOUT_KEY = "xrdflow.frame-timeout-seconds";

    private int workerCount = Runtime.getRuntime().availableProcessors();
    private FailurePolicy failurePolicy = FailurePolicy.ABORT;
    private Duration frameTimeout = Duration.ofMinutes(5);

    /// Creates a configuration with default values.
    public ProcessingConfig() {}

    /// Creates a configuration from properties, using defaults for missing keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws ConfigException if a value cannot be parsed
    public static ProcessingConfig fromProperties(Properties properties) {
        ProcessingConfig config = new ProcessingConfig();
        String workers = properties.getProperty(WORKERS_KEY);
        String policy = properties.getProperty(FAILURE_POLICY_KEY);
        String timeout = properties.getProperty(FRAME_TIMEOUT_KEY);
        try {
            if (workers != null) {
                config.setWorkerCount(Integer.parseInt(workers.trim()));
            }
            if (timeout != null) {
                config.setFrameTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
            }
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid number in processing properties: " + e.getMessage(), e);
        }
        if (policy != null) {
            try {
                config.setFailurePolicy(
                        FailurePolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Unknown failure policy: " + policy, e);
            }
        }
        return config;
    }

    /// Returns the number of workers processing frames concurrently.
    public int getWorkerCount() {
        return workerCount;
    }

    /// Sets the number of concurrent workers.
    ///
    /// @param workerCount number of workers, at least 1
    /// @throws ConfigException if `workerCount` is less than 1
    public void setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new ConfigException("The worker count must be at least 1, got " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(FailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }

    /// Returns how long the coordinator waits for the next completed frame.
    public Duration getFrameTimeout() {
        return frameTimeout;
    }

    public void setFrameTimeout(Duration frameTimeout) {
        if (frameTimeout == null || frameTimeout.isNegative() || frameTimeout.isZero()) {
            throw new ConfigException("The frame timeout must be positive, got " + frameTimeout);
        }
        this.frameTimeout = frameTimeout;
    }

    /// Creates a new builder for fluent configuration construction.
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ProcessingConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ProcessingConfig config = new ProcessingConfig();

        public Builder workerCount(int workerCount) {
            config.setWorkerCount(workerCount);
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            config.setFailurePolicy(failurePolicy);
            return this;
        }

        public Builder frameTimeout(Duration frameTimeout) {
            config.setFrameTimeout(frameTimeout);
            return this;
        }

        /// @return the configured instance, never null
        public ProcessingConfig build() {
            return config;
        }
    }
}
