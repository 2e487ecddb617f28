package dev.mars.foldstore.core.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.foldstore.core.cache.EventStreamCache;
import dev.mars.foldstore.core.persistence.files.IoRetryStrategy;
import dev.mars.foldstore.core.retry.OptimisticConcurrencyRetryStrategy;
import dev.mars.foldstore.core.snapshot.SnapshotRandomlyStrategy;
import dev.mars.foldstore.core.snapshot.SnapshotStrategy;
import dev.mars.foldstore.core.upgrade.EventUpgradeChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Random;

/**
 * Configuration management for FoldStore.
 *
 * <p>Properties are layered, later sources winning: {@code /foldstore-default.properties}, then
 * {@code /foldstore-<profile>.properties}, then {@code FOLDSTORE_*} environment variables, then
 * {@code foldstore.*} system properties. The configuration is validated on construction and
 * every problem is reported at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class FoldStoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FoldStoreConfiguration.class);

    private final Properties properties;
    private final String profile;

    public FoldStoreConfiguration() {
        this(getActiveProfile());
    }

    public FoldStoreConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Constructor for programmatic configuration. The overrides win over every other source,
     * which keeps tests independent of System properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties applied last
     */
    public FoldStoreConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded FoldStore configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("foldstore.profile",
               System.getenv("FOLDSTORE_PROFILE") != null ? System.getenv("FOLDSTORE_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        // Load default properties first
        loadPropertiesFromResource(props, "/foldstore-default.properties");

        // Load profile-specific properties
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/foldstore-" + profile + ".properties");
        }

        // Environment variables, then system properties so -D wins over env
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("FOLDSTORE_") && !"FOLDSTORE_PROFILE".equals(key)) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("foldstore.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateAggregateStoreConfig(errors);
        validateCacheConfig(errors);
        validateSnapshotConfig(errors);
        validateCircuitBreakerConfig(errors);
        validateFilesConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateAggregateStoreConfig(List<String> errors) {
        if (getInt("foldstore.aggregate-store.retry.max-retries", OptimisticConcurrencyRetryStrategy.DEFAULT_MAX_RETRIES) < 0) {
            errors.add("Aggregate store max retries must be non-negative");
        }
        Duration delay = getDuration("foldstore.aggregate-store.retry.delay", OptimisticConcurrencyRetryStrategy.DEFAULT_DELAY);
        Duration maxDelay = getDuration("foldstore.aggregate-store.retry.max-delay", Duration.ofSeconds(2));
        if (delay.isNegative()) {
            errors.add("Aggregate store retry delay must be non-negative");
        }
        if (maxDelay.compareTo(delay) < 0) {
            errors.add("Aggregate store retry max delay must be greater than or equal to retry delay");
        }
        if (getDouble("foldstore.aggregate-store.retry.backoff-multiplier", 1.0) < 1.0) {
            errors.add("Aggregate store retry backoff multiplier must be at least 1.0");
        }
        if (getInt("foldstore.upgrade.max-iterations", EventUpgradeChain.DEFAULT_MAX_ITERATIONS) < 1) {
            errors.add("Upgrade max iterations must be at least 1");
        }
        if (getInt("foldstore.global-reader.page-size", 200) < 1) {
            errors.add("Global reader page size must be at least 1");
        }
    }

    private void validateCacheConfig(List<String> errors) {
        if (getBoolean("foldstore.cache.enabled", true)) {
            Duration ttl = getDuration("foldstore.cache.ttl", EventStreamCache.DEFAULT_TTL);
            if (ttl.isNegative() || ttl.isZero()) {
                errors.add("Cache TTL must be positive");
            }
            if (getInt("foldstore.cache.max-entries", EventStreamCache.DEFAULT_MAX_ENTRIES) < 1) {
                errors.add("Cache max entries must be at least 1");
            }
        }
    }

    private void validateSnapshotConfig(List<String> errors) {
        String strategy = getString("foldstore.snapshot.strategy", "none");
        switch (strategy) {
            case "none":
                break;
            case "every":
                if (getInt("foldstore.snapshot.every-versions", 100) < 1) {
                    errors.add("Snapshot interval must be at least 1 version");
                }
                break;
            case "random":
                double probability = getDouble("foldstore.snapshot.probability", 0.1);
                if (probability < 0.0 || probability > 1.0) {
                    errors.add("Snapshot probability must be between 0.0 and 1.0");
                }
                break;
            default:
                errors.add("Snapshot strategy must be one of none, every, random but was '" + strategy + "'");
        }
    }

    private void validateCircuitBreakerConfig(List<String> errors) {
        boolean circuitBreakerEnabled = getBoolean("foldstore.circuit-breaker.enabled", true);
        if (circuitBreakerEnabled) {
            if (getInt("foldstore.circuit-breaker.failure-threshold", 5) < 1) {
                errors.add("Circuit breaker failure threshold must be at least 1");
            }
            if (getDuration("foldstore.circuit-breaker.wait-duration", Duration.ofMinutes(1)).toMillis() < 1000) {
                errors.add("Circuit breaker wait duration must be at least 1000ms");
            }
            if (getInt("foldstore.circuit-breaker.ring-buffer-size", 100) < 1) {
                errors.add("Circuit breaker ring buffer size must be at least 1");
            }
            double rate = getDouble("foldstore.circuit-breaker.failure-rate-threshold", 50.0);
            if (rate <= 0.0 || rate > 100.0) {
                errors.add("Circuit breaker failure rate threshold must be in (0, 100]");
            }
        }
    }

    private void validateFilesConfig(List<String> errors) {
        if (getString("foldstore.files.store-path", "").isBlank()) {
            errors.add("Files store path is required");
        }
        if (getInt("foldstore.files.retry.max-retries", 3) < 0) {
            errors.add("Files retry max retries must be non-negative");
        }
    }

    // Configuration getters with defaults and validation
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public String getProfile() {
        return profile;
    }

    // Specific configuration builders
    public AggregateStoreConfig getAggregateStoreConfig() {
        return new AggregateStoreConfig(
            getInt("foldstore.aggregate-store.retry.max-retries", OptimisticConcurrencyRetryStrategy.DEFAULT_MAX_RETRIES),
            getDuration("foldstore.aggregate-store.retry.delay", OptimisticConcurrencyRetryStrategy.DEFAULT_DELAY),
            getDouble("foldstore.aggregate-store.retry.backoff-multiplier", 1.0),
            getDuration("foldstore.aggregate-store.retry.max-delay", Duration.ofSeconds(2)),
            getInt("foldstore.upgrade.max-iterations", EventUpgradeChain.DEFAULT_MAX_ITERATIONS),
            getInt("foldstore.global-reader.page-size", 200)
        );
    }

    public CacheConfig getCacheConfig() {
        return new CacheConfig(
            getBoolean("foldstore.cache.enabled", true),
            getDuration("foldstore.cache.ttl", EventStreamCache.DEFAULT_TTL),
            getInt("foldstore.cache.max-entries", EventStreamCache.DEFAULT_MAX_ENTRIES)
        );
    }

    public SnapshotConfig getSnapshotConfig() {
        return new SnapshotConfig(
            getString("foldstore.snapshot.strategy", "none"),
            getInt("foldstore.snapshot.every-versions", 100),
            getDouble("foldstore.snapshot.probability", 0.1)
        );
    }

    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return new CircuitBreakerConfig(
            getBoolean("foldstore.circuit-breaker.enabled", true),
            getInt("foldstore.circuit-breaker.failure-threshold", 5),
            getDuration("foldstore.circuit-breaker.wait-duration", Duration.ofMinutes(1)),
            getInt("foldstore.circuit-breaker.ring-buffer-size", 100),
            getDouble("foldstore.circuit-breaker.failure-rate-threshold", 50.0)
        );
    }

    public FilesConfig getFilesConfig() {
        return new FilesConfig(
            Path.of(getString("foldstore.files.store-path", "foldstore-data")),
            getInt("foldstore.files.retry.max-retries", 3),
            getDuration("foldstore.files.retry.initial-delay", Duration.ofMillis(50)),
            getDuration("foldstore.files.retry.max-delay", Duration.ofSeconds(1))
        );
    }

    // Configuration data classes
    public static class AggregateStoreConfig {
        private final int maxRetries;
        private final Duration retryDelay;
        private final double backoffMultiplier;
        private final Duration maxRetryDelay;
        private final int upgradeMaxIterations;
        private final int globalReaderPageSize;

        public AggregateStoreConfig(int maxRetries, Duration retryDelay, double backoffMultiplier,
                                    Duration maxRetryDelay, int upgradeMaxIterations, int globalReaderPageSize) {
            this.maxRetries = maxRetries;
            this.retryDelay = retryDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxRetryDelay = maxRetryDelay;
            this.upgradeMaxIterations = upgradeMaxIterations;
            this.globalReaderPageSize = globalReaderPageSize;
        }

        public int getMaxRetries() { return maxRetries; }
        public Duration getRetryDelay() { return retryDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public Duration getMaxRetryDelay() { return maxRetryDelay; }
        public int getUpgradeMaxIterations() { return upgradeMaxIterations; }
        public int getGlobalReaderPageSize() { return globalReaderPageSize; }

        public OptimisticConcurrencyRetryStrategy createRetryStrategy() {
            return new OptimisticConcurrencyRetryStrategy(maxRetries, retryDelay, backoffMultiplier, maxRetryDelay);
        }

        public EventUpgradeChain.Builder upgradeChainBuilder() {
            return EventUpgradeChain.builder().maxIterations(upgradeMaxIterations);
        }
    }

    public static class CacheConfig {
        private final boolean enabled;
        private final Duration ttl;
        private final int maxEntries;

        public CacheConfig(boolean enabled, Duration ttl, int maxEntries) {
            this.enabled = enabled;
            this.ttl = ttl;
            this.maxEntries = maxEntries;
        }

        public boolean isEnabled() { return enabled; }
        public Duration getTtl() { return ttl; }
        public int getMaxEntries() { return maxEntries; }

        public EventStreamCache createCache(Clock clock) {
            return enabled ? new EventStreamCache(clock, ttl, maxEntries) : EventStreamCache.disabled();
        }
    }

    public static class SnapshotConfig {
        private final String strategy;
        private final int everyVersions;
        private final double probability;

        public SnapshotConfig(String strategy, int everyVersions, double probability) {
            this.strategy = strategy;
            this.everyVersions = everyVersions;
            this.probability = probability;
        }

        public String getStrategy() { return strategy; }
        public int getEveryVersions() { return everyVersions; }
        public double getProbability() { return probability; }

        public SnapshotStrategy createStrategy(Random random) {
            switch (strategy) {
                case "every":
                    return SnapshotStrategy.everyFewVersions(everyVersions);
                case "random":
                    return new SnapshotRandomlyStrategy(probability, random);
                default:
                    return SnapshotStrategy.never();
            }
        }
    }

    public static class CircuitBreakerConfig {
        private final boolean enabled;
        private final int failureThreshold;
        private final Duration waitDuration;
        private final int ringBufferSize;
        private final double failureRateThreshold;

        public CircuitBreakerConfig(boolean enabled, int failureThreshold, Duration waitDuration,
                                    int ringBufferSize, double failureRateThreshold) {
            this.enabled = enabled;
            this.failureThreshold = failureThreshold;
            this.waitDuration = waitDuration;
            this.ringBufferSize = ringBufferSize;
            this.failureRateThreshold = failureRateThreshold;
        }

        public boolean isEnabled() { return enabled; }
        public int getFailureThreshold() { return failureThreshold; }
        public Duration getWaitDuration() { return waitDuration; }
        public int getRingBufferSize() { return ringBufferSize; }
        public double getFailureRateThreshold() { return failureRateThreshold; }

        @Override
        public String toString() {
            return "CircuitBreakerConfig{enabled=" + enabled + ", failureThreshold=" + failureThreshold
                + ", waitDuration=" + waitDuration + ", ringBufferSize=" + ringBufferSize
                + ", failureRateThreshold=" + failureRateThreshold + '}';
        }
    }

    public static class FilesConfig {
        private final Path storePath;
        private final int maxRetries;
        private final Duration initialRetryDelay;
        private final Duration maxRetryDelay;

        public FilesConfig(Path storePath, int maxRetries, Duration initialRetryDelay, Duration maxRetryDelay) {
            this.storePath = storePath;
            this.maxRetries = maxRetries;
            this.initialRetryDelay = initialRetryDelay;
            this.maxRetryDelay = maxRetryDelay;
        }

        public Path getStorePath() { return storePath; }
        public int getMaxRetries() { return maxRetries; }
        public Duration getInitialRetryDelay() { return initialRetryDelay; }
        public Duration getMaxRetryDelay() { return maxRetryDelay; }

        public IoRetryStrategy createRetryStrategy() {
            return new IoRetryStrategy(maxRetries, initialRetryDelay, maxRetryDelay);
        }
    }
}
