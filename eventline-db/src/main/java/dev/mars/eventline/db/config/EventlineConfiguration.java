package dev.mars.eventline.db.config;

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

import dev.mars.eventline.core.consumer.ConsumerLoopConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

/**
 * Layered configuration for Eventline.
 *
 * <p>Sources, later ones winning: {@code /eventline-default.properties},
 * {@code /eventline-<profile>.properties}, {@code EVENTLINE_*} environment variables
 * (underscores become dots, lower-cased) and finally {@code eventline.*} system
 * properties. Validation collects every problem before failing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class EventlineConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EventlineConfiguration.class);

    private static final String PREFIX = "eventline.";
    private static final String ENV_PREFIX = "EVENTLINE_";

    private final Properties properties;
    private final String profile;

    public EventlineConfiguration() {
        this(getActiveProfile());
    }

    public EventlineConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Loads the profile, then applies {@code overrides} on top of every other source.
     * Lets callers configure programmatically without touching system properties.
     */
    public EventlineConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded Eventline configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("eventline.profile",
               System.getenv("EVENTLINE_PROFILE") != null ? System.getenv("EVENTLINE_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/eventline-default.properties");
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/eventline-" + profile + ".properties");
        }

        System.getenv().forEach((key, value) -> {
            if (key.startsWith(ENV_PREFIX)) {
                props.setProperty(key.toLowerCase().replace("_", "."), value);
            }
        });

        // System properties last so tests can override with System.setProperty
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith(PREFIX)) {
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

        validateDatabaseConfig(errors);
        validateBusConfig(errors);
        validateConsumerConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.info("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("eventline.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("eventline.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("eventline.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString("eventline.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }

        if (getInt("eventline.database.pool.max-size", 16) < 2) {
            errors.add("Pool max size must be at least 2");
        }
    }

    private void validateBusConfig(List<String> errors) {
        String domain = getString("eventline.bus.domain", "");
        if (domain.isBlank()) {
            errors.add("Bus domain is required");
        } else if (domain.contains(".")) {
            errors.add("Bus domain must not contain '.'");
        }
    }

    private void validateConsumerConfig(List<String> errors) {
        Duration pollInterval = getDuration("eventline.consumer.poll-interval", Duration.ofSeconds(3));
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            errors.add("Consumer poll interval must be positive");
        }

        int batchSize = getInt("eventline.consumer.batch-size", 1);
        if (batchSize < 1 || batchSize > 1000) {
            errors.add("Consumer batch size must be between 1 and 1000");
        }
    }

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

    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString("eventline.database.host", "localhost"))
            .port(getInt("eventline.database.port", 5432))
            .database(getString("eventline.database.name", "eventline"))
            .username(getString("eventline.database.username", "eventline"))
            .password(getString("eventline.database.password", ""))
            .schema(getString("eventline.database.schema", "public"))
            .sslEnabled(getBoolean("eventline.database.ssl.enabled", false))
            .build();
    }

    public PgPoolConfig getPoolConfig() {
        return new PgPoolConfig.Builder()
            .maxSize(getInt("eventline.database.pool.max-size", 16))
            .maxWaitQueueSize(getInt("eventline.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(Duration.ofMillis(getLong("eventline.database.pool.connection-timeout-ms", 30000)))
            .idleTimeout(Duration.ofMillis(getLong("eventline.database.pool.idle-timeout-ms", 600000)))
            .shared(getBoolean("eventline.database.pool.shared", true))
            .build();
    }

    public ConsumerLoopConfig getConsumerLoopConfig() {
        return new ConsumerLoopConfig.Builder()
            .pollInterval(getDuration("eventline.consumer.poll-interval", Duration.ofSeconds(3)))
            .batchSize(getInt("eventline.consumer.batch-size", 1))
            .build();
    }

    public String getBusDomain() {
        return getString("eventline.bus.domain");
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("eventline.metrics.enabled", true),
            getString("eventline.metrics.instance-id", "eventline-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
