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

package dev.mars.ripple.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the Ripple event bus and workflow engine.
 *
 * <p>Values are layered: built-in defaults, then the first readable
 * {@code ripple.properties} (working directory, {@code config/}, the user's
 * {@code ~/.ripple/}, {@code /etc/ripple/}, then the classpath), then any
 * {@code ripple.*} system property.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RippleConfiguration {
    private static final Logger logger = Logger.getLogger(RippleConfiguration.class.getName());

    public static final String ENGINE_MAX_CONCURRENT = "ripple.engine.max.concurrent";
    public static final String ENGINE_QUEUE_CAPACITY = "ripple.engine.queue.capacity";
    public static final String ENGINE_TIMEOUT_MS = "ripple.engine.timeout.ms";
    public static final String ENGINE_SHUTDOWN_TIMEOUT_MS = "ripple.engine.shutdown.timeout.ms";
    public static final String ENGINE_OUTCOME_EVENTS_ENABLED = "ripple.engine.outcome.events.enabled";
    public static final String BUS_HISTORY_SIZE = "ripple.bus.history.size";
    public static final String WORKFLOW_DIR = "ripple.workflow.dir";
    public static final String METRICS_ENABLED = "ripple.monitoring.metrics.enabled";

    private static final int DEFAULT_MAX_CONCURRENT_INVOCATIONS = 10;
    private static final int DEFAULT_QUEUE_CAPACITY = 1000;
    private static final long DEFAULT_INVOCATION_TIMEOUT_MS = 30000;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 10000;
    private static final int DEFAULT_BUS_HISTORY_SIZE = 100;
    private static final String DEFAULT_WORKFLOW_DIR = "workflows";

    private final Properties properties;

    public RippleConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public RippleConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Engine

    public int getMaxConcurrentInvocations() {
        return getPositiveInt(ENGINE_MAX_CONCURRENT, DEFAULT_MAX_CONCURRENT_INVOCATIONS);
    }

    public int getQueueCapacity() {
        return getPositiveInt(ENGINE_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * Global per-invocation timeout. {@link Duration#ZERO} means invocations are unbounded.
     */
    public Duration getInvocationTimeout() {
        long millis = getLongProperty(ENGINE_TIMEOUT_MS, DEFAULT_INVOCATION_TIMEOUT_MS);
        return millis > 0 ? Duration.ofMillis(millis) : Duration.ZERO;
    }

    public Duration getShutdownTimeout() {
        return Duration.ofMillis(getLongProperty(ENGINE_SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS));
    }

    public boolean isOutcomeEventsEnabled() {
        return getBooleanProperty(ENGINE_OUTCOME_EVENTS_ENABLED, true);
    }

    // Event bus

    public int getBusHistorySize() {
        return getPositiveInt(BUS_HISTORY_SIZE, DEFAULT_BUS_HISTORY_SIZE);
    }

    // Workflow documents

    public Path getWorkflowDirectory() {
        return Paths.get(getStringProperty(WORKFLOW_DIR, DEFAULT_WORKFLOW_DIR));
    }

    // Monitoring

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getPositiveInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warning("Non-positive value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(ENGINE_MAX_CONCURRENT, String.valueOf(DEFAULT_MAX_CONCURRENT_INVOCATIONS));
        properties.setProperty(ENGINE_QUEUE_CAPACITY, String.valueOf(DEFAULT_QUEUE_CAPACITY));
        properties.setProperty(ENGINE_TIMEOUT_MS, String.valueOf(DEFAULT_INVOCATION_TIMEOUT_MS));
        properties.setProperty(ENGINE_SHUTDOWN_TIMEOUT_MS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_MS));
        properties.setProperty(ENGINE_OUTCOME_EVENTS_ENABLED, "true");
        properties.setProperty(BUS_HISTORY_SIZE, String.valueOf(DEFAULT_BUS_HISTORY_SIZE));
        properties.setProperty(WORKFLOW_DIR, DEFAULT_WORKFLOW_DIR);
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "ripple.properties",
                "config/ripple.properties",
                System.getProperty("user.home") + "/.ripple/ripple.properties",
                "/etc/ripple/ripple.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("ripple.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("ripple."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "RippleConfiguration{" +
                "maxConcurrentInvocations=" + getMaxConcurrentInvocations() +
                ", queueCapacity=" + getQueueCapacity() +
                ", invocationTimeout=" + getInvocationTimeout() +
                ", busHistorySize=" + getBusHistorySize() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
