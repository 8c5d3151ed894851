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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validates defaults, overrides and type conversion of RippleConfiguration.
 */
class RippleConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(RippleConfiguration.ENGINE_MAX_CONCURRENT);
        System.clearProperty(RippleConfiguration.BUS_HISTORY_SIZE);
    }

    // ========== Defaults ==========

    @Test
    void testDefaults() {
        RippleConfiguration config = new RippleConfiguration(new Properties());

        assertEquals(10, config.getMaxConcurrentInvocations());
        assertEquals(1000, config.getQueueCapacity());
        assertEquals(Duration.ofSeconds(30), config.getInvocationTimeout());
        assertEquals(Duration.ofSeconds(10), config.getShutdownTimeout());
        assertTrue(config.isOutcomeEventsEnabled());
        assertEquals(100, config.getBusHistorySize());
        assertEquals(Paths.get("workflows"), config.getWorkflowDirectory());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Overrides ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(RippleConfiguration.ENGINE_MAX_CONCURRENT, "4");
        props.setProperty(RippleConfiguration.ENGINE_TIMEOUT_MS, "1500");
        props.setProperty(RippleConfiguration.ENGINE_OUTCOME_EVENTS_ENABLED, "false");
        props.setProperty(RippleConfiguration.WORKFLOW_DIR, "/opt/ripple/workflows");

        RippleConfiguration config = new RippleConfiguration(props);

        assertEquals(4, config.getMaxConcurrentInvocations());
        assertEquals(Duration.ofMillis(1500), config.getInvocationTimeout());
        assertFalse(config.isOutcomeEventsEnabled());
        assertEquals(Paths.get("/opt/ripple/workflows"), config.getWorkflowDirectory());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(RippleConfiguration.ENGINE_MAX_CONCURRENT, "7");
        System.setProperty(RippleConfiguration.BUS_HISTORY_SIZE, "5");

        RippleConfiguration config = new RippleConfiguration();

        assertEquals(7, config.getMaxConcurrentInvocations());
        assertEquals(5, config.getBusHistorySize());
    }

    @Test
    void testZeroTimeoutDisablesTimeout() {
        Properties props = new Properties();
        props.setProperty(RippleConfiguration.ENGINE_TIMEOUT_MS, "0");

        assertEquals(Duration.ZERO, new RippleConfiguration(props).getInvocationTimeout());
    }

    // ========== Invalid values ==========

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(RippleConfiguration.ENGINE_MAX_CONCURRENT, "many");
        props.setProperty(RippleConfiguration.ENGINE_QUEUE_CAPACITY, "-3");
        props.setProperty(RippleConfiguration.ENGINE_TIMEOUT_MS, "soon");

        RippleConfiguration config = new RippleConfiguration(props);

        assertEquals(10, config.getMaxConcurrentInvocations());
        assertEquals(1000, config.getQueueCapacity());
        assertEquals(Duration.ofSeconds(30), config.getInvocationTimeout());
    }

    @Test
    void testGenericPropertyAccess() {
        RippleConfiguration config = new RippleConfiguration(new Properties());
        config.setProperty("ripple.custom", "value");

        assertEquals("value", config.getProperty("ripple.custom"));
        assertEquals("fallback", config.getProperty("ripple.missing", "fallback"));
        assertNull(config.getProperty("ripple.missing"));
    }
}
