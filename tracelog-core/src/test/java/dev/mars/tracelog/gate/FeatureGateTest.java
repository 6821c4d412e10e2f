/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.tracelog.gate;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FeatureGate}.
 */
class FeatureGateTest {

    private final Map<String, String> env = new HashMap<>();

    private FeatureGate gate(boolean configured) {
        return new FeatureGate(configured, env::get);
    }

    @ParameterizedTest(name = "configured={0}, override={1} -> {2}")
    @CsvSource({
            "true,  ,      true",
            "false, ,      false",
            "true,  false, false",
            "false, true,  true",
            "true,  true,  true",
            "false, false, false"
    })
    @DisplayName("Override wins over the configured flag")
    void testResolve(boolean configured, Boolean override, boolean expected) {
        assertEquals(expected, FeatureGate.resolve(configured, Optional.ofNullable(override)));
    }

    @Test
    @DisplayName("Without any override the configured flag applies")
    void testConfiguredOnly() {
        assertTrue(gate(true).isEnabled());
        assertFalse(gate(false).isEnabled());
        assertTrue(gate(true).currentOverride().isEmpty());
    }

    @Test
    @DisplayName("Environment override disables a configured-on gate")
    void testEnvironmentOverride() {
        env.put(FeatureGate.OVERRIDE_ENV, "false");

        FeatureGate gate = gate(true);

        assertFalse(gate.isEnabled());
        assertEquals(Optional.of(false), gate.currentOverride());
        assertTrue(gate.configured());
    }

    @Test
    @DisplayName("Environment is re-read on every evaluation")
    void testEnvironmentReadPerEvaluation() {
        FeatureGate gate = gate(false);
        assertFalse(gate.isEnabled());

        env.put(FeatureGate.OVERRIDE_ENV, "on");
        assertTrue(gate.isEnabled());

        env.remove(FeatureGate.OVERRIDE_ENV);
        assertFalse(gate.isEnabled());
    }

    @Test
    @DisplayName("Operator override wins over the environment and can be cleared")
    void testOperatorOverride() {
        env.put(FeatureGate.OVERRIDE_ENV, "true");
        FeatureGate gate = gate(true);

        gate.override(false);
        assertFalse(gate.isEnabled());

        gate.clearOverride();
        assertTrue(gate.isEnabled());
        assertEquals(Optional.of(true), gate.currentOverride());
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", "1", "yes", "On", " true "})
    void testParseFlag_True(String value) {
        assertEquals(Optional.of(true), FeatureGate.parseFlag(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "False", "0", "no", "OFF"})
    void testParseFlag_False(String value) {
        assertEquals(Optional.of(false), FeatureGate.parseFlag(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "maybe", "2"})
    void testParseFlag_Unrecognized(String value) {
        assertEquals(Optional.empty(), FeatureGate.parseFlag(value));
    }

    @Test
    void testUnrecognizedEnvironmentValueIgnored() {
        env.put(FeatureGate.OVERRIDE_ENV, "perhaps");

        assertTrue(gate(true).isEnabled());
        assertTrue(gate(true).toString().contains("configured=true"));
    }

    @Test
    @DisplayName("An unrecognized environment value is reported once, not on every evaluation")
    void testUnrecognizedEnvironmentValueWarnsOnce() {
        Logger logger = (Logger) LoggerFactory.getLogger(FeatureGate.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            env.put(FeatureGate.OVERRIDE_ENV, "perhaps");
            FeatureGate gate = gate(true);
            for (int i = 0; i < 100; i++) {
                assertTrue(gate.isEnabled());
            }
            env.put(FeatureGate.OVERRIDE_ENV, "nope");
            for (int i = 0; i < 100; i++) {
                assertTrue(gate.isEnabled());
            }

            long warnings = appender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .count();
            assertEquals(2, warnings);
        } finally {
            logger.detachAppender(appender);
        }
    }
}
