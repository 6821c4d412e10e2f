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
package dev.mars.tracelog.storage;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InvestigationStoreConfig} resolution paths.
 * <p>
 * Tests system properties, default values, and builder validation.
 */
class InvestigationStoreConfigTest {

    private static final String[] PROPERTIES = {
            "tracelog.enabled", "tracelog.investigationsPath", "tracelog.maxEntries",
            "tracelog.retentionDays", "tracelog.maxFileBytes", "tracelog.tenantScopingRequired",
            "tracelog.defaultTenantId", "tracelog.syncEnabled", "tracelog.minFreeSpaceMb",
            "tracelog.maxRecordBytes"
    };

    @TempDir
    Path tempDir;

    @BeforeEach
    @AfterEach
    void clearSystemProperties() {
        for (String property : PROPERTIES) {
            System.clearProperty(property);
        }
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property investigationsPath is respected")
        void testInvestigationsPathSystemProperty() {
            Path custom = tempDir.resolve("custom.jsonl");
            System.setProperty("tracelog.investigationsPath", custom.toString());

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertEquals(custom, config.investigationsPath());
        }

        @Test
        @DisplayName("System property limits are respected")
        void testLimitSystemProperties() {
            System.setProperty("tracelog.maxEntries", "42");
            System.setProperty("tracelog.retentionDays", "7");
            System.setProperty("tracelog.maxFileBytes", "1048576");
            System.setProperty("tracelog.maxRecordBytes", "4096");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertEquals(42, config.maxEntries());
            assertEquals(7, config.retentionDays());
            assertEquals(1_048_576L, config.maxFileBytes());
            assertEquals(4096, config.maxRecordBytes());
        }

        @Test
        @DisplayName("System property enabled=false is respected")
        void testEnabledSystemProperty() {
            System.setProperty("tracelog.enabled", "false");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertFalse(config.enabled());
        }

        @Test
        @DisplayName("Optional tenant scoping exposes the default tenant")
        void testTenantScopingSystemProperties() {
            System.setProperty("tracelog.tenantScopingRequired", "false");
            System.setProperty("tracelog.defaultTenantId", "shared");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertFalse(config.tenantScopingRequired());
            assertEquals("shared", config.defaultTenantId());
        }

        @Test
        @DisplayName("Invalid integer system property falls back to default")
        void testInvalidIntSystemProperty() {
            System.setProperty("tracelog.maxEntries", "lots");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertEquals(500, config.maxEntries());
        }

        @Test
        @DisplayName("Out-of-range system property falls back to default")
        void testOutOfRangeSystemProperty() {
            System.setProperty("tracelog.maxEntries", "0");
            System.setProperty("tracelog.retentionDays", "-3");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertEquals(500, config.maxEntries());
            assertEquals(30, config.retentionDays());
        }

        @Test
        @DisplayName("Integer settings beyond int range fall back to default")
        void testIntOverflowSystemProperty() {
            System.setProperty("tracelog.maxEntries", "3000000000");
            System.setProperty("tracelog.retentionDays", "2147483648");
            System.setProperty("tracelog.minFreeSpaceMb", "9999999999");
            System.setProperty("tracelog.maxRecordBytes", "4294967297");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertEquals(500, config.maxEntries());
            assertEquals(30, config.retentionDays());
            assertEquals(16, config.minFreeSpaceMb());
            assertEquals(1024 * 1024, config.maxRecordBytes());
        }

        @Test
        @DisplayName("Integer settings at int max are accepted")
        void testIntMaxSystemProperty() {
            System.setProperty("tracelog.maxEntries", String.valueOf(Integer.MAX_VALUE));

            assertEquals(Integer.MAX_VALUE, InvestigationStoreConfig.builder().build().maxEntries());
        }

        @Test
        @DisplayName("Store built from an overflowing maxEntries keeps appending")
        void testIntOverflowStoreStillAppends() throws Exception {
            System.setProperty("tracelog.maxEntries", "3000000000");
            InvestigationStoreConfig config = InvestigationStoreConfig.builder()
                    .investigationsPath(tempDir.resolve("investigations.jsonl"))
                    .minFreeSpaceMb(0)
                    .build();

            try (FileInvestigationStore store =
                         StoreFixtures.store(config, new MutableClock(StoreFixtures.START))) {
                store.open().get(5, TimeUnit.SECONDS);
                String id = store.append(StoreFixtures.record("t1", "q")).get(5, TimeUnit.SECONDS);

                assertTrue(store.get(InvestigationFilter.forTenant("t1"), id).isPresent());
                assertNull(store.state().lastError());
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"yes", "ON", "1", "true"})
        @DisplayName("Boolean settings accept the gate's spellings")
        void testLenientBooleanSystemProperty(String value) {
            System.setProperty("tracelog.enabled", "false");
            System.setProperty("tracelog.syncEnabled", "no");
            System.setProperty("tracelog.tenantScopingRequired", value);

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertFalse(config.enabled());
            assertFalse(config.syncEnabled());
            assertTrue(config.tenantScopingRequired());
        }

        @Test
        @DisplayName("Unrecognized boolean setting falls back to default")
        void testInvalidBooleanSystemProperty() {
            System.setProperty("tracelog.tenantScopingRequired", "maybe");
            System.setProperty("tracelog.syncEnabled", "sometimes");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertTrue(config.tenantScopingRequired());
            assertTrue(config.syncEnabled());
        }

        @Test
        @DisplayName("Blank system property falls back to default")
        void testBlankSystemProperty() {
            System.setProperty("tracelog.syncEnabled", "   ");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();
            assertTrue(config.syncEnabled());
        }
    }

    // ========================================================================
    // Programmatic Override Tests
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Override")
    class ProgrammaticOverrideTests {

        @Test
        @DisplayName("Programmatic path overrides system property")
        void testProgrammaticPathOverride() {
            System.setProperty("tracelog.investigationsPath", tempDir.resolve("sys.jsonl").toString());
            Path programmatic = tempDir.resolve("programmatic.jsonl");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder()
                    .investigationsPath(programmatic)
                    .build();

            assertEquals(programmatic, config.investigationsPath());
        }

        @Test
        @DisplayName("Programmatic maxEntries overrides system property")
        void testProgrammaticMaxEntriesOverride() {
            System.setProperty("tracelog.maxEntries", "10");

            InvestigationStoreConfig config = InvestigationStoreConfig.builder()
                    .maxEntries(3)
                    .build();

            assertEquals(3, config.maxEntries());
        }

        @Test
        @DisplayName("String path overload works correctly")
        void testPathStringOverload() {
            String path = tempDir.resolve("string.jsonl").toString();

            InvestigationStoreConfig config = InvestigationStoreConfig.builder()
                    .investigationsPath(path)
                    .build();

            assertEquals(Path.of(path), config.investigationsPath());
        }

        @Test
        @DisplayName("Required tenant scoping has no default tenant")
        void testScopingRequiredHidesDefaultTenant() {
            InvestigationStoreConfig config = InvestigationStoreConfig.builder()
                    .tenantScopingRequired(true)
                    .defaultTenantId("shared")
                    .build();

            assertNull(config.defaultTenantId());
        }
    }

    // ========================================================================
    // Default Value Tests
    // ========================================================================

    @Nested
    @DisplayName("Default Values")
    class DefaultValueTests {

        @Test
        @DisplayName("Default config values are correct")
        void testDefaultValues() {
            InvestigationStoreConfig config = InvestigationStoreConfig.builder().build();

            assertTrue(config.enabled());
            assertEquals(Path.of("data", "live", "investigations.jsonl"), config.investigationsPath());
            assertEquals(500, config.maxEntries());
            assertEquals(30, config.retentionDays());
            assertEquals(5L * 1024 * 1024, config.maxFileBytes());
            assertTrue(config.tenantScopingRequired());
            assertTrue(config.syncEnabled());
            assertEquals(16, config.minFreeSpaceMb());
            assertEquals(16L * 1024 * 1024, config.minFreeSpaceBytes());
            assertEquals(1024 * 1024, config.maxRecordBytes());
        }

        @Test
        @DisplayName("toString names every setting")
        void testToString() {
            String text = InvestigationStoreConfig.builder().maxEntries(7).build().toString();

            assertTrue(text.contains("maxEntries=7"));
            assertTrue(text.contains("retentionDays="));
            assertTrue(text.contains("investigationsPath="));
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Builder Validation")
    class ValidationTests {

        @Test
        @DisplayName("Out-of-range builder values are rejected")
        void testRejectsInvalidValues() {
            InvestigationStoreConfig.Builder builder = InvestigationStoreConfig.builder();

            assertThrows(IllegalArgumentException.class, () -> builder.maxEntries(0));
            assertThrows(IllegalArgumentException.class, () -> builder.retentionDays(-1));
            assertThrows(IllegalArgumentException.class, () -> builder.maxFileBytes(0));
            assertThrows(IllegalArgumentException.class, () -> builder.maxRecordBytes(0));
            assertThrows(IllegalArgumentException.class, () -> builder.minFreeSpaceMb(-1));
            assertThrows(IllegalArgumentException.class, () -> builder.defaultTenantId(" "));
        }

        @Test
        @DisplayName("Zero retention and zero disk check are allowed")
        void testZeroValues() {
            InvestigationStoreConfig config = InvestigationStoreConfig.builder()
                    .retentionDays(0)
                    .minFreeSpaceMb(0)
                    .build();

            assertEquals(0, config.retentionDays());
            assertEquals(0, config.minFreeSpaceBytes());
        }
    }
}
