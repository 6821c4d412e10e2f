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
package dev.mars.tracelog.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.mars.tracelog.export.UnsupportedFormatException;
import dev.mars.tracelog.model.Evidence;
import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.JsonMappers;
import dev.mars.tracelog.model.SchemaRegistry;
import dev.mars.tracelog.model.ValidationException;
import dev.mars.tracelog.storage.FileInvestigationStore;
import dev.mars.tracelog.storage.InvestigationFilter;
import dev.mars.tracelog.storage.InvestigationStoreConfig;
import dev.mars.tracelog.storage.MissingTenantScopeException;
import dev.mars.tracelog.storage.MutableClock;
import dev.mars.tracelog.storage.QueryPage;
import dev.mars.tracelog.storage.StoreFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static dev.mars.tracelog.storage.StoreFixtures.START;
import static dev.mars.tracelog.storage.StoreFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InvestigationQueryService}.
 */
class InvestigationQueryServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = JsonMappers.shared();
    private MutableClock clock;
    private FileInvestigationStore store;
    private InvestigationQueryService service;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(START);
        openStore(StoreFixtures.config(tempDir).build());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private void openStore(InvestigationStoreConfig config) throws Exception {
        if (store != null) {
            store.close();
        }
        store = StoreFixtures.store(config, clock);
        store.open().get(5, TimeUnit.SECONDS);
        service = new InvestigationQueryService(store);
    }

    private String append(InvestigationRecord record) throws Exception {
        String id = store.append(record).get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(1));
        return id;
    }

    private static List<String> ids(QueryPage page) {
        List<String> ids = new ArrayList<>();
        for (InvestigationRecord record : page.records()) {
            ids.add(record.id());
        }
        return ids;
    }

    // ========================================================================
    // Tenant scope
    // ========================================================================

    @Nested
    @DisplayName("Tenant scope")
    class TenantScope {

        @Test
        @DisplayName("Tenant caller without tenant_id is rejected for query, export and lookup")
        void testMissingTenant() throws Exception {
            append(record("t1", "q"));
            QueryRequest unscoped = QueryRequest.fromParameters(Map.of());

            assertThrows(MissingTenantScopeException.class, () -> service.query(CallerScope.TENANT, unscoped));
            assertThrows(MissingTenantScopeException.class,
                    () -> service.export(CallerScope.TENANT, unscoped, new ByteArrayOutputStream()));
            assertThrows(MissingTenantScopeException.class,
                    () -> service.lookup(CallerScope.TENANT, null, "any"));
        }

        @Test
        @DisplayName("Tenant caller sees only its own tenant")
        void testIsolation() throws Exception {
            String a = append(record("t1", "a"));
            String b = append(record("t2", "b"));

            QueryPage page = service.query(CallerScope.TENANT, QueryRequest.forTenant("t1"));

            assertEquals(List.of(a), ids(page));
            assertTrue(service.lookup(CallerScope.TENANT, "t1", b).isEmpty());
            assertTrue(service.lookup(CallerScope.TENANT, "t2", b).isPresent());
        }

        @Test
        @DisplayName("Administrative caller spans tenants and may narrow to one")
        void testAdministrative() throws Exception {
            String a = append(record("t1", "a"));
            String b = append(record("t2", "b"));

            assertEquals(List.of(b, a),
                    ids(service.query(CallerScope.ADMINISTRATIVE, QueryRequest.fromParameters(Map.of()))));
            assertEquals(List.of(b),
                    ids(service.query(CallerScope.ADMINISTRATIVE, QueryRequest.forTenant("t2"))));
            assertTrue(service.lookup(CallerScope.ADMINISTRATIVE, null, a).isPresent());
        }

        @Test
        @DisplayName("Scope is optional when tenant scoping is not required")
        void testScopingDisabled() throws Exception {
            openStore(StoreFixtures.config(tempDir).tenantScopingRequired(false).build());
            String a = append(record("t1", "a"));
            String b = append(record("t2", "b"));

            assertEquals(List.of(b, a),
                    ids(service.query(CallerScope.TENANT, QueryRequest.fromParameters(Map.of()))));
        }
    }

    // ========================================================================
    // Paging
    // ========================================================================

    @Nested
    @DisplayName("Paging")
    class Paging {

        @Test
        @DisplayName("Default page size is 25")
        void testDefaultLimit() throws Exception {
            for (int i = 0; i < 30; i++) {
                append(record("t1", "q" + i));
            }

            QueryPage page = service.query(CallerScope.TENANT, QueryRequest.forTenant("t1"));

            assertEquals(QueryRequest.DEFAULT_LIMIT, page.records().size());
            assertTrue(page.hasMore());
        }

        @Test
        @DisplayName("Limit is clamped to [1, maxEntries]")
        void testLimitClamped() throws Exception {
            openStore(StoreFixtures.config(tempDir).maxEntries(5).build());
            for (int i = 0; i < 5; i++) {
                append(record("t1", "q" + i));
            }
            QueryRequest request = QueryRequest.forTenant("t1");

            assertEquals(5, service.query(CallerScope.TENANT, request.withLimit(1000)).records().size());
            assertEquals(1, service.query(CallerScope.TENANT, request.withLimit(0)).records().size());
            assertEquals(1, service.query(CallerScope.TENANT, request.withLimit(-3)).records().size());
        }

        @Test
        @DisplayName("Following cursors visits every record once")
        void testCursorWalk() throws Exception {
            List<String> appended = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                appended.add(0, append(record("t1", "q" + i)));
            }

            List<String> seen = new ArrayList<>();
            QueryRequest request = QueryRequest.forTenant("t1").withLimit(3);
            QueryPage page = service.query(CallerScope.TENANT, request);
            seen.addAll(ids(page));
            while (page.hasMore()) {
                page = service.query(CallerScope.TENANT, request.withCursor(page.nextCursor()));
                seen.addAll(ids(page));
            }

            assertEquals(appended, seen);
        }

        @Test
        @DisplayName("Malformed cursor is a validation error")
        void testBadCursor() {
            QueryRequest request = QueryRequest.forTenant("t1").withCursor("not-a-cursor");

            assertThrows(ValidationException.class, () -> service.query(CallerScope.TENANT, request));
        }
    }

    // ========================================================================
    // Export
    // ========================================================================

    @Nested
    @DisplayName("Export")
    class Export {

        @Test
        @DisplayName("Unsupported format fails before the store is touched")
        void testUnsupportedFormat() throws Exception {
            append(record("t1", "q"));
            int before = store.state().entryCount();
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                    () -> service.export(CallerScope.TENANT, QueryRequest.forTenant("t1").withFormat("xml"), out));

            assertEquals("xml", ex.requested());
            assertEquals(0, out.size());
            assertEquals(before, store.state().entryCount());
            assertNull(store.state().lastError());
        }

        @Test
        @DisplayName("JSON export decodes to the stored records field for field")
        void testJsonExport() throws Exception {
            List<InvestigationRecord> stored = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                InvestigationRecord record = InvestigationRecord.builder()
                        .tenantId("t1")
                        .componentId("billing")
                        .question("q" + i)
                        .answer("a" + i)
                        .addEvidence(new Evidence("e" + i, "log", mapper.createObjectNode().put("line", i)))
                        .build();
                String id = append(record);
                stored.add(0, store.get(InvestigationFilter.forTenant("t1"), id).orElseThrow());
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            long written = service.export(CallerScope.TENANT, QueryRequest.forTenant("t1"), out);

            assertEquals(4, written);
            JsonNode array = mapper.readTree(out.toByteArray());
            assertTrue(array.isArray());
            SchemaRegistry registry = SchemaRegistry.standard();
            List<InvestigationRecord> exported = new ArrayList<>();
            for (JsonNode node : array) {
                exported.add(registry.decode(node));
            }
            assertEquals(stored, exported);
        }

        @Test
        @DisplayName("CSV export has a header and one row per matching record")
        void testCsvExport() throws Exception {
            String a = append(record("t1", "q").toBuilder().summary("first, with comma").build());
            append(record("t2", "other tenant"));
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            long written = service.export(CallerScope.TENANT, QueryRequest.forTenant("t1").withFormat("csv"), out);

            assertEquals(1, written);
            CsvMapper csv = new CsvMapper();
            List<Map<String, String>> rows = new ArrayList<>();
            try (MappingIterator<Map<String, String>> it = csv.readerForMapOf(String.class)
                    .with(CsvSchema.emptySchema().withHeader())
                    .readValues(out.toByteArray())) {
                while (it.hasNext()) {
                    rows.add(it.next());
                }
            }
            assertEquals(1, rows.size());
            assertEquals(a, rows.get(0).get("id"));
            assertEquals("t1", rows.get(0).get("tenant_id"));
            assertEquals("first, with comma", rows.get(0).get("summary"));
        }

        @Test
        @DisplayName("Filters apply to export")
        void testExportFiltered() throws Exception {
            append(record("t1", "billing"));
            String other = append(record("t1", "ledger").toBuilder().componentId("ledger").build());
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            service.export(CallerScope.TENANT, QueryRequest.forTenant("t1").withComponent("ledger"), out);

            JsonNode array = mapper.readTree(out.toByteArray());
            assertEquals(1, array.size());
            assertEquals(other, array.get(0).get("id").asText());
        }
    }

    // ========================================================================
    // Doc issue references
    // ========================================================================

    @Nested
    @DisplayName("Doc issue references")
    class DocIssues {

        private String investigationWithEvidence() throws Exception {
            return append(record("t1", "why did billing fail").toBuilder()
                    .addEvidence(new Evidence("ev-1", "log", mapper.createObjectNode().put("line", 1)))
                    .addEvidence(new Evidence("ev-2", "slack", mapper.createObjectNode().put("text", "see logs")))
                    .build());
        }

        @Test
        @DisplayName("Resolves the investigation and each cited evidence entry")
        void testResolve() throws Exception {
            String id = investigationWithEvidence();

            DocIssueReference ref = service.resolveDocIssue(CallerScope.TENANT, "t1", id, List.of("ev-2", "ev-1"));

            assertEquals(id, ref.investigationId());
            assertEquals(List.of("ev-2", "ev-1"), ref.evidenceIds());
        }

        @Test
        @DisplayName("Every missing evidence id is reported")
        void testMissingEvidence() throws Exception {
            String id = investigationWithEvidence();

            ValidationException ex = assertThrows(ValidationException.class,
                    () -> service.resolveDocIssue(CallerScope.TENANT, "t1", id, List.of("ev-1", "ev-8", "ev-9")));

            assertEquals(2, ex.violations().size());
            assertTrue(ex.violations().get(0).contains("ev-8"));
            assertTrue(ex.violations().get(1).contains("ev-9"));
        }

        @Test
        @DisplayName("Investigation from another tenant does not resolve")
        void testOtherTenant() throws Exception {
            String id = investigationWithEvidence();

            assertThrows(ValidationException.class,
                    () -> service.resolveDocIssue(CallerScope.TENANT, "t2", id, List.of()));
            assertThrows(ValidationException.class,
                    () -> service.resolveDocIssue(CallerScope.TENANT, "t1", " ", List.of()));
        }
    }

    // ========================================================================
    // Feature gate
    // ========================================================================

    @Test
    @DisplayName("Disabled gate yields empty pages and exports")
    void testGateDisabled() throws Exception {
        append(record("t1", "q"));
        store.gate().override(false);

        assertTrue(service.query(CallerScope.TENANT, QueryRequest.forTenant("t1")).records().isEmpty());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(0, service.export(CallerScope.TENANT, QueryRequest.forTenant("t1"), out));
        assertEquals(0, mapper.readTree(out.toByteArray()).size());
        assertFalse(service.health().enabled());

        store.gate().clearOverride();
        assertEquals(1, service.query(CallerScope.TENANT, QueryRequest.forTenant("t1")).records().size());
    }

    @Test
    @DisplayName("Disabled gate answers empty before scope and format are checked")
    void testGateDisabled_BeforeScopeAndFormat() throws Exception {
        append(record("t1", "q"));
        store.gate().override(false);
        QueryRequest unscoped = QueryRequest.fromParameters(Map.of());

        assertTrue(service.query(CallerScope.TENANT, unscoped).records().isEmpty());
        assertTrue(service.lookup(CallerScope.TENANT, null, "any").isEmpty());

        ByteArrayOutputStream json = new ByteArrayOutputStream();
        assertEquals(0, service.export(CallerScope.TENANT, unscoped.withFormat("xml"), json));
        assertEquals(0, mapper.readTree(json.toByteArray()).size());

        ByteArrayOutputStream csv = new ByteArrayOutputStream();
        assertEquals(0, service.export(CallerScope.TENANT, unscoped.withFormat("csv"), csv));
        assertTrue(csv.toString(StandardCharsets.UTF_8).startsWith("id,tenant_id,"));

        store.gate().clearOverride();
        assertThrows(MissingTenantScopeException.class, () -> service.query(CallerScope.TENANT, unscoped));
        assertThrows(UnsupportedFormatException.class,
                () -> service.export(CallerScope.TENANT, QueryRequest.forTenant("t1").withFormat("xml"), json));
    }
}
