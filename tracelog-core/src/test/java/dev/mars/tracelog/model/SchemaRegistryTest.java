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
package dev.mars.tracelog.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SchemaRegistry} and the two record codecs.
 */
class SchemaRegistryTest {

    private final ObjectMapper mapper = JsonMappers.shared();
    private final SchemaRegistry registry = SchemaRegistry.standard();

    @Test
    void testSupportedVersions() {
        assertEquals(List.of(1, 2), List.copyOf(registry.supportedVersions()));
        assertEquals(2, SchemaRegistry.CURRENT_VERSION);
        assertEquals(SchemaRegistry.CURRENT_VERSION, registry.current().version());
        assertFalse(registry.isSupported(3));
    }

    @Test
    void testConstructor_RejectsDuplicateAndMissingCurrent() {
        assertThrows(IllegalArgumentException.class,
                () -> new SchemaRegistry(List.of(new CurrentRecordCodec(), new CurrentRecordCodec())));
        assertThrows(IllegalArgumentException.class,
                () -> new SchemaRegistry(List.of(new LegacyRecordCodec())));
    }

    @Test
    void testDecode_MissingVersionUsesCurrent() {
        ObjectNode node = mapper.createObjectNode().put("tenant_id", "t1");

        assertEquals(SchemaRegistry.CURRENT_VERSION, registry.decode(node).schemaVersion());
    }

    @Test
    void testDecode_LegacyEvidenceLayout() throws Exception {
        JsonNode node = mapper.readTree("{\"schema_version\":1,\"tenant_id\":\"t1\",\"evidence\":["
                + "{\"evidence_id\":\"e1\",\"source\":\"slack\",\"title\":\"thread\",\"url\":\"https://x\","
                + "\"metadata\":{\"channel\":\"#ops\"}},"
                + "{\"title\":\"no source\"}]}");

        InvestigationRecord record = registry.decode(node);

        assertEquals(1, record.schemaVersion());
        Evidence first = record.evidence().get(0);
        assertEquals("e1", first.evidenceId());
        assertEquals("slack", first.kind());
        assertEquals("thread", first.payload().get("title").asText());
        assertEquals("#ops", first.payload().get("metadata").get("channel").asText());
        Evidence second = record.evidence().get(1);
        assertEquals("ev-2", second.evidenceId());
        assertEquals("doc", second.kind());
    }

    @Test
    void testEncode_UsesRecordsOwnVersion() {
        InvestigationRecord legacy = InvestigationRecord.builder()
                .tenantId("t1")
                .schemaVersion(1)
                .addEvidence(new Evidence("e1", "git", mapper.createObjectNode().put("sha", "abc")))
                .build();

        ObjectNode encoded = registry.encode(legacy);

        assertEquals(1, encoded.get("schema_version").asInt());
        JsonNode evidence = encoded.get("evidence").get(0);
        assertEquals("git", evidence.get("source").asText());
        assertEquals("abc", evidence.get("sha").asText());
        assertNull(evidence.get("kind"));

        ObjectNode current = registry.encode(legacy.withSchemaVersion(2));
        JsonNode upgraded = current.get("evidence").get(0);
        assertEquals("git", upgraded.get("kind").asText());
        assertEquals("abc", upgraded.get("payload").get("sha").asText());
    }

    @Test
    void testCurrentCodec_RoundTripPreservesEveryField() {
        ObjectNode attributes = mapper.createObjectNode().put("goal", "find it");
        attributes.putObject("extra").put("n", 1);
        InvestigationRecord record = InvestigationRecord.builder()
                .id("inv-1")
                .tenantId("t1")
                .type(RecordType.INCIDENT)
                .componentId("auth")
                .projectId("p1")
                .createdAt(Instant.parse("2026-03-01T09:00:00.123Z"))
                .status("doc-filed")
                .summary("s")
                .question("q")
                .answer("a")
                .severity("high")
                .sourceCommand("/investigate")
                .rawTraceId("trace-9")
                .addEvidence(new Evidence("e1", "slack", mapper.createObjectNode().put("text", "hi")))
                .attributes(attributes)
                .build();

        assertEquals(record, registry.decode(registry.encode(record)));
    }

    @Test
    void testDecode_OffsetTimestampNormalizedToUtc() {
        ObjectNode node = mapper.createObjectNode()
                .put("tenant_id", "t1")
                .put("created_at", "2026-03-01T10:00:00+01:00");

        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), registry.decode(node).createdAt());
    }

    @Test
    void testDecode_BadFieldsCollected() {
        ObjectNode node = mapper.createObjectNode().put("created_at", "yesterday");
        node.putObject("status");
        node.put("evidence", "not-an-array");

        ValidationException ex = assertThrows(ValidationException.class, () -> registry.decode(node));
        assertEquals(3, ex.violations().size());
    }
}
