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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level field mapping shared by every schema version. Subclasses only differ
 * in how evidence entries are laid out.
 */
abstract class AbstractRecordCodec implements RecordCodec {

    static final String F_SCHEMA_VERSION = "schema_version";
    static final String F_ID = "id";
    static final String F_TENANT_ID = "tenant_id";
    static final String F_TYPE = "type";
    static final String F_COMPONENT_ID = "component_id";
    static final String F_PROJECT_ID = "project_id";
    static final String F_CREATED_AT = "created_at";
    static final String F_STATUS = "status";
    static final String F_SUMMARY = "summary";
    static final String F_QUESTION = "question";
    static final String F_ANSWER = "answer";
    static final String F_SEVERITY = "severity";
    static final String F_SOURCE_COMMAND = "source_command";
    static final String F_RAW_TRACE_ID = "raw_trace_id";
    static final String F_EVIDENCE = "evidence";
    static final String F_EVIDENCE_ID = "evidence_id";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            F_SCHEMA_VERSION, F_ID, F_TENANT_ID, F_TYPE, F_COMPONENT_ID, F_PROJECT_ID,
            F_CREATED_AT, F_STATUS, F_SUMMARY, F_QUESTION, F_ANSWER, F_SEVERITY,
            F_SOURCE_COMMAND, F_RAW_TRACE_ID, F_EVIDENCE);

    private final int version;

    AbstractRecordCodec(int version) {
        this.version = version;
    }

    @Override
    public int version() {
        return version;
    }

    @Override
    public InvestigationRecord decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("record must be a JSON object");
        }
        List<String> violations = new ArrayList<>();

        InvestigationRecord.Builder builder = InvestigationRecord.builder()
                .schemaVersion(version)
                .id(text(node, F_ID, violations))
                .tenantId(text(node, F_TENANT_ID, violations))
                .type(RecordType.fromWire(text(node, F_TYPE, violations)))
                .componentId(text(node, F_COMPONENT_ID, violations))
                .projectId(text(node, F_PROJECT_ID, violations))
                .createdAt(instant(node, violations))
                .status(text(node, F_STATUS, violations))
                .summary(text(node, F_SUMMARY, violations))
                .question(text(node, F_QUESTION, violations))
                .answer(text(node, F_ANSWER, violations))
                .severity(text(node, F_SEVERITY, violations))
                .sourceCommand(text(node, F_SOURCE_COMMAND, violations))
                .rawTraceId(text(node, F_RAW_TRACE_ID, violations));

        JsonNode evidenceNode = node.get(F_EVIDENCE);
        if (evidenceNode != null && !evidenceNode.isNull()) {
            if (!evidenceNode.isArray()) {
                violations.add("evidence must be an array");
            } else {
                for (int i = 0; i < evidenceNode.size(); i++) {
                    JsonNode entry = evidenceNode.get(i);
                    if (!entry.isObject()) {
                        violations.add("evidence[" + i + "] must be an object");
                        continue;
                    }
                    Evidence decoded = decodeEvidence((ObjectNode) entry, i, violations);
                    if (decoded != null) {
                        builder.addEvidence(decoded);
                    }
                }
            }
        }

        ObjectNode attributes = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                attributes.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        builder.attributes(attributes);

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return builder.build();
    }

    @Override
    public ObjectNode encode(InvestigationRecord record) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(F_SCHEMA_VERSION, version);
        putIfPresent(node, F_ID, record.id());
        putIfPresent(node, F_TENANT_ID, record.tenantId());
        node.put(F_TYPE, record.type().wireName());
        putIfPresent(node, F_COMPONENT_ID, record.componentId());
        putIfPresent(node, F_PROJECT_ID, record.projectId());
        if (record.createdAt() != null) {
            node.put(F_CREATED_AT, record.createdAt().toString());
        }
        node.put(F_STATUS, record.status());
        putIfPresent(node, F_SUMMARY, record.summary());
        putIfPresent(node, F_QUESTION, record.question());
        putIfPresent(node, F_ANSWER, record.answer());
        putIfPresent(node, F_SEVERITY, record.severity());
        putIfPresent(node, F_SOURCE_COMMAND, record.sourceCommand());
        putIfPresent(node, F_RAW_TRACE_ID, record.rawTraceId());

        ArrayNode evidence = node.putArray(F_EVIDENCE);
        for (Evidence entry : record.evidence()) {
            evidence.add(encodeEvidence(entry));
        }

        Iterator<Map.Entry<String, JsonNode>> extra = record.attributes().fields();
        while (extra.hasNext()) {
            Map.Entry<String, JsonNode> field = extra.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                node.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return node;
    }

    /**
     * Decodes one evidence entry, adding to {@code violations} and returning null when invalid.
     */
    abstract Evidence decodeEvidence(ObjectNode entry, int position, List<String> violations);

    abstract ObjectNode encodeEvidence(Evidence evidence);

    static String defaultEvidenceId(int position) {
        return "ev-" + (position + 1);
    }

    static String text(JsonNode node, String field, List<String> violations) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isContainerNode()) {
            violations.add(field + " must be a scalar value");
            return null;
        }
        return value.asText();
    }

    private static Instant instant(JsonNode node, List<String> violations) {
        String value = text(node, F_CREATED_AT, violations);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException notUtc) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException e) {
                violations.add("created_at is not an ISO-8601 timestamp: " + value);
                return null;
            }
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
