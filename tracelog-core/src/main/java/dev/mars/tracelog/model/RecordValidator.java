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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns collaborator-supplied payloads into records the store accepts.
 * <p>
 * Only structural rules are checked: a tenant, a known schema version, and
 * well-formed evidence entries with unique ids. Status values and evidence payloads
 * belong to the collaborator and are not interpreted. This class has no side effects.
 */
public final class RecordValidator {

    /** Maximum length of a summary derived from question/goal/answer. */
    public static final int SUMMARY_MAX_LENGTH = 240;

    private static final String GOAL_ATTRIBUTE = "goal";

    private final SchemaRegistry registry;
    private final String defaultTenantId;

    /**
     * @param registry        known schema versions
     * @param defaultTenantId tenant stamped on records that carry none, or null to
     *                        reject such records
     */
    public RecordValidator(SchemaRegistry registry, String defaultTenantId) {
        this.registry = registry;
        this.defaultTenantId = defaultTenantId == null || defaultTenantId.isBlank() ? null : defaultTenantId;
    }

    /**
     * Validates a raw JSON payload.
     *
     * @throws ValidationException listing every violation found
     */
    public InvestigationRecord validate(JsonNode raw) {
        return validate(registry.decode(raw));
    }

    /**
     * Validates and normalizes an already-typed record.
     *
     * @throws ValidationException listing every violation found
     */
    public InvestigationRecord validate(InvestigationRecord record) {
        if (record == null) {
            throw new ValidationException("record is required");
        }
        List<String> violations = new ArrayList<>();

        String tenantId = record.tenantId() == null ? null : record.tenantId().trim();
        if (tenantId == null || tenantId.isEmpty()) {
            if (defaultTenantId == null) {
                violations.add("tenant_id is required");
            } else {
                tenantId = defaultTenantId;
            }
        }

        if (!registry.isSupported(record.schemaVersion())) {
            violations.add("unsupported schema_version " + record.schemaVersion()
                    + " (supported: " + registry.supportedVersions() + ")");
        }

        if (record.id() != null && record.id().isBlank()) {
            violations.add("id must not be blank when supplied");
        }

        Set<String> evidenceIds = new HashSet<>();
        for (int i = 0; i < record.evidence().size(); i++) {
            Evidence entry = record.evidence().get(i);
            if (entry.kind().isBlank()) {
                violations.add("evidence[" + i + "].kind is required");
            }
            if (entry.evidenceId().isBlank()) {
                violations.add("evidence[" + i + "].evidence_id must not be blank");
            } else if (!evidenceIds.add(entry.evidenceId())) {
                violations.add("duplicate evidence_id " + entry.evidenceId());
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        InvestigationRecord.Builder normalized = record.toBuilder().tenantId(tenantId);
        if (record.summary() == null || record.summary().isBlank()) {
            normalized.summary(deriveSummary(record));
        }
        return normalized.build();
    }

    private static String deriveSummary(InvestigationRecord record) {
        JsonNode goal = record.attributes().get(GOAL_ATTRIBUTE);
        String goalText = goal != null && goal.isTextual() ? goal.asText() : null;
        for (String candidate : new String[]{record.question(), goalText, record.answer()}) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.length() > SUMMARY_MAX_LENGTH
                        ? candidate.substring(0, SUMMARY_MAX_LENGTH)
                        : candidate;
            }
        }
        return record.summary();
    }
}
