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

import dev.mars.tracelog.model.RecordType;
import dev.mars.tracelog.model.ValidationException;
import dev.mars.tracelog.storage.InvestigationFilter;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * External query and export parameters, as received from an endpoint.
 *
 * @param tenantId    tenant to read, required for tenant callers
 * @param componentId component filter
 * @param projectId   project filter
 * @param status      status filter
 * @param type        record type filter
 * @param from        earliest {@code created_at}, inclusive
 * @param to          latest {@code created_at}, exclusive
 * @param limit       requested page size, null for the default
 * @param cursor      pagination token from a previous page
 * @param format      export format name, null for json
 */
public record QueryRequest(
        String tenantId,
        String componentId,
        String projectId,
        String status,
        RecordType type,
        Instant from,
        Instant to,
        Integer limit,
        String cursor,
        String format
) {

    public static final int DEFAULT_LIMIT = 25;

    public QueryRequest {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new ValidationException("from must be before to");
        }
    }

    /** Request for one tenant with no further filters. */
    public static QueryRequest forTenant(String tenantId) {
        return new QueryRequest(tenantId, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Parses endpoint parameters. Recognized keys: {@code tenant_id},
     * {@code component_id}, {@code project_id}, {@code status}, {@code type},
     * {@code from}, {@code to}, {@code limit}, {@code cursor}, {@code format}.
     *
     * @throws ValidationException listing every parameter that could not be parsed
     */
    public static QueryRequest fromParameters(Map<String, String> params) {
        List<String> violations = new ArrayList<>();
        RecordType type = parseType(params.get("type"), violations);
        Instant from = parseInstant("from", params.get("from"), violations);
        Instant to = parseInstant("to", params.get("to"), violations);
        Integer limit = parseLimit(params.get("limit"), violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return new QueryRequest(
                params.get("tenant_id"),
                params.get("component_id"),
                params.get("project_id"),
                params.get("status"),
                type,
                from,
                to,
                limit,
                params.get("cursor"),
                params.get("format"));
    }

    public QueryRequest withLimit(Integer value) {
        return new QueryRequest(tenantId, componentId, projectId, status, type, from, to, value, cursor, format);
    }

    public QueryRequest withCursor(String value) {
        return new QueryRequest(tenantId, componentId, projectId, status, type, from, to, limit, value, format);
    }

    public QueryRequest withFormat(String value) {
        return new QueryRequest(tenantId, componentId, projectId, status, type, from, to, limit, cursor, value);
    }

    public QueryRequest withComponent(String value) {
        return new QueryRequest(tenantId, value, projectId, status, type, from, to, limit, cursor, format);
    }

    public QueryRequest withProject(String value) {
        return new QueryRequest(tenantId, componentId, value, status, type, from, to, limit, cursor, format);
    }

    /**
     * Page size clamped to {@code [1, maxEntries]}.
     */
    public int effectiveLimit(int maxEntries) {
        int requested = limit == null ? DEFAULT_LIMIT : limit;
        return Math.max(1, Math.min(requested, maxEntries));
    }

    /**
     * Store filter for this request. Tenant callers are bound to {@link #tenantId()};
     * administrative callers may still narrow to one tenant.
     */
    public InvestigationFilter toFilter(CallerScope scope) {
        return new InvestigationFilter(tenantId, componentId, projectId, status, type, from, to,
                scope.isAdministrative());
    }

    private static RecordType parseType(String value, List<String> violations) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecordType candidate : RecordType.values()) {
            if (candidate.wireName().equals(normalized)) {
                return candidate;
            }
        }
        violations.add("type must be one of investigation, incident (was '" + value + "')");
        return null;
    }

    private static Instant parseInstant(String name, String value, List<String> violations) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value.trim()).toInstant();
            } catch (DateTimeParseException notOffset) {
                violations.add(name + " is not an ISO-8601 timestamp: '" + value + "'");
                return null;
            }
        }
    }

    private static Integer parseLimit(String value, List<String> violations) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            violations.add("limit is not an integer: '" + value + "'");
            return null;
        }
    }
}
