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

import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.RecordType;

import java.time.Instant;

/**
 * Read filter. Every non-null field must match; the time range is inclusive of
 * {@code from} and exclusive of {@code to}.
 *
 * @param tenantId       owning tenant, null only for administrative reads
 * @param componentId    component classification
 * @param projectId      project classification
 * @param status         collaborator status value
 * @param type           record type
 * @param from           earliest {@code created_at}, inclusive
 * @param to             latest {@code created_at}, exclusive
 * @param administrative whether the caller may read across tenants
 */
public record InvestigationFilter(
        String tenantId,
        String componentId,
        String projectId,
        String status,
        RecordType type,
        Instant from,
        Instant to,
        boolean administrative
) {

    public InvestigationFilter {
        tenantId = blankToNull(tenantId);
        componentId = blankToNull(componentId);
        projectId = blankToNull(projectId);
        status = blankToNull(status);
    }

    /** Filter scoped to one tenant. */
    public static InvestigationFilter forTenant(String tenantId) {
        return new InvestigationFilter(tenantId, null, null, null, null, null, null, false);
    }

    /** Unscoped filter for administrative callers. */
    public static InvestigationFilter adminScope() {
        return new InvestigationFilter(null, null, null, null, null, null, null, true);
    }

    public InvestigationFilter withComponent(String value) {
        return new InvestigationFilter(tenantId, value, projectId, status, type, from, to, administrative);
    }

    public InvestigationFilter withProject(String value) {
        return new InvestigationFilter(tenantId, componentId, value, status, type, from, to, administrative);
    }

    public InvestigationFilter withStatus(String value) {
        return new InvestigationFilter(tenantId, componentId, projectId, value, type, from, to, administrative);
    }

    public InvestigationFilter withType(RecordType value) {
        return new InvestigationFilter(tenantId, componentId, projectId, status, value, from, to, administrative);
    }

    public InvestigationFilter between(Instant fromInclusive, Instant toExclusive) {
        return new InvestigationFilter(tenantId, componentId, projectId, status, type,
                fromInclusive, toExclusive, administrative);
    }

    /** True when the read carries no tenant and is not administrative. */
    public boolean missingTenantScope() {
        return tenantId == null && !administrative;
    }

    /** Field match, not including retention. */
    public boolean matches(InvestigationRecord record) {
        if (tenantId != null && !tenantId.equals(record.tenantId())) {
            return false;
        }
        if (componentId != null && !componentId.equals(record.componentId())) {
            return false;
        }
        if (projectId != null && !projectId.equals(record.projectId())) {
            return false;
        }
        if (status != null && !status.equalsIgnoreCase(record.status())) {
            return false;
        }
        if (type != null && type != record.type()) {
            return false;
        }
        Instant createdAt = record.createdAt();
        if (from != null && createdAt.isBefore(from)) {
            return false;
        }
        return to == null || createdAt.isBefore(to);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
