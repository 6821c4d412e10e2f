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

import dev.mars.tracelog.export.ExportFormat;
import dev.mars.tracelog.export.RecordExporter;
import dev.mars.tracelog.health.HealthReporter;
import dev.mars.tracelog.health.HealthSnapshot;
import dev.mars.tracelog.model.Evidence;
import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.SchemaRegistry;
import dev.mars.tracelog.model.ValidationException;
import dev.mars.tracelog.storage.InvestigationFilter;
import dev.mars.tracelog.storage.InvestigationStore;
import dev.mars.tracelog.storage.MissingTenantScopeException;
import dev.mars.tracelog.storage.QueryPage;
import dev.mars.tracelog.storage.StorageReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Endpoint-facing wrapper over an {@link InvestigationStore}.
 * <p>
 * Translates request parameters into store filters and rejects requests that are
 * missing tenant scope or name an unknown export format before the store is
 * consulted. While the feature gate is closed every read answers empty and
 * neither check applies.
 */
public final class InvestigationQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(InvestigationQueryService.class);

    private final InvestigationStore store;
    private final HealthReporter healthReporter;

    public InvestigationQueryService(InvestigationStore store) {
        this.store = Objects.requireNonNull(store, "store");
        this.healthReporter = new HealthReporter(store);
    }

    /**
     * One newest-first page for the request.
     *
     * @throws MissingTenantScopeException for a tenant caller without {@code tenant_id}
     * @throws ValidationException         for a malformed cursor
     */
    public QueryPage query(CallerScope scope, QueryRequest request) {
        if (!store.gate().isEnabled()) {
            return QueryPage.empty();
        }
        InvestigationFilter filter = scopedFilter(scope, request, "query");
        int limit = request.effectiveLimit(store.config().maxEntries());
        return store.query(filter, limit, request.cursor());
    }

    /**
     * Streams every matching record to {@code out} in the requested format.
     *
     * @return number of records written
     * @throws dev.mars.tracelog.export.UnsupportedFormatException for formats other than json or csv
     * @throws MissingTenantScopeException for a tenant caller without {@code tenant_id}
     */
    public long export(CallerScope scope, QueryRequest request, OutputStream out) {
        if (!store.gate().isEnabled()) {
            // Empty document; an unknown format falls back to json
            ExportFormat format = ExportFormat.find(request.format()).orElse(ExportFormat.JSON);
            return writeEmpty(format, out);
        }
        ExportFormat format = ExportFormat.parse(request.format());
        InvestigationFilter filter = scopedFilter(scope, request, "export");
        return store.export(filter, format, out);
    }

    /**
     * Looks up one investigation visible to the caller.
     */
    public Optional<InvestigationRecord> lookup(CallerScope scope, String tenantId, String investigationId) {
        if (!store.gate().isEnabled()) {
            return Optional.empty();
        }
        InvestigationFilter filter = scopedFilter(scope, QueryRequest.forTenant(tenantId), "lookup");
        return store.get(filter, investigationId);
    }

    /**
     * Confirms that an investigation and each cited evidence entry exist, so a
     * doc issue can reference them.
     *
     * @throws ValidationException naming the investigation or every evidence id that did not resolve
     */
    public DocIssueReference resolveDocIssue(CallerScope scope, String tenantId,
                                             String investigationId, List<String> evidenceIds) {
        if (investigationId == null || investigationId.isBlank()) {
            throw new ValidationException("investigation id is required");
        }
        InvestigationRecord investigation = lookup(scope, tenantId, investigationId)
                .orElseThrow(() -> new ValidationException("investigation " + investigationId + " not found"));

        List<Evidence> resolved = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String evidenceId : evidenceIds) {
            Optional<Evidence> entry = investigation.findEvidence(evidenceId);
            if (entry.isPresent()) {
                resolved.add(entry.get());
            } else {
                missing.add("evidence " + evidenceId + " not found on investigation " + investigationId);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException(missing);
        }
        LOG.debug("Resolved doc issue reference {} with {} evidence entries", investigationId, resolved.size());
        return new DocIssueReference(investigation, resolved);
    }

    public HealthSnapshot health() {
        return healthReporter.snapshot();
    }

    private static long writeEmpty(ExportFormat format, OutputStream out) {
        try {
            return RecordExporter.forFormat(format, SchemaRegistry.standard())
                    .write(Collections.emptyIterator(), out);
        } catch (IOException e) {
            throw new StorageReadException("Export as " + format.wireName() + " failed", e);
        }
    }

    private InvestigationFilter scopedFilter(CallerScope scope, QueryRequest request, String operation) {
        InvestigationFilter filter = request.toFilter(scope);
        if (store.config().tenantScopingRequired() && filter.missingTenantScope()) {
            LOG.debug("Rejected {} without tenant scope", operation);
            throw new MissingTenantScopeException(operation);
        }
        return filter;
    }
}
