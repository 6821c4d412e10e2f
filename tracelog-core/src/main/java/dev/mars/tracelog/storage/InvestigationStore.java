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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.tracelog.export.ExportFormat;
import dev.mars.tracelog.gate.FeatureGate;
import dev.mars.tracelog.model.InvestigationRecord;

import java.io.Closeable;
import java.io.OutputStream;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only, retention-bounded, tenant-aware store for investigation records.
 * <p>
 * Writes are serialized through a single writer and complete asynchronously; reads
 * work on a consistent in-memory snapshot and never wait for a write in progress.
 * <p>
 * <b>Feature gate:</b> while {@link FeatureGate#isEnabled()} is false, appends
 * succeed without touching storage and reads return empty results.
 *
 * @see FileInvestigationStore
 */
public interface InvestigationStore extends Closeable {

    /**
     * Opens the store: acquires the directory lock, completes any interrupted
     * rotation and replays the active segment. Idempotent.
     *
     * @return a Future that completes when the store is ready
     */
    CompletableFuture<Void> open();

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Validates and appends a record, assigning {@code id} and {@code created_at}
     * when absent and stamping the current schema version.
     * <p>
     * Count eviction, retention cleanup and rotation happen as part of the append.
     * Either the full line is written or nothing is.
     *
     * @return a Future with the record id; fails with
     *         {@link dev.mars.tracelog.model.ValidationException} or {@link StorageWriteException}
     */
    CompletableFuture<String> append(InvestigationRecord record);

    /**
     * Validates a raw JSON payload and appends it.
     *
     * @see #append(InvestigationRecord)
     */
    CompletableFuture<String> append(JsonNode raw);

    /**
     * Rewrites the active segment with live records only.
     *
     * @return a Future with the number of dead lines removed
     */
    CompletableFuture<Integer> compact();

    /**
     * Explicit migration pass: rewrites the active segment with every live record
     * stamped at the current schema version.
     *
     * @return a Future with the number of records upgraded
     */
    CompletableFuture<Integer> migrateSchema();

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * Returns one newest-first page of matching records.
     *
     * @param filter filter; must name a tenant unless administrative (when scoping is required)
     * @param limit  maximum number of records, at least 1
     * @param cursor token from a previous page, or null for the first page
     * @throws MissingTenantScopeException if the filter lacks required tenant scope
     */
    QueryPage query(InvestigationFilter filter, int limit, String cursor);

    /**
     * Looks up one live record by id within the filter's scope.
     */
    Optional<InvestigationRecord> get(InvestigationFilter scope, String id);

    /**
     * Streams every matching record, newest first, to {@code out}.
     *
     * @return number of records written
     * @throws MissingTenantScopeException if the filter lacks required tenant scope
     * @throws StorageReadException        if writing the stream fails
     */
    long export(InvestigationFilter filter, ExportFormat format, OutputStream out);

    /**
     * Parses {@code format} and streams the export.
     *
     * @throws dev.mars.tracelog.export.UnsupportedFormatException for formats other than json or csv
     */
    default long export(InvestigationFilter filter, String format, OutputStream out) {
        return export(filter, ExportFormat.parse(format), out);
    }

    // ========================================================================
    // State
    // ========================================================================

    /** In-memory counters; never performs I/O. */
    StoreState state();

    InvestigationStoreConfig config();

    FeatureGate gate();

    /**
     * Flushes and closes the store, releasing the directory lock.
     */
    @Override
    void close();
}
