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
package dev.mars.tracelog.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.tracelog.storage.StorageError;

import java.time.Instant;

/**
 * Point-in-time view of the investigation store for process health checks.
 * <p>
 * Serializes with the snake_case field names operators already know from the
 * health endpoint. {@code last_write_at} and {@code last_error} are written as
 * {@code null} when there is nothing to report.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record HealthSnapshot(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("feature_enabled") boolean featureEnabled,
        @JsonProperty("path") String path,
        @JsonProperty("max_entries") int maxEntries,
        @JsonProperty("retention_days") int retentionDays,
        @JsonProperty("max_file_bytes") long maxFileBytes,
        @JsonProperty("schema_version") int schemaVersion,
        @JsonProperty("last_write_at") Instant lastWriteAt,
        @JsonProperty("last_error") StorageError lastError,
        @JsonProperty("entry_count") int entryCount,
        @JsonProperty("byte_size") long byteSize,
        @JsonProperty("archived_segments") int archivedSegments,
        @JsonProperty("tenant_scoping_required") boolean tenantScopingRequired,
        @JsonProperty("override_active") boolean overrideActive) {

    /** True when the store is persisting and its last operation succeeded. */
    public boolean healthy() {
        return enabled && lastError == null;
    }
}
