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

import java.nio.file.Path;
import java.time.Instant;

/**
 * Point-in-time view of the store's in-memory counters. Producing it never touches
 * the log file.
 *
 * @param open             whether the store is open for writes
 * @param path             active segment location
 * @param entryCount       live records, excluding any past retention
 * @param byteSize         size of the active segment
 * @param lastWriteAt      time of the last successful append, null if none
 * @param lastError        most recent storage failure, null if none
 * @param archivedSegments number of rotated segments beside the active one
 */
public record StoreState(
        boolean open,
        Path path,
        int entryCount,
        long byteSize,
        Instant lastWriteAt,
        StorageError lastError,
        int archivedSegments
) {
}
