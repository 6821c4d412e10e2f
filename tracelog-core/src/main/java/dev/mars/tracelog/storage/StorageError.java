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

import java.time.Instant;

/**
 * Structured description of the most recent storage failure, reported by health checks.
 *
 * @param operation what was being done (append, rotate, compact, open, export)
 * @param type      simple name of the exception raised
 * @param message   failure detail
 * @param timestamp when the failure happened
 */
public record StorageError(String operation, String type, String message, Instant timestamp) {

    static StorageError of(String operation, Throwable failure, Instant timestamp) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = failure.getMessage();
        if (root != failure && root.getMessage() != null) {
            message = message + ": " + root.getMessage();
        }
        return new StorageError(operation, root.getClass().getSimpleName(), message, timestamp);
    }
}
