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

import dev.mars.tracelog.TracelogException;

import java.util.List;

/**
 * A submitted record (or request parameter) is malformed or incomplete.
 * <p>
 * Rejected records are never persisted. {@link #violations()} lists every problem
 * found so the caller can fix the request in one round trip.
 */
public class ValidationException extends TracelogException {

    private final List<String> violations;

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public ValidationException(List<String> violations) {
        super("Invalid investigation record: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
