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
package dev.mars.tracelog.export;

import dev.mars.tracelog.TracelogException;

/**
 * Requested export format is not one of {@link ExportFormat}. Raised before any
 * storage access.
 */
public class UnsupportedFormatException extends TracelogException {

    private final String requested;

    public UnsupportedFormatException(String requested) {
        super("Unsupported export format '" + requested + "' (supported: json, csv)");
        this.requested = requested;
    }

    public String requested() {
        return requested;
    }
}
