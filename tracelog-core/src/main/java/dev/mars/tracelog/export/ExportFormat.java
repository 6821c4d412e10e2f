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

import java.util.Locale;
import java.util.Optional;

/**
 * Serialization formats supported by export.
 */
public enum ExportFormat {
    /** A JSON array of records in their persisted shape. */
    JSON("json", "application/json"),
    /** One flattened row per record, evidence as an embedded JSON blob. */
    CSV("csv", "text/csv");

    private final String wireName;
    private final String contentType;

    ExportFormat(String wireName, String contentType) {
        this.wireName = wireName;
        this.contentType = contentType;
    }

    public String wireName() {
        return wireName;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Parses a format name. Null or blank selects {@link #JSON}.
     *
     * @throws UnsupportedFormatException for any other value
     */
    public static ExportFormat parse(String value) {
        return find(value).orElseThrow(() -> new UnsupportedFormatException(value));
    }

    /**
     * Looks up a format name. Null or blank selects {@link #JSON}; unknown names are empty.
     */
    public static Optional<ExportFormat> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(JSON);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.wireName.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
