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

import java.util.Locale;

/**
 * Kind of persisted record. Unknown values normalize to {@link #INVESTIGATION}.
 */
public enum RecordType {
    INVESTIGATION("investigation"),
    INCIDENT("incident");

    private final String wireName;

    RecordType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RecordType fromWire(String value) {
        if (value == null) {
            return INVESTIGATION;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecordType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return INVESTIGATION;
    }
}
