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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps schema versions to the codec that reads and writes them.
 * <p>
 * A record is always re-encoded with the codec of its own version, so a record read
 * from disk at an older version is written back in that same shape. Upgrading
 * on-disk records only happens through an explicit migration pass.
 */
public final class SchemaRegistry {

    /** Version stamped on newly appended records. */
    public static final int CURRENT_VERSION = CurrentRecordCodec.VERSION;

    private final Map<Integer, RecordCodec> codecs;

    public SchemaRegistry(Collection<? extends RecordCodec> codecs) {
        Map<Integer, RecordCodec> byVersion = new TreeMap<>();
        for (RecordCodec codec : codecs) {
            if (byVersion.put(codec.version(), codec) != null) {
                throw new IllegalArgumentException("Duplicate codec for schema version " + codec.version());
            }
        }
        if (!byVersion.containsKey(CURRENT_VERSION)) {
            throw new IllegalArgumentException("No codec registered for current schema version " + CURRENT_VERSION);
        }
        this.codecs = Collections.unmodifiableMap(byVersion);
    }

    /** Registry with every version this library knows how to read. */
    public static SchemaRegistry standard() {
        return new SchemaRegistry(List.of(new LegacyRecordCodec(), new CurrentRecordCodec()));
    }

    public boolean isSupported(int version) {
        return codecs.containsKey(version);
    }

    public SortedSet<Integer> supportedVersions() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(codecs.keySet()));
    }

    /**
     * @throws ValidationException if the version is not registered
     */
    public RecordCodec codecFor(int version) {
        RecordCodec codec = codecs.get(version);
        if (codec == null) {
            throw new ValidationException("unsupported schema_version " + version
                    + " (supported: " + codecs.keySet() + ")");
        }
        return codec;
    }

    public RecordCodec current() {
        return codecs.get(CURRENT_VERSION);
    }

    /**
     * Decodes a raw JSON object using the codec named by its {@code schema_version}
     * field. Records without the field are read as the current version.
     */
    public InvestigationRecord decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("record must be a JSON object");
        }
        JsonNode versionNode = node.get(AbstractRecordCodec.F_SCHEMA_VERSION);
        if (versionNode == null || versionNode.isNull()) {
            return current().decode(node);
        }
        if (!versionNode.canConvertToInt() || !versionNode.isIntegralNumber()) {
            throw new ValidationException("schema_version must be an integer");
        }
        return codecFor(versionNode.intValue()).decode(node);
    }

    /** Encodes a record in the shape of its own schema version. */
    public ObjectNode encode(InvestigationRecord record) {
        return codecFor(record.schemaVersion()).encode(record);
    }
}
