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

/**
 * Reads and writes one schema version of the persisted record shape.
 *
 * @see SchemaRegistry
 */
public interface RecordCodec {

    /** Schema version handled by this codec. */
    int version();

    /**
     * Decodes a JSON object into a record stamped with {@link #version()}.
     *
     * @throws ValidationException if the node is not structurally valid for this version
     */
    InvestigationRecord decode(JsonNode node);

    /** Encodes a record into this version's JSON shape. */
    ObjectNode encode(InvestigationRecord record);
}
