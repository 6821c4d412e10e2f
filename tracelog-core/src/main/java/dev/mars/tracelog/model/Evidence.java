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
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * One piece of evidence attached to an investigation.
 * <p>
 * The store treats {@code payload} as opaque: only the {@code kind} tag is checked.
 *
 * @param evidenceId identifier referenced by doc-issue requests
 * @param kind       tag describing the payload (e.g. {@code slack}, {@code git}, {@code doc})
 * @param payload    collaborator-defined structured value, never null ({@link NullNode} when absent)
 */
public record Evidence(String evidenceId, String kind, JsonNode payload) {

    public Evidence {
        Objects.requireNonNull(evidenceId, "evidenceId");
        Objects.requireNonNull(kind, "kind");
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
    }

    /** A copy of the payload; the entry itself never changes. */
    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }
}
