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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Schema version 2: evidence entries are {@code {evidence_id, kind, payload}}.
 */
final class CurrentRecordCodec extends AbstractRecordCodec {

    static final int VERSION = 2;

    private static final String F_KIND = "kind";
    private static final String F_PAYLOAD = "payload";

    CurrentRecordCodec() {
        super(VERSION);
    }

    @Override
    Evidence decodeEvidence(ObjectNode entry, int position, List<String> violations) {
        String kind = text(entry, F_KIND, violations);
        if (kind == null || kind.isBlank()) {
            violations.add("evidence[" + position + "].kind is required");
            return null;
        }
        String evidenceId = text(entry, F_EVIDENCE_ID, violations);
        if (evidenceId == null || evidenceId.isBlank()) {
            evidenceId = defaultEvidenceId(position);
        }
        JsonNode payload = entry.get(F_PAYLOAD);
        return new Evidence(evidenceId, kind, payload);
    }

    @Override
    ObjectNode encodeEvidence(Evidence evidence) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(F_EVIDENCE_ID, evidence.evidenceId());
        node.put(F_KIND, evidence.kind());
        node.set(F_PAYLOAD, evidence.payload().deepCopy());
        return node;
    }
}
