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

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Schema version 1: flat evidence entries {@code {evidence_id, source, title, url, metadata}}.
 * <p>
 * {@code source} is read as the evidence kind; every other field becomes the payload.
 */
final class LegacyRecordCodec extends AbstractRecordCodec {

    static final int VERSION = 1;

    private static final String F_SOURCE = "source";
    private static final String F_PAYLOAD = "payload";
    private static final String DEFAULT_SOURCE = "doc";

    LegacyRecordCodec() {
        super(VERSION);
    }

    @Override
    Evidence decodeEvidence(ObjectNode entry, int position, List<String> violations) {
        String kind = text(entry, F_SOURCE, violations);
        if (kind == null || kind.isBlank()) {
            kind = DEFAULT_SOURCE;
        }
        String evidenceId = text(entry, F_EVIDENCE_ID, violations);
        if (evidenceId == null || evidenceId.isBlank()) {
            evidenceId = defaultEvidenceId(position);
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (!F_EVIDENCE_ID.equals(name) && !F_SOURCE.equals(name)) {
                payload.set(name, field.getValue().deepCopy());
            }
        }
        return new Evidence(evidenceId, kind, payload);
    }

    @Override
    ObjectNode encodeEvidence(Evidence evidence) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(F_EVIDENCE_ID, evidence.evidenceId());
        node.put(F_SOURCE, evidence.kind());
        JsonNode payload = evidence.payload();
        if (payload.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String name = field.getKey();
                if (!F_EVIDENCE_ID.equals(name) && !F_SOURCE.equals(name)) {
                    node.set(name, field.getValue().deepCopy());
                }
            }
        } else if (!payload.isNull()) {
            node.set(F_PAYLOAD, payload.deepCopy());
        }
        return node;
    }
}
