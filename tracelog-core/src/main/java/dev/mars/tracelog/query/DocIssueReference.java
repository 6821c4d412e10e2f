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
package dev.mars.tracelog.query;

import dev.mars.tracelog.model.Evidence;
import dev.mars.tracelog.model.InvestigationRecord;

import java.util.List;

/**
 * An investigation and the evidence entries a doc issue will cite, all resolved.
 *
 * @param investigation the originating investigation
 * @param evidence      the cited entries, in request order
 */
public record DocIssueReference(InvestigationRecord investigation, List<Evidence> evidence) {

    public DocIssueReference {
        evidence = List.copyOf(evidence);
    }

    public String investigationId() {
        return investigation.id();
    }

    public List<String> evidenceIds() {
        return evidence.stream().map(Evidence::evidenceId).toList();
    }
}
