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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An investigation (or incident) record as persisted by the store.
 * <p>
 * Records are immutable. {@code id} and {@code createdAt} may be null on a record
 * that has not been appended yet; the store assigns both on append and stamps
 * {@code schemaVersion} with its current version.
 *
 * @param id            unique identifier, assigned at append time
 * @param tenantId      owning tenant, never blank once persisted
 * @param type          investigation or incident
 * @param componentId   free-form classification, nullable
 * @param projectId     free-form classification, nullable
 * @param createdAt     creation time, assigned at append time when absent
 * @param status        collaborator-defined status (open, evidence-collected, doc-filed, closed, ...)
 * @param summary       short human-readable description, nullable
 * @param question      question that started the investigation, nullable
 * @param answer        answer produced by the agent, nullable
 * @param severity      collaborator-defined severity, nullable
 * @param sourceCommand command that produced the record, nullable
 * @param rawTraceId    trace id of the producing agent run, nullable
 * @param evidence      ordered evidence entries, possibly empty
 * @param attributes    unrecognized top-level fields, preserved as-is
 * @param schemaVersion shape version of this record
 */
public record InvestigationRecord(
        String id,
        String tenantId,
        RecordType type,
        String componentId,
        String projectId,
        Instant createdAt,
        String status,
        String summary,
        String question,
        String answer,
        String severity,
        String sourceCommand,
        String rawTraceId,
        List<Evidence> evidence,
        ObjectNode attributes,
        int schemaVersion
) {

    /** Status assigned when the collaborator does not provide one. */
    public static final String DEFAULT_STATUS = "open";

    public InvestigationRecord {
        type = type == null ? RecordType.INVESTIGATION : type;
        status = status == null || status.isBlank() ? DEFAULT_STATUS : status;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        attributes = attributes == null ? JsonNodeFactory.instance.objectNode() : attributes.deepCopy();
    }

    /** A copy of the unrecognized fields; records are shared with concurrent readers. */
    @Override
    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    /** Returns a copy of this record with the given id. */
    public InvestigationRecord withId(String newId) {
        return toBuilder().id(newId).build();
    }

    /** Returns a copy of this record with the given creation time. */
    public InvestigationRecord withCreatedAt(Instant newCreatedAt) {
        return toBuilder().createdAt(newCreatedAt).build();
    }

    /** Returns a copy of this record stamped with the given schema version. */
    public InvestigationRecord withSchemaVersion(int version) {
        return toBuilder().schemaVersion(version).build();
    }

    /** Returns a copy of this record with the given tenant. */
    public InvestigationRecord withTenantId(String newTenantId) {
        return toBuilder().tenantId(newTenantId).build();
    }

    /** Finds an evidence entry by id. */
    public Optional<Evidence> findEvidence(String evidenceId) {
        return evidence.stream()
                .filter(e -> e.evidenceId().equals(evidenceId))
                .findFirst();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .type(type)
                .componentId(componentId)
                .projectId(projectId)
                .createdAt(createdAt)
                .status(status)
                .summary(summary)
                .question(question)
                .answer(answer)
                .severity(severity)
                .sourceCommand(sourceCommand)
                .rawTraceId(rawTraceId)
                .evidence(evidence)
                .attributes(attributes)
                .schemaVersion(schemaVersion);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link InvestigationRecord}.
     */
    public static final class Builder {
        private String id;
        private String tenantId;
        private RecordType type = RecordType.INVESTIGATION;
        private String componentId;
        private String projectId;
        private Instant createdAt;
        private String status;
        private String summary;
        private String question;
        private String answer;
        private String severity;
        private String sourceCommand;
        private String rawTraceId;
        private final List<Evidence> evidence = new ArrayList<>();
        private ObjectNode attributes;
        private int schemaVersion = SchemaRegistry.CURRENT_VERSION;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder type(RecordType type) {
            this.type = type;
            return this;
        }

        public Builder componentId(String componentId) {
            this.componentId = componentId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder question(String question) {
            this.question = question;
            return this;
        }

        public Builder answer(String answer) {
            this.answer = answer;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder sourceCommand(String sourceCommand) {
            this.sourceCommand = sourceCommand;
            return this;
        }

        public Builder rawTraceId(String rawTraceId) {
            this.rawTraceId = rawTraceId;
            return this;
        }

        /** Replaces the evidence list. */
        public Builder evidence(List<Evidence> evidence) {
            this.evidence.clear();
            if (evidence != null) {
                this.evidence.addAll(evidence);
            }
            return this;
        }

        public Builder addEvidence(Evidence entry) {
            this.evidence.add(entry);
            return this;
        }

        public Builder attributes(ObjectNode attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        public InvestigationRecord build() {
            return new InvestigationRecord(id, tenantId, type, componentId, projectId, createdAt,
                    status, summary, question, answer, severity, sourceCommand, rawTraceId,
                    evidence, attributes, schemaVersion);
        }
    }
}
