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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.SchemaRegistry;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a flattened tabular projection with a header row. The evidence list is
 * embedded in each row as a JSON-encoded blob.
 */
public final class CsvRecordExporter implements RecordExporter {

    /** Column order of the export. */
    public static final List<String> COLUMNS = List.of(
            "id", "tenant_id", "type", "component_id", "project_id", "status", "created_at",
            "summary", "severity", "schema_version", "evidence_count", "evidence");

    private final SchemaRegistry registry;
    private final ObjectWriter writer;

    public CsvRecordExporter(SchemaRegistry registry) {
        this.registry = registry;
        CsvMapper mapper = new CsvMapper();
        CsvSchema.Builder schema = CsvSchema.builder();
        COLUMNS.forEach(schema::addColumn);
        // The header is written as an ordinary first row so an empty export still has one.
        this.writer = mapper.writer(schema.build().withoutHeader())
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public long write(Iterator<InvestigationRecord> records, OutputStream out) throws IOException {
        long count = 0;
        try (SequenceWriter rows = writer.writeValues(out)) {
            rows.write(headerRow());
            while (records.hasNext()) {
                rows.write(toRow(records.next()));
                count++;
            }
            rows.flush();
        }
        return count;
    }

    private static Map<String, String> headerRow() {
        Map<String, String> header = new LinkedHashMap<>();
        COLUMNS.forEach(column -> header.put(column, column));
        return header;
    }

    private Map<String, String> toRow(InvestigationRecord record) {
        ObjectNode encoded = registry.encode(record);
        JsonNode evidence = encoded.get("evidence");

        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", record.id());
        row.put("tenant_id", record.tenantId());
        row.put("type", record.type().wireName());
        row.put("component_id", record.componentId());
        row.put("project_id", record.projectId());
        row.put("status", record.status());
        row.put("created_at", record.createdAt() == null ? null : record.createdAt().toString());
        row.put("summary", record.summary());
        row.put("severity", record.severity());
        row.put("schema_version", Integer.toString(record.schemaVersion()));
        row.put("evidence_count", Integer.toString(record.evidence().size()));
        row.put("evidence", evidence == null ? "[]" : evidence.toString());
        return row;
    }
}
