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

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.JsonMappers;
import dev.mars.tracelog.model.SchemaRegistry;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * Writes a JSON array, one element per record, each in its persisted shape.
 */
public final class JsonRecordExporter implements RecordExporter {

    private final SchemaRegistry registry;
    private final JsonFactory jsonFactory;

    public JsonRecordExporter(SchemaRegistry registry) {
        this.registry = registry;
        this.jsonFactory = JsonMappers.shared().getFactory();
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public long write(Iterator<InvestigationRecord> records, OutputStream out) throws IOException {
        long count = 0;
        try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            gen.writeStartArray();
            while (records.hasNext()) {
                gen.writeTree(registry.encode(records.next()));
                count++;
            }
            gen.writeEndArray();
            gen.flush();
        }
        return count;
    }
}
