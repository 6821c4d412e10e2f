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

import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.SchemaRegistry;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * Streams records to an output stream in one {@link ExportFormat}.
 * <p>
 * Records are pulled from the iterator one at a time and written incrementally, so
 * the full result is never buffered. The output stream is flushed but not closed.
 */
public interface RecordExporter {

    ExportFormat format();

    /**
     * Writes every record from {@code records}.
     *
     * @return number of records written
     */
    long write(Iterator<InvestigationRecord> records, OutputStream out) throws IOException;

    static RecordExporter forFormat(ExportFormat format, SchemaRegistry registry) {
        switch (format) {
            case JSON:
                return new JsonRecordExporter(registry);
            case CSV:
                return new CsvRecordExporter(registry);
            default:
                throw new UnsupportedFormatException(format.wireName());
        }
    }
}
