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
package dev.mars.tracelog.storage;

import dev.mars.tracelog.model.InvestigationRecord;

/**
 * A live record and where its line sits in the active segment.
 *
 * @param sequence append order, strictly increasing within a store instance
 * @param offset   byte offset of the line in the active segment
 * @param length   line length in bytes, including the trailing newline
 * @param record   the decoded record
 */
record IndexedRecord(long sequence, long offset, int length, InvestigationRecord record) {

    long createdAtMillis() {
        return record.createdAt().toEpochMilli();
    }
}
