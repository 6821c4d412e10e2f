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

import java.util.List;
import java.util.Optional;

/**
 * One newest-first page of query results.
 *
 * @param records    at most {@code limit} records, newest first
 * @param nextCursor token for the following page, null when there is none
 */
public record QueryPage(List<InvestigationRecord> records, String nextCursor) {

    private static final QueryPage EMPTY = new QueryPage(List.of(), null);

    public QueryPage {
        records = List.copyOf(records);
    }

    public static QueryPage empty() {
        return EMPTY;
    }

    public Optional<String> next() {
        return Optional.ofNullable(nextCursor);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
