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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable snapshot of the live records in the active segment.
 * <p>
 * The writer builds a new snapshot after every mutation and publishes it through a
 * volatile field; readers take the reference once and work on it without locking.
 * A snapshot always matches a fully written state of the log: no reader can observe
 * a record whose line is not completely on disk.
 * <p>
 * Besides the primary list (ordered by append sequence) it keeps secondary lists per
 * tenant, component and project, and the creation times in sorted order so the
 * number of unexpired records can be counted with a binary search.
 */
final class RecordIndex {

    static final RecordIndex EMPTY = build(List.of(), 0L, 0L);

    private final List<IndexedRecord> records;
    private final Map<String, IndexedRecord> byId;
    private final Map<String, List<IndexedRecord>> byTenant;
    private final Map<String, List<IndexedRecord>> byComponent;
    private final Map<String, List<IndexedRecord>> byProject;
    private final Instant[] createdAtSorted;
    private final long activeBytes;
    private final long deadLines;

    private RecordIndex(List<IndexedRecord> records,
                        Map<String, IndexedRecord> byId,
                        Map<String, List<IndexedRecord>> byTenant,
                        Map<String, List<IndexedRecord>> byComponent,
                        Map<String, List<IndexedRecord>> byProject,
                        Instant[] createdAtSorted,
                        long activeBytes,
                        long deadLines) {
        this.records = records;
        this.byId = byId;
        this.byTenant = byTenant;
        this.byComponent = byComponent;
        this.byProject = byProject;
        this.createdAtSorted = createdAtSorted;
        this.activeBytes = activeBytes;
        this.deadLines = deadLines;
    }

    /**
     * Builds a snapshot.
     *
     * @param records     live records in ascending sequence order
     * @param activeBytes size of the active segment
     * @param deadLines   lines in the active segment that are no longer live
     */
    static RecordIndex build(List<IndexedRecord> records, long activeBytes, long deadLines) {
        List<IndexedRecord> ordered = Collections.unmodifiableList(new ArrayList<>(records));
        Map<String, IndexedRecord> byId = new HashMap<>();
        Instant[] createdAt = new Instant[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            IndexedRecord entry = ordered.get(i);
            byId.put(entry.record().id(), entry);
            createdAt[i] = entry.record().createdAt();
        }
        Arrays.sort(createdAt);
        return new RecordIndex(
                ordered,
                Collections.unmodifiableMap(byId),
                group(ordered, e -> e.record().tenantId()),
                group(ordered, e -> e.record().componentId()),
                group(ordered, e -> e.record().projectId()),
                createdAt,
                activeBytes,
                deadLines);
    }

    private static Map<String, List<IndexedRecord>> group(List<IndexedRecord> ordered,
                                                          Function<IndexedRecord, String> key) {
        Map<String, List<IndexedRecord>> grouped = new HashMap<>();
        for (IndexedRecord entry : ordered) {
            String value = key.apply(entry);
            if (value != null) {
                grouped.computeIfAbsent(value, k -> new ArrayList<>()).add(entry);
            }
        }
        grouped.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(grouped);
    }

    /** Live records in ascending append order. */
    List<IndexedRecord> records() {
        return records;
    }

    int size() {
        return records.size();
    }

    long activeBytes() {
        return activeBytes;
    }

    long deadLines() {
        return deadLines;
    }

    Optional<IndexedRecord> byId(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    boolean containsId(String id) {
        return byId.containsKey(id);
    }

    /**
     * Number of records created at or after {@code cutoff}.
     */
    int countNotExpired(Instant cutoff) {
        int lo = 0;
        int hi = createdAtSorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (createdAtSorted[mid].isBefore(cutoff)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return createdAtSorted.length - lo;
    }

    /**
     * Lazily walks matching, unexpired records newest first, starting strictly below
     * {@code beforeSequence}.
     */
    Iterator<IndexedRecord> newestFirst(InvestigationFilter filter, long beforeSequence, Instant cutoff) {
        List<IndexedRecord> candidates = candidatesFor(filter);
        return new NewestFirstIterator(candidates, startBelow(candidates, beforeSequence), filter, cutoff);
    }

    /**
     * Picks the smallest list that every match must belong to.
     */
    private List<IndexedRecord> candidatesFor(InvestigationFilter filter) {
        List<IndexedRecord> best = records;
        best = narrower(best, filter.tenantId(), byTenant);
        best = narrower(best, filter.componentId(), byComponent);
        best = narrower(best, filter.projectId(), byProject);
        return best;
    }

    private static List<IndexedRecord> narrower(List<IndexedRecord> current, String key,
                                                Map<String, List<IndexedRecord>> secondary) {
        if (key == null) {
            return current;
        }
        List<IndexedRecord> list = secondary.getOrDefault(key, List.of());
        return list.size() < current.size() ? list : current;
    }

    /** Index of the last entry whose sequence is below {@code beforeSequence}, or -1. */
    private static int startBelow(List<IndexedRecord> candidates, long beforeSequence) {
        int lo = 0;
        int hi = candidates.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (candidates.get(mid).sequence() < beforeSequence) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    private static final class NewestFirstIterator implements Iterator<IndexedRecord> {
        private final List<IndexedRecord> candidates;
        private final InvestigationFilter filter;
        private final Instant cutoff;
        private int position;
        private IndexedRecord next;

        NewestFirstIterator(List<IndexedRecord> candidates, int start, InvestigationFilter filter, Instant cutoff) {
            this.candidates = candidates;
            this.position = start;
            this.filter = filter;
            this.cutoff = cutoff;
            advance();
        }

        private void advance() {
            next = null;
            while (position >= 0) {
                IndexedRecord candidate = candidates.get(position--);
                if (!candidate.record().createdAt().isBefore(cutoff) && filter.matches(candidate.record())) {
                    next = candidate;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public IndexedRecord next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            IndexedRecord current = next;
            advance();
            return current;
        }
    }
}
