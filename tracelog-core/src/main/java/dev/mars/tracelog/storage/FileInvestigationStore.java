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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.tracelog.export.ExportFormat;
import dev.mars.tracelog.export.RecordExporter;
import dev.mars.tracelog.gate.FeatureGate;
import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.JsonMappers;
import dev.mars.tracelog.model.RecordValidator;
import dev.mars.tracelog.model.SchemaRegistry;
import dev.mars.tracelog.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * File-based implementation of {@link InvestigationStore}.
 * <p>
 * Records are kept as newline-delimited JSON, one record per line, in the active
 * segment at {@link InvestigationStoreConfig#investigationsPath()}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/live/
 *  ├─ investigations.jsonl                        // active segment, append-only
 *  ├─ investigations.jsonl.20261019T182600123Z    // archived segments
 *  ├─ investigations.jsonl.lock                   // single-process lock
 *  └─ investigations.jsonl.next                   // only during rotation
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All write operations are serialized through a single-threaded executor, so lines
 * never interleave and rotation is atomic with respect to other appends. After each
 * write the writer publishes an immutable {@link RecordIndex} snapshot; readers use
 * the latest snapshot and never block on file I/O.
 * <p>
 * <b>Bounds:</b>
 * <ul>
 *   <li><b>Count:</b> when an append would exceed {@code maxEntries}, the record with
 *       the lowest append sequence is evicted first.</li>
 *   <li><b>Age:</b> records older than {@code retentionDays} are excluded from every
 *       read immediately and dropped from the index on the next append.</li>
 *   <li><b>Size:</b> an append that would push the active segment past
 *       {@code maxFileBytes} is written to a fresh segment; the old one is archived
 *       under a timestamped name and leaves the active store.</li>
 * </ul>
 * Evicted and expired lines are physically removed by compaction once their number
 * reaches {@code maxEntries}.
 * <p>
 * <b>Failures:</b> an append that cannot be written leaves the log as it was, is
 * reported to the caller as a {@link StorageWriteException} and is latched into
 * {@link StoreState#lastError()}; reads keep working.
 *
 * @see InvestigationStore
 */
public final class FileInvestigationStore implements InvestigationStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileInvestigationStore.class);

    // ========================================================================
    // Constants
    // ========================================================================

    private static final String LOCK_SUFFIX = ".lock";
    private static final String NEXT_SUFFIX = ".next";
    private static final String COMPACT_SUFFIX = ".compact";

    private static final DateTimeFormatter ARCHIVE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    private static final byte NEWLINE = '\n';

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Single-threaded executor for all writes.
     * <p>
     * <b>INVARIANT:</b> the log channel, the append sequence and the published index
     * are only mutated on this thread.
     */
    private final ExecutorService writeExecutor;
    private final InvestigationStoreConfig config;
    private final FeatureGate gate;
    private final Clock clock;
    private final SchemaRegistry registry;
    private final RecordValidator validator;
    private final ObjectMapper mapper;
    private final Path logPath;
    private final Pattern archivePattern;

    private FileChannel logChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private long nextSequence = 1;
    private Instant lastAssignedCreatedAt = Instant.EPOCH;

    private volatile RecordIndex index = RecordIndex.EMPTY;
    private volatile Instant lastWriteAt;
    private volatile int archivedSegments;
    private volatile boolean opened = false;
    private volatile boolean closed = false;
    private final AtomicReference<StorageError> lastError = new AtomicReference<>();

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a store with configuration loaded from system properties, environment
     * variables, properties file, or defaults.
     *
     * @see InvestigationStoreConfig
     */
    public FileInvestigationStore() {
        this(InvestigationStoreConfig.load());
    }

    /**
     * Creates a store with the given configuration, the process environment as the
     * feature-gate override source and the system UTC clock.
     */
    public FileInvestigationStore(InvestigationStoreConfig config) {
        this(config, new FeatureGate(config.enabled()), Clock.systemUTC());
    }

    /**
     * @param config storage configuration
     * @param gate   feature gate consulted once per operation
     * @param clock  time source for {@code created_at}, retention and archive names
     */
    public FileInvestigationStore(InvestigationStoreConfig config, FeatureGate gate, Clock clock) {
        this.config = config;
        this.gate = gate;
        this.clock = clock;
        this.registry = SchemaRegistry.standard();
        this.validator = new RecordValidator(registry, config.defaultTenantId());
        this.mapper = JsonMappers.shared();
        this.logPath = config.investigationsPath().toAbsolutePath();
        this.archivePattern = Pattern.compile(Pattern.quote(logPath.getFileName().toString())
                + "\\.\\d{8}T\\d{9}Z(-\\d+)?");

        this.writeExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tracelog-writer");
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileInvestigationStore initialized: path={}, maxEntries={}, retentionDays={}, maxFileBytes={}, " +
                        "tenantScopingRequired={}, syncEnabled={}",
                logPath, config.maxEntries(), config.retentionDays(), config.maxFileBytes(),
                config.tenantScopingRequired(), config.syncEnabled());

        if (!config.syncEnabled()) {
            LOG.warn("FileInvestigationStore created with fsync DISABLED. Appends may be lost on power failure");
        }
    }

    @Override
    public InvestigationStoreConfig config() {
        return config;
    }

    @Override
    public FeatureGate gate() {
        return gate;
    }

    /** Schema versions this store reads and writes. */
    public SchemaRegistry schemaRegistry() {
        return registry;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public CompletableFuture<Void> open() {
        return submit(() -> {
            if (opened) {
                LOG.debug("Store already open, ignoring duplicate open()");
                return null;
            }
            try {
                LOG.info("Opening investigation store at: {}", logPath);
                Path dir = logPath.getParent();
                Files.createDirectories(dir);

                // Acquire exclusive lock to prevent multiple processes
                acquireExclusiveLock();

                warnOnLowDiskSpace();
                recoverInterruptedRotation();

                this.logChannel = FileChannel.open(logPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE);

                RecordIndex replayed = replay();
                this.archivedSegments = listArchivedSegments().size();
                this.index = replayed;
                this.opened = true;
                LOG.info("Investigation store opened: path={}, liveRecords={}, size={} bytes, archivedSegments={}",
                        logPath, replayed.size(), replayed.activeBytes(), archivedSegments);

                if (replayed.deadLines() >= config.maxEntries()) {
                    this.index = compactQuietly(replayed);
                }
                return null;
            } catch (IOException e) {
                LOG.error("Failed to open investigation store at {}: {}", logPath, e.getMessage(), e);
                closeLogChannel();
                releaseExclusiveLock();
                StorageReadException failure = new StorageReadException("Failed to open investigation store at " + logPath, e);
                latch("open", failure);
                throw failure;
            } catch (StorageException e) {
                closeLogChannel();
                releaseExclusiveLock();
                latch("open", e);
                throw e;
            }
        });
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing investigation store at: {}", logPath);

        writeExecutor.execute(() -> {
            if (logChannel != null && logChannel.isOpen() && config.syncEnabled()) {
                try {
                    logChannel.force(true);
                } catch (IOException e) {
                    LOG.warn("Could not flush active segment on close: {}", e.getMessage());
                }
            }
            closeLogChannel();
            releaseExclusiveLock();
            opened = false;
        });

        writeExecutor.shutdown();
        try {
            if (!writeExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Writer did not finish within 10s of close()");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the writer to finish");
        }
        LOG.info("Investigation store closed");
    }

    // ========================================================================
    // Writes
    // ========================================================================

    @Override
    public CompletableFuture<String> append(InvestigationRecord record) {
        if (!gate.isEnabled()) {
            String id = record != null && record.id() != null ? record.id() : newId();
            LOG.debug("Traceability disabled, skipping append of {}", id);
            return CompletableFuture.completedFuture(id);
        }
        InvestigationRecord validated;
        try {
            validated = validator.validate(record);
        } catch (ValidationException e) {
            LOG.debug("Rejected investigation record: {}", e.violations());
            return CompletableFuture.failedFuture(e);
        }
        return submit(() -> appendOnWriter(validated));
    }

    @Override
    public CompletableFuture<String> append(JsonNode raw) {
        if (!gate.isEnabled()) {
            JsonNode id = raw == null ? null : raw.get("id");
            String assigned = id != null && id.isTextual() && !id.asText().isBlank() ? id.asText() : newId();
            LOG.debug("Traceability disabled, skipping append of {}", assigned);
            return CompletableFuture.completedFuture(assigned);
        }
        InvestigationRecord validated;
        try {
            validated = validator.validate(raw);
        } catch (ValidationException e) {
            LOG.debug("Rejected investigation payload: {}", e.violations());
            return CompletableFuture.failedFuture(e);
        }
        return submit(() -> appendOnWriter(validated));
    }

    @Override
    public CompletableFuture<Integer> compact() {
        if (!gate.isEnabled()) {
            return CompletableFuture.completedFuture(0);
        }
        return submit(() -> {
            ensureWritable("compact");
            RecordIndex current = index;
            long before = current.deadLines() + current.size();
            RecordIndex pruned = pruneExpired(current, clock.instant());
            RecordIndex compacted = rewriteOrFail(pruned, false, "compact");
            index = compacted;
            return (int) (before - compacted.size());
        });
    }

    @Override
    public CompletableFuture<Integer> migrateSchema() {
        if (!gate.isEnabled()) {
            return CompletableFuture.completedFuture(0);
        }
        return submit(() -> {
            ensureWritable("migrate");
            RecordIndex current = index;
            int upgraded = 0;
            for (IndexedRecord entry : current.records()) {
                if (entry.record().schemaVersion() != SchemaRegistry.CURRENT_VERSION) {
                    upgraded++;
                }
            }
            if (upgraded == 0) {
                LOG.info("Schema migration: all {} records already at version {}",
                        current.size(), SchemaRegistry.CURRENT_VERSION);
                return 0;
            }
            index = rewriteOrFail(current, true, "migrate");
            LOG.info("Schema migration: {} records upgraded to version {}", upgraded, SchemaRegistry.CURRENT_VERSION);
            return upgraded;
        });
    }

    /**
     * Performs one append. Must be called from the writer thread.
     */
    private String appendOnWriter(InvestigationRecord validated) {
        ensureWritable("append");
        Instant now = clock.instant();
        RecordIndex current = index;

        InvestigationRecord stamped = stamp(validated, now);
        if (current.containsId(stamped.id())) {
            throw new ValidationException("id " + stamped.id() + " already exists");
        }

        byte[] line = encodeLine(stamped);
        if (line.length > config.maxRecordBytes()) {
            throw new ValidationException("record of " + line.length + " bytes exceeds maxRecordBytes "
                    + config.maxRecordBytes());
        }
        if (line.length > config.maxFileBytes()) {
            throw new ValidationException("record of " + line.length + " bytes exceeds max_file_bytes "
                    + config.maxFileBytes());
        }

        try {
            checkDiskSpace();

            RecordIndex pruned = pruneExpired(current, now);
            List<IndexedRecord> live = new ArrayList<>(pruned.records());
            long deadLines = pruned.deadLines();
            int evicted = 0;
            while (!live.isEmpty() && live.size() + 1 > config.maxEntries()) {
                IndexedRecord oldest = live.remove(0);
                evicted++;
                LOG.debug("Evicting oldest investigation {} (sequence {})", oldest.record().id(), oldest.sequence());
            }
            deadLines += evicted;

            long sequence = nextSequence;
            RecordIndex next;
            if (pruned.activeBytes() > 0 && pruned.activeBytes() + line.length > config.maxFileBytes()) {
                rotate(line, now, pruned);
                IndexedRecord entry = new IndexedRecord(sequence, 0, line.length, stamped);
                next = RecordIndex.build(List.of(entry), line.length, 0);
            } else {
                long offset = writeLine(line);
                live.add(new IndexedRecord(sequence, offset, line.length, stamped));
                next = RecordIndex.build(live, offset + line.length, deadLines);
            }

            nextSequence = sequence + 1;
            if (stamped.createdAt().isAfter(lastAssignedCreatedAt)) {
                lastAssignedCreatedAt = stamped.createdAt();
            }
            index = next;
            lastWriteAt = now;
            lastError.set(null);

            LOG.debug("Appended investigation {} (tenant={}, sequence={}, {} bytes, live={}, evicted={})",
                    stamped.id(), stamped.tenantId(), sequence, line.length, next.size(), evicted);

            if (next.deadLines() >= config.maxEntries()) {
                index = compactQuietly(next);
            }
            return stamped.id();
        } catch (IOException e) {
            LOG.error("Failed to append investigation {}: {}", stamped.id(), e.getMessage(), e);
            StorageWriteException failure =
                    new StorageWriteException("Failed to append investigation " + stamped.id(), e);
            latch("append", failure);
            throw failure;
        } catch (StorageWriteException e) {
            latch("append", e);
            throw e;
        }
    }

    /**
     * Assigns id, creation time and the current schema version.
     * Store-assigned creation times never go backwards.
     */
    private InvestigationRecord stamp(InvestigationRecord record, Instant now) {
        InvestigationRecord.Builder builder = record.toBuilder()
                .schemaVersion(SchemaRegistry.CURRENT_VERSION);
        if (record.id() == null) {
            builder.id(newId());
        }
        if (record.createdAt() == null) {
            builder.createdAt(now.isBefore(lastAssignedCreatedAt) ? lastAssignedCreatedAt : now);
        }
        return builder.build();
    }

    private byte[] encodeLine(InvestigationRecord record) {
        try {
            byte[] json = mapper.writeValueAsBytes(registry.encode(record));
            byte[] line = new byte[json.length + 1];
            System.arraycopy(json, 0, line, 0, json.length);
            line[json.length] = NEWLINE;
            return line;
        } catch (JsonProcessingException e) {
            throw new ValidationException("record could not be serialized: " + e.getOriginalMessage());
        }
    }

    /**
     * Appends one full line to the active segment, rolling back on failure.
     *
     * @return the offset the line was written at
     */
    private long writeLine(byte[] line) throws IOException {
        long position = logChannel.position();
        ByteBuffer buf = ByteBuffer.wrap(line);
        try {
            while (buf.hasRemaining()) {
                logChannel.write(buf);
            }
            if (config.syncEnabled()) {
                logChannel.force(false);
            }
        } catch (IOException e) {
            rollback(position, e);
            throw e;
        }
        LOG.trace("Wrote {} bytes at position {}", line.length, position);
        return position;
    }

    /**
     * Cuts a partially written line off the active segment.
     */
    private void rollback(long position, IOException cause) {
        try {
            logChannel.truncate(position);
            logChannel.position(position);
            LOG.warn("Rolled back partial write at position {}", position);
        } catch (IOException e) {
            cause.addSuppressed(e);
            LOG.error("Could not roll back partial write at position {}: {}", position, e.getMessage());
        }
    }

    // ========================================================================
    // Retention, Rotation, Compaction
    // ========================================================================

    private Instant retentionCutoff(Instant now) {
        if (config.retentionDays() <= 0) {
            return Instant.MIN;
        }
        return now.minus(Duration.ofDays(config.retentionDays()));
    }

    /**
     * Drops records past retention from the index. Their lines become dead.
     */
    private RecordIndex pruneExpired(RecordIndex current, Instant now) {
        Instant cutoff = retentionCutoff(now);
        if (current.countNotExpired(cutoff) == current.size()) {
            return current;
        }
        List<IndexedRecord> kept = new ArrayList<>(current.size());
        for (IndexedRecord entry : current.records()) {
            if (!entry.record().createdAt().isBefore(cutoff)) {
                kept.add(entry);
            }
        }
        int expired = current.size() - kept.size();
        LOG.debug("Retention removed {} investigations created before {}", expired, cutoff);
        return RecordIndex.build(kept, current.activeBytes(), current.deadLines() + expired);
    }

    /**
     * Writes {@code line} as the first line of a fresh segment, then archives the
     * current segment and promotes the fresh one. Must be called from the writer thread.
     */
    private void rotate(byte[] line, Instant now, RecordIndex current) throws IOException {
        Path next = sibling(NEXT_SUFFIX);
        LOG.info("Rotating active segment: {} bytes + {} byte record exceeds maxFileBytes {}",
                current.activeBytes(), line.length, config.maxFileBytes());

        // 1. The pending record goes to the new segment and is made durable there
        try (FileChannel ch = FileChannel.open(next,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(line);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (config.syncEnabled()) {
                ch.force(true);
            }
        } catch (IOException e) {
            deleteIfExists(next);
            throw e;
        }

        // 2. Archive the old segment
        Path archive = nextArchivePath(now);
        closeLogChannel();
        try {
            Files.move(logPath, archive, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteIfExists(next);
            reopenLogChannel();
            throw e;
        }

        // 3. Promote the new segment
        try {
            Files.move(next, logPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            restoreArchive(archive, e);
            deleteIfExists(next);
            reopenLogChannel();
            throw e;
        }

        if (config.syncEnabled()) {
            syncDirectory(logPath.getParent());
        }
        reopenLogChannel();
        archivedSegments++;
        LOG.info("Rotation complete: archived {} ({} live records left the active store)",
                archive.getFileName(), current.size());
    }

    private void restoreArchive(Path archive, IOException cause) {
        try {
            Files.move(archive, logPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            cause.addSuppressed(e);
            LOG.error("Could not restore {} after failed rotation: {}", archive, e.getMessage());
        }
    }

    /**
     * Compacts after an operation that has already succeeded. A failure is latched
     * into {@code last_error} and the current segment is kept.
     */
    private RecordIndex compactQuietly(RecordIndex current) {
        try {
            return rewriteActiveSegment(current, false, "compact");
        } catch (IOException e) {
            LOG.warn("Compaction failed, keeping current segment: {}", e.getMessage());
            latch("compact", new StorageWriteException("Compaction of " + logPath + " failed", e));
            return current;
        }
    }

    /**
     * Rewrites the active segment on behalf of an explicit maintenance call.
     */
    private RecordIndex rewriteOrFail(RecordIndex current, boolean upgradeSchema, String operation) {
        try {
            return rewriteActiveSegment(current, upgradeSchema, operation);
        } catch (IOException e) {
            LOG.error("Rewrite of active segment ({}) failed: {}", operation, e.getMessage(), e);
            StorageWriteException failure =
                    new StorageWriteException("Failed to rewrite active segment during " + operation, e);
            latch(operation, failure);
            throw failure;
        }
    }

    /**
     * Writes live records to a temp file, fsyncs it and atomically replaces the
     * active segment with it. Must be called from the writer thread.
     */
    private RecordIndex rewriteActiveSegment(RecordIndex current, boolean upgradeSchema, String operation)
            throws IOException {
        Path tmp = sibling(COMPACT_SUFFIX);
        List<IndexedRecord> rewritten = new ArrayList<>(current.size());
        long offset = 0;
        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            for (IndexedRecord entry : current.records()) {
                InvestigationRecord record = upgradeSchema
                        ? entry.record().withSchemaVersion(SchemaRegistry.CURRENT_VERSION)
                        : entry.record();
                byte[] line = encodeLine(record);
                ByteBuffer buf = ByteBuffer.wrap(line);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                rewritten.add(new IndexedRecord(entry.sequence(), offset, line.length, record));
                offset += line.length;
            }
            if (config.syncEnabled()) {
                ch.force(true);
            }
        } catch (IOException e) {
            deleteIfExists(tmp);
            throw e;
        }

        closeLogChannel();
        try {
            Files.move(tmp, logPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteIfExists(tmp);
            reopenLogChannel();
            throw e;
        }
        if (config.syncEnabled()) {
            syncDirectory(logPath.getParent());
        }
        reopenLogChannel();

        LOG.info("Active segment rewritten ({}): {} live records, {} dead lines removed, {} -> {} bytes",
                operation, rewritten.size(), current.deadLines(), current.activeBytes(), offset);
        return RecordIndex.build(rewritten, offset, 0);
    }

    /**
     * Completes a rotation interrupted after the new segment was written.
     */
    private void recoverInterruptedRotation() throws IOException {
        Path next = sibling(NEXT_SUFFIX);
        if (!Files.exists(next)) {
            return;
        }
        if (Files.exists(logPath)) {
            Path archive = nextArchivePath(clock.instant());
            LOG.warn("Found interrupted rotation: archiving {} as {} and promoting {}",
                    logPath.getFileName(), archive.getFileName(), next.getFileName());
            Files.move(logPath, archive, StandardCopyOption.ATOMIC_MOVE);
        } else {
            LOG.warn("Found interrupted rotation: promoting {}", next.getFileName());
        }
        Files.move(next, logPath, StandardCopyOption.ATOMIC_MOVE);
        syncDirectory(logPath.getParent());
    }

    private Path nextArchivePath(Instant now) {
        String base = logPath.getFileName() + "." + ARCHIVE_STAMP.format(now);
        Path candidate = logPath.resolveSibling(base);
        int attempt = 1;
        while (Files.exists(candidate)) {
            candidate = logPath.resolveSibling(base + "-" + attempt++);
        }
        return candidate;
    }

    /**
     * Lists archived segments, oldest first.
     */
    public List<Path> listArchivedSegments() throws IOException {
        List<Path> archives = new ArrayList<>();
        Path dir = logPath.getParent();
        if (!Files.isDirectory(dir)) {
            return archives;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir,
                entry -> archivePattern.matcher(entry.getFileName().toString()).matches())) {
            for (Path entry : stream) {
                archives.add(entry);
            }
        }
        Collections.sort(archives);
        return archives;
    }

    // ========================================================================
    // Replay
    // ========================================================================

    /**
     * Rebuilds the index from the active segment. Must be called from the writer thread.
     * <p>
     * A final line without a newline is a torn write and is truncated. Complete lines
     * that cannot be decoded, or that carry an unknown schema version, are skipped.
     * Count and retention bounds are re-applied to what remains.
     */
    private RecordIndex replay() throws IOException {
        long fileSize = logChannel.size();
        if (fileSize == 0) {
            LOG.debug("Active segment is empty");
            return RecordIndex.EMPTY;
        }
        if (fileSize > Integer.MAX_VALUE) {
            throw new StorageReadException("Active segment too large to replay: " + fileSize + " bytes");
        }

        LOG.info("Replaying active segment: {} ({} bytes)", logPath, fileSize);
        long startTime = System.currentTimeMillis();

        byte[] data = new byte[(int) fileSize];
        ByteBuffer buf = ByteBuffer.wrap(data);
        long readPos = 0;
        while (buf.hasRemaining()) {
            int n = logChannel.read(buf, readPos);
            if (n < 0) {
                break;
            }
            readPos += n;
        }

        Map<String, Integer> positionsById = new HashMap<>();
        List<IndexedRecord> entries = new ArrayList<>();
        long deadLines = 0;
        long sequence = 0;
        int pos = 0;
        int lastGoodPos = 0;

        while (pos < data.length) {
            int newline = indexOf(data, NEWLINE, pos);
            if (newline < 0) {
                break; // torn tail
            }
            int length = newline - pos + 1;
            String text = new String(data, pos, newline - pos, StandardCharsets.UTF_8).trim();
            if (text.isEmpty()) {
                deadLines++;
            } else {
                Optional<InvestigationRecord> decoded = decodeLine(text, pos);
                if (decoded.isPresent()) {
                    InvestigationRecord record = decoded.get();
                    Integer previous = positionsById.put(record.id(), entries.size());
                    if (previous != null) {
                        LOG.warn("Duplicate id {} at offset {}, keeping the later line", record.id(), pos);
                        entries.set(previous, null);
                        deadLines++;
                    }
                    entries.add(new IndexedRecord(++sequence, pos, length, record));
                } else {
                    deadLines++;
                }
            }
            pos = newline + 1;
            lastGoodPos = pos;
        }

        if (lastGoodPos < fileSize) {
            LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                    fileSize - lastGoodPos, fileSize, lastGoodPos);
            logChannel.truncate(lastGoodPos);
        }
        logChannel.position(lastGoodPos);

        List<IndexedRecord> live = new ArrayList<>(entries.size());
        for (IndexedRecord entry : entries) {
            if (entry != null) {
                live.add(entry);
            }
        }

        Instant cutoff = retentionCutoff(clock.instant());
        int before = live.size();
        live.removeIf(entry -> entry.record().createdAt().isBefore(cutoff));
        int expired = before - live.size();
        int evicted = 0;
        while (live.size() > config.maxEntries()) {
            live.remove(0);
            evicted++;
        }
        deadLines += expired + evicted;

        nextSequence = sequence + 1;
        if (!live.isEmpty()) {
            lastAssignedCreatedAt = live.get(live.size() - 1).record().createdAt();
        }

        long elapsed = System.currentTimeMillis() - startTime;
        LOG.info("Replay complete: {} live records, {} expired, {} evicted, {} dead lines, {} ms",
                live.size(), expired, evicted, deadLines, elapsed);
        return RecordIndex.build(live, lastGoodPos, deadLines);
    }

    private Optional<InvestigationRecord> decodeLine(String text, int offset) {
        try {
            InvestigationRecord record = registry.decode(mapper.readTree(text));
            if (record.id() == null || record.tenantId() == null || record.tenantId().isBlank()
                    || record.createdAt() == null) {
                LOG.warn("Skipping incomplete record at offset {}: id, tenant_id and created_at are required", offset);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (JsonProcessingException e) {
            LOG.warn("Skipping unparsable line at offset {}: {}", offset, e.getOriginalMessage());
            return Optional.empty();
        } catch (ValidationException e) {
            LOG.warn("Skipping unreadable record at offset {}: {}", offset, e.getMessage());
            return Optional.empty();
        }
    }

    private static int indexOf(byte[] data, byte value, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == value) {
                return i;
            }
        }
        return -1;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public QueryPage query(InvestigationFilter filter, int limit, String cursor) {
        if (!gate.isEnabled()) {
            return QueryPage.empty();
        }
        requireTenantScope(filter, "query");
        if (limit < 1) {
            throw new ValidationException("limit must be >= 1, was " + limit);
        }
        long before = QueryCursor.decode(cursor);

        RecordIndex snapshot = index;
        Iterator<IndexedRecord> matches = snapshot.newestFirst(filter, before, retentionCutoff(clock.instant()));
        List<InvestigationRecord> page = new ArrayList<>(Math.min(limit, snapshot.size()));
        IndexedRecord last = null;
        while (page.size() < limit && matches.hasNext()) {
            last = matches.next();
            page.add(last.record());
        }
        String nextCursor = last != null && matches.hasNext() ? QueryCursor.encode(last.sequence()) : null;
        LOG.debug("Query {} returned {} records (more={})", filter, page.size(), nextCursor != null);
        return new QueryPage(page, nextCursor);
    }

    @Override
    public Optional<InvestigationRecord> get(InvestigationFilter scope, String id) {
        if (!gate.isEnabled() || id == null || id.isBlank()) {
            return Optional.empty();
        }
        requireTenantScope(scope, "lookup");
        Instant cutoff = retentionCutoff(clock.instant());
        return index.byId(id)
                .map(IndexedRecord::record)
                .filter(record -> !record.createdAt().isBefore(cutoff))
                .filter(scope::matches);
    }

    @Override
    public long export(InvestigationFilter filter, ExportFormat format, OutputStream out) {
        RecordExporter exporter = RecordExporter.forFormat(format, registry);
        Iterator<InvestigationRecord> records;
        if (!gate.isEnabled()) {
            records = Collections.emptyIterator();
        } else {
            requireTenantScope(filter, "export");
            Iterator<IndexedRecord> matches =
                    index.newestFirst(filter, Long.MAX_VALUE, retentionCutoff(clock.instant()));
            records = new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return matches.hasNext();
                }

                @Override
                public InvestigationRecord next() {
                    return matches.next().record();
                }
            };
        }
        try {
            long written = exporter.write(records, out);
            LOG.debug("Exported {} records as {}", written, format.wireName());
            return written;
        } catch (IOException e) {
            LOG.warn("Export as {} failed: {}", format.wireName(), e.getMessage());
            StorageReadException failure = new StorageReadException("Export as " + format.wireName() + " failed", e);
            latch("export", failure);
            throw failure;
        }
    }

    @Override
    public StoreState state() {
        RecordIndex snapshot = index;
        return new StoreState(
                opened && !closed,
                logPath,
                snapshot.countNotExpired(retentionCutoff(clock.instant())),
                snapshot.activeBytes(),
                lastWriteAt,
                lastError.get(),
                archivedSegments);
    }

    private void requireTenantScope(InvestigationFilter filter, String operation) {
        if (filter == null) {
            throw new MissingTenantScopeException(operation);
        }
        if (config.tenantScopingRequired() && filter.missingTenantScope()) {
            throw new MissingTenantScopeException(operation);
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, writeExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StorageWriteException("Investigation store is closed", e));
        }
    }

    private void ensureWritable(String operation) {
        if (closed) {
            throw latchAndReturn(operation, new StorageWriteException("Investigation store is closed"));
        }
        if (!opened) {
            throw latchAndReturn(operation, new StorageWriteException("Investigation store is not open"));
        }
        if (logChannel == null || !logChannel.isOpen()) {
            throw latchAndReturn(operation, new StorageWriteException(
                    "Active segment " + logPath + " is unavailable; reopen the store"));
        }
    }

    private void latch(String operation, RuntimeException failure) {
        lastError.set(StorageError.of(operation, failure, clock.instant()));
    }

    private StorageWriteException latchAndReturn(String operation, StorageWriteException failure) {
        latch(operation, failure);
        return failure;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private Path sibling(String suffix) {
        return logPath.resolveSibling(logPath.getFileName() + suffix);
    }

    private void reopenLogChannel() throws IOException {
        logChannel = FileChannel.open(logPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        logChannel.position(logChannel.size());
    }

    private void closeLogChannel() {
        try {
            if (logChannel != null && logChannel.isOpen()) {
                logChannel.close();
                LOG.trace("Log channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing log channel: {}", e.getMessage());
        }
    }

    private static void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Fsyncs a directory so renames are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     */
    private static void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock beside the active segment so a second process
     * cannot append to the same log.
     *
     * @throws StorageException if another holder has the lock
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = sibling(LOCK_SUFFIX);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on " + lockPath +
                        ". Another process may be using this investigation log.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
                LOG.trace("Lock channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available before a write.
     *
     * @throws StorageWriteException if disk space is below the configured minimum
     */
    private void checkDiskSpace() throws IOException {
        long minFreeSpace = config.minFreeSpaceBytes();
        if (minFreeSpace <= 0) {
            return;
        }
        FileStore store = Files.getFileStore(logPath.getParent());
        long usableSpace = store.getUsableSpace();
        if (usableSpace < minFreeSpace) {
            long usableSpaceMb = usableSpace / 1024 / 1024;
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, config.minFreeSpaceMb());
            throw new StorageWriteException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + config.minFreeSpaceMb() + " MB");
        }
    }

    private void warnOnLowDiskSpace() {
        try {
            checkDiskSpace();
        } catch (StorageWriteException | IOException e) {
            LOG.warn("Opening investigation store with low disk space; appends will fail until space is freed: {}",
                    e.getMessage());
        }
    }
}
