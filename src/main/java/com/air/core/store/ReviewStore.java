package com.air.core.store;

import com.air.core.model.PatchRecord;
import com.air.core.model.PatchState;
import com.air.core.model.ReviewFormat;
import com.air.core.model.ReviewRecord;
import com.air.core.model.ReviewRequest;
import com.air.core.model.ReviewStatus;
import com.air.core.model.ReviewSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Durable metadata and result store.
 *
 * <p>Layout under the results directory:
 * <pre>
 *   summary.json
 *   reviews/&lt;id&gt;/record.json
 *   reviews/&lt;id&gt;/message
 *   reviews/&lt;id&gt;/&lt;n&gt;/patch
 *   reviews/&lt;id&gt;/&lt;n&gt;/review.json | review.md | review-inline.txt
 * </pre>
 *
 * <p>Every update replaces the whole {@link ReviewRecord} under a lock scoped
 * to that review, writes it atomically, then publishes the new immutable
 * instance to the in-memory cache. Readers only ever see complete records.
 * Updates to different reviews never contend; the summary file has its own
 * lock and is rewritten only on status transitions.
 */
public class ReviewStore {

    private static final Logger log = LoggerFactory.getLogger(ReviewStore.class);

    static final String RECORD_FILE = "record.json";
    static final String SUMMARY_FILE = "summary.json";
    static final String MESSAGE_FILE = "message";
    static final String PATCH_INPUT_FILE = "patch";
    static final String INTERRUPTED_MESSAGE = "interrupted by service restart";

    private final Path resultsPath;
    private final Path reviewsDir;
    private final ObjectMapper mapper;
    private final Map<String, ReviewRecord> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Object summaryLock = new Object();

    public ReviewStore(Path resultsPath) {
        this(resultsPath, AtomicFiles.newMapper());
    }

    public ReviewStore(Path resultsPath, ObjectMapper mapper) {
        this.resultsPath = resultsPath;
        this.reviewsDir = resultsPath.resolve("reviews");
        this.mapper = mapper;
        load();
    }

    public Path resultsPath() {
        return resultsPath;
    }

    // --- lifecycle transitions ---

    public ReviewRecord create(ReviewRequest request) {
        var record = ReviewRecord.queued(request);
        Object lock = lockFor(record.id());
        synchronized (lock) {
            if (cache.containsKey(record.id())) {
                throw new IllegalStateException("Review " + record.id() + " already exists");
            }
            persist(record);
        }
        writeSummary();
        return record;
    }

    public ReviewRecord markSetupStarted(String id) {
        return update(id, r -> r.withStatus(ReviewStatus.SETUP_IN_PROGRESS).withSetupStarted(Instant.now()));
    }

    /**
     * Stores the prepared patch list. Masked patches arrive already {@code skipped}.
     */
    public ReviewRecord recordPatches(String id, List<PatchRecord> patches) {
        return update(id, r -> r.withPatches(patches));
    }

    /**
     * Records that every snapshot for the review has been handed off. If no
     * patch is still pending the review completes here.
     */
    public ReviewRecord markSetupCompleted(String id) {
        return update(id, r -> finishIfComplete(r.withSetupCompleted(Instant.now())));
    }

    /**
     * Fails the whole review: status {@code error}, message recorded, no patch results.
     */
    public ReviewRecord failRequest(String id, String message) {
        return update(id, r -> {
            if (r.status().isTerminal()) {
                return r;
            }
            return r.withStatus(ReviewStatus.ERROR)
                    .withMessage(message)
                    .withPatches(List.of())
                    .withCompleted(Instant.now());
        });
    }

    /**
     * A reviewer worker picked up patch {@code index}. The first call for a
     * review moves it to {@code reviewing}.
     */
    public ReviewRecord markReviewerStarted(String id, int index, String snapshotId) {
        return update(id, r -> {
            if (r.patch(index) == null) {
                return r;
            }
            var now = Instant.now();
            var next = r.withPatch(r.patch(index).claimed(snapshotId, now)).withReviewStarted(now);
            if (!next.status().isTerminal()) {
                next = next.withStatus(ReviewStatus.REVIEWING);
            }
            return next;
        });
    }

    /** Marks patch {@code index} reviewed, with {@code resultPath} relative to the review directory. */
    public ReviewRecord completePatch(String id, int index, String resultPath, int attempts) {
        return update(id, r -> r.patch(index) == null ? r : finishIfComplete(
                r.withPatch(r.patch(index).done(resultPath, attempts, Instant.now()))));
    }

    /** Marks patch {@code index} as a terminal per-patch error. */
    public ReviewRecord failPatch(String id, int index, String message, int attempts) {
        return update(id, r -> r.patch(index) == null ? r : finishIfComplete(
                r.withPatch(r.patch(index).failed(message, attempts, Instant.now()))));
    }

    /**
     * Marks every non-terminal review that is no longer queued as failed.
     * Run once at start, before any worker is started.
     *
     * @param stillQueued whether a review id is still in the durable queue
     * @return number of reviews marked
     */
    public int recoverInterrupted(Predicate<String> stillQueued) {
        int recovered = 0;
        for (var record : List.copyOf(cache.values())) {
            if (record.status().isTerminal() || stillQueued.test(record.id())) {
                continue;
            }
            log.warn("Review {} was {} at shutdown, marking as error", record.id(), record.status().label());
            failRequest(record.id(), INTERRUPTED_MESSAGE);
            writeMessage(record.id(), INTERRUPTED_MESSAGE);
            recovered++;
        }
        return recovered;
    }

    // --- queries ---

    public Optional<ReviewRecord> get(String id) {
        return Optional.ofNullable(cache.get(id));
    }

    /**
     * Most recently submitted reviews first.
     *
     * @param owner only this owner's reviews, or all when {@code null}
     * @param limit maximum number of records, non-positive for no limit
     */
    public List<ReviewRecord> list(String owner, int limit) {
        Stream<ReviewRecord> stream = cache.values().stream()
                .filter(r -> owner == null || owner.equals(r.owner()))
                .sorted(Comparator.comparing(ReviewRecord::submitted).reversed());
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return stream.toList();
    }

    public ReviewSummary summary() {
        var counts = new EnumMap<ReviewStatus, Long>(ReviewStatus.class);
        for (var record : cache.values()) {
            counts.merge(record.status(), 1L, Long::sum);
        }
        return new ReviewSummary(counts);
    }

    // --- artifacts ---

    public Path reviewDir(String id) {
        return reviewsDir.resolve(id);
    }

    public Path patchDir(String id, int index) {
        Path dir = reviewDir(id).resolve(String.valueOf(index));
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Failed to create " + dir, e);
        }
        return dir;
    }

    public void writeMessage(String id, String message) {
        AtomicFiles.writeString(reviewDir(id).resolve(MESSAGE_FILE), message);
    }

    public Optional<String> readMessage(String id) {
        return readIfExists(reviewDir(id).resolve(MESSAGE_FILE));
    }

    public void writePatchInput(String id, int index, String content) {
        AtomicFiles.writeString(patchDir(id, index).resolve(PATCH_INPUT_FILE), content);
    }

    /** Relative path of the review document for patch {@code index}, as stored in {@link PatchRecord#result()}. */
    public static String resultPath(int index, ReviewFormat format) {
        return index + "/" + format.fileName();
    }

    public Optional<String> readReviewFile(String id, int index, ReviewFormat format) {
        return readIfExists(reviewDir(id).resolve(String.valueOf(index)).resolve(format.fileName()));
    }

    // --- internals ---

    private ReviewRecord update(String id, UnaryOperator<ReviewRecord> change) {
        ReviewRecord before;
        ReviewRecord after;
        synchronized (lockFor(id)) {
            before = cache.get(id);
            if (before == null) {
                throw new IllegalArgumentException("Unknown review: " + id);
            }
            after = change.apply(before);
            if (after.equals(before)) {
                return before;
            }
            persist(after);
        }
        if (after.status() != before.status()) {
            log.info("Review {} {} -> {}", id, before.status().label(), after.status().label());
            writeSummary();
        }
        return after;
    }

    private static ReviewRecord finishIfComplete(ReviewRecord r) {
        if (r.status().isTerminal() || r.setupCompleted() == null || r.hasPendingPatches()) {
            return r;
        }
        long failed = r.countPatches(PatchState.ERROR);
        long reviewed = r.patchCount() - r.countPatches(PatchState.SKIPPED);
        var done = r.withStatus(ReviewStatus.DONE).withCompleted(Instant.now());
        if (failed > 0) {
            done = done.withMessage(failed + " of " + reviewed + " patches failed review");
        }
        return done;
    }

    // caller holds the record lock
    private void persist(ReviewRecord record) {
        try {
            AtomicFiles.write(reviewDir(record.id()).resolve(RECORD_FILE), mapper.writeValueAsBytes(record));
        } catch (IOException e) {
            throw new StorageException("Failed to serialize review " + record.id(), e);
        }
        cache.put(record.id(), record);
    }

    private void writeSummary() {
        synchronized (summaryLock) {
            var summary = summary();
            var labelled = new LinkedHashMap<String, Long>();
            for (var status : ReviewStatus.values()) {
                labelled.put(status.label(), summary.count(status));
            }
            try {
                AtomicFiles.write(resultsPath.resolve(SUMMARY_FILE), mapper.writeValueAsBytes(labelled));
            } catch (IOException e) {
                throw new StorageException("Failed to serialize review summary", e);
            }
        }
    }

    private Object lockFor(String id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    private void load() {
        if (!Files.isDirectory(reviewsDir)) {
            return;
        }
        try (Stream<Path> dirs = Files.list(reviewsDir)) {
            dirs.map(d -> d.resolve(RECORD_FILE)).filter(Files::isRegularFile).forEach(file -> {
                try {
                    var record = mapper.readValue(file.toFile(), ReviewRecord.class);
                    cache.put(record.id(), record);
                } catch (IOException e) {
                    log.error("Skipping unreadable review record {}: {}", file, e.getMessage());
                }
            });
        } catch (IOException e) {
            throw new StorageException("Failed to list " + reviewsDir, e);
        }
        log.info("Loaded {} review record(s) from {}", cache.size(), reviewsDir);
    }

    private static Optional<String> readIfExists(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
