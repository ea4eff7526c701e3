package com.air.core.queue;

import com.air.core.model.ReviewRequest;
import com.air.core.store.AtomicFiles;
import com.air.core.store.StorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable FIFO of review requests waiting for a setup worker.
 *
 * <p>The full queue content is rewritten to {@code queue.json} on every
 * change, so requests that were submitted but not yet claimed survive a
 * restart in their original order. A claimed request leaves the file at the
 * moment of the claim; requests in flight during a crash are not replayed.
 *
 * <p>Submission never blocks: the queue is logically unbounded. Backpressure
 * lives between setup and review, in {@link SnapshotHandoffQueue}.
 */
public class ReviewQueue {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueue.class);

    private final Path queueFile;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<ReviewRequest> items = new ArrayDeque<>();

    public ReviewQueue(Path queueFile) {
        this(queueFile, AtomicFiles.newMapper());
    }

    public ReviewQueue(Path queueFile, ObjectMapper mapper) {
        this.queueFile = queueFile;
        this.mapper = mapper;
        load();
    }

    /**
     * Appends a validated request and persists the queue.
     *
     * @return the request id
     * @throws StorageException if the queue could not be persisted; the request is not enqueued
     */
    public String submit(ReviewRequest request) {
        lock.lock();
        try {
            items.addLast(request);
            try {
                persist();
            } catch (StorageException e) {
                items.removeLast();
                throw e;
            }
            notEmpty.signal();
            log.info("Queued review {} ({} waiting)", request.id(), items.size());
            return request.id();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a request is available and removes it from the queue.
     */
    public ReviewRequest claim() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                notEmpty.await();
            }
            return takeFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #claim()}, but gives up after {@code timeout}.
     *
     * @return the claimed request, or empty if none arrived in time
     */
    public Optional<ReviewRequest> claim(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(takeFirst());
        } finally {
            lock.unlock();
        }
    }

    public int length() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of requests ahead of {@code reviewId}, or -1 if it is not queued.
     */
    public int positionOf(String reviewId) {
        lock.lock();
        try {
            int position = 0;
            for (var item : items) {
                if (item.id().equals(reviewId)) {
                    return position;
                }
                position++;
            }
            return -1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Estimated number of patches queued ahead of {@code reviewId}; 0 if it is not queued.
     */
    public int patchesAhead(String reviewId) {
        lock.lock();
        try {
            int patches = 0;
            for (var item : items) {
                if (item.id().equals(reviewId)) {
                    return patches;
                }
                patches += item.estimatedPatchCount();
            }
            return 0;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String reviewId) {
        return positionOf(reviewId) >= 0;
    }

    /** Queued requests in claim order. */
    public List<ReviewRequest> list() {
        lock.lock();
        try {
            return List.copyOf(items);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private ReviewRequest takeFirst() {
        ReviewRequest request = items.pollFirst();
        try {
            persist();
        } catch (StorageException e) {
            items.addFirst(request);
            throw e;
        }
        return request;
    }

    // caller holds the lock
    private void persist() {
        try {
            AtomicFiles.write(queueFile, mapper.writeValueAsBytes(new ArrayList<>(items)));
        } catch (IOException e) {
            throw new StorageException("Failed to serialize review queue", e);
        }
    }

    private void load() {
        if (!Files.exists(queueFile)) {
            return;
        }
        try {
            List<ReviewRequest> stored = mapper.readValue(queueFile.toFile(), new TypeReference<>() {});
            items.addAll(stored);
            log.info("Restored {} queued review(s) from {}", stored.size(), queueFile);
        } catch (IOException e) {
            throw new StorageException("Failed to read review queue " + queueFile, e);
        }
    }
}
