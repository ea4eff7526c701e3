package com.air.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded channel between the setup stage and the reviewer stage.
 *
 * <p>Capacity is twice the number of reviewer workers. {@link #push} blocks
 * while the queue is full, which is the only thing that keeps setup workers
 * from cutting more snapshots than the reviewers can absorb: at most
 * {@code capacity} uncollected snapshots exist at any time.
 */
public class SnapshotHandoffQueue {

    private static final Logger log = LoggerFactory.getLogger(SnapshotHandoffQueue.class);

    private final BlockingQueue<SnapshotTask> queue;
    private final int capacity;
    private final AtomicInteger highWaterMark = new AtomicInteger();

    public SnapshotHandoffQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity, true);
    }

    /**
     * Adds a task, blocking while the queue is full.
     */
    public void push(SnapshotTask task) throws InterruptedException {
        if (queue.remainingCapacity() == 0) {
            log.debug("Handoff queue full ({}), waiting to queue review {} patch {}",
                    capacity, task.reviewId(), task.patchIndex());
        }
        queue.put(task);
        highWaterMark.accumulateAndGet(queue.size(), Math::max);
    }

    /**
     * Removes the next task, blocking while the queue is empty.
     */
    public SnapshotTask pop() throws InterruptedException {
        return queue.take();
    }

    /**
     * Removes the next task, waiting at most {@code timeout}.
     */
    public Optional<SnapshotTask> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /** Removes every queued task without blocking. */
    public List<SnapshotTask> drain() {
        var drained = new ArrayList<SnapshotTask>();
        queue.drainTo(drained);
        return drained;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Largest size observed right after a push. */
    public int highWaterMark() {
        return highWaterMark.get();
    }
}
