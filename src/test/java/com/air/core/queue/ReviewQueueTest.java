package com.air.core.queue;

import com.air.core.model.Origin;
import com.air.core.model.ReviewRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReviewQueueTest {

    @TempDir
    Path tempDir;

    private Path queueFile;
    private ReviewQueue queue;

    @BeforeEach
    void setUp() {
        queueFile = tempDir.resolve("queue.json");
        queue = new ReviewQueue(queueFile);
    }

    private static ReviewRequest request(String hash) {
        return ReviewRequest.create("alice", "netdev/net", null, new Origin.SingleCommit(hash), null);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("claims in submission order")
        void fifo() throws Exception {
            var a = request("aaaa1");
            var b = request("bbbb2");
            var c = request("cccc3");
            queue.submit(a);
            queue.submit(b);
            queue.submit(c);

            assertEquals(3, queue.length());
            assertEquals(a.id(), queue.claim().id());
            assertEquals(b.id(), queue.claim().id());
            assertEquals(c.id(), queue.claim().id());
            assertEquals(0, queue.length());
        }

        @Test
        @DisplayName("claim with timeout returns empty when nothing arrives")
        void claimTimeout() throws Exception {
            assertTrue(queue.claim(Duration.ofMillis(50)).isEmpty());
        }

        @Test
        @DisplayName("blocked claim wakes up on submit")
        void claimWakesOnSubmit() throws Exception {
            var r = request("aaaa1");
            var claimed = new ArrayList<ReviewRequest>();
            var thread = new Thread(() -> {
                try {
                    claimed.add(queue.claim());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            thread.start();
            Thread.sleep(50);
            queue.submit(r);
            thread.join(5000);

            assertEquals(1, claimed.size());
            assertEquals(r.id(), claimed.get(0).id());
        }
    }

    @Nested
    @DisplayName("Position")
    class Position {

        @Test
        @DisplayName("positionOf and patchesAhead count what is queued in front")
        void positionAndPatchesAhead() {
            var series = ReviewRequest.create("a", "net", null, new Origin.Series(11), null);
            var literal = ReviewRequest.create("a", "net", null,
                    new Origin.LiteralPatches(List.of("p1", "p2", "p3")), null);
            var last = request("dddd4");
            queue.submit(series);
            queue.submit(literal);
            queue.submit(last);

            assertEquals(0, queue.positionOf(series.id()));
            assertEquals(2, queue.positionOf(last.id()));
            assertEquals(0, queue.patchesAhead(series.id()));
            assertEquals(1, queue.patchesAhead(literal.id()));
            assertEquals(4, queue.patchesAhead(last.id()));
            assertEquals(-1, queue.positionOf("missing"));
            assertEquals(0, queue.patchesAhead("missing"));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("each request is claimed by exactly one of many consumers")
        void exactlyOnceClaim() throws Exception {
            int requests = 200;
            var submitted = new ArrayList<String>();
            for (int i = 0; i < requests; i++) {
                var r = request(String.format("%08x", i + 0x1000));
                submitted.add(r.id());
                queue.submit(r);
            }

            Set<String> seen = ConcurrentHashMap.newKeySet();
            List<String> duplicates = Collections.synchronizedList(new ArrayList<>());
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var done = new CountDownLatch(8);
            for (int t = 0; t < 8; t++) {
                pool.execute(() -> {
                    try {
                        while (true) {
                            var next = queue.claim(Duration.ofMillis(100));
                            if (next.isEmpty()) {
                                break;
                            }
                            if (!seen.add(next.get().id())) {
                                duplicates.add(next.get().id());
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(30, TimeUnit.SECONDS));
            pool.shutdownNow();

            assertTrue(duplicates.isEmpty(), "claimed twice: " + duplicates);
            assertEquals(Set.copyOf(submitted), seen);
        }
    }

    @Nested
    @DisplayName("Durability")
    class Durability {

        @Test
        @DisplayName("unclaimed requests survive a restart in order")
        void reloadKeepsOrder() throws Exception {
            var a = request("aaaa1");
            var b = ReviewRequest.create("bob", "net", "main", new Origin.CommitRange("v1..v2"),
                    List.of(true, false));
            var c = ReviewRequest.create("carol", "net", null,
                    new Origin.LiteralPatches(List.of("diff --git a b")), List.of(true));
            queue.submit(a);
            queue.submit(b);
            queue.submit(c);
            queue.claim();

            var reloaded = new ReviewQueue(queueFile);
            assertEquals(2, reloaded.length());
            var first = reloaded.claim();
            assertEquals(b, first);
            assertEquals(List.of(true, false), first.mask());
            assertEquals(c, reloaded.claim());
        }

        @Test
        @DisplayName("queue file holds only unclaimed requests")
        void claimRewritesFile() throws Exception {
            var a = request("aaaa1");
            queue.submit(a);
            assertTrue(Files.readString(queueFile).contains(a.id()));
            queue.claim();
            assertFalse(Files.readString(queueFile).contains(a.id()));
        }

        @Test
        @DisplayName("a missing queue file means an empty queue")
        void missingFile() {
            assertEquals(0, new ReviewQueue(tempDir.resolve("absent").resolve("queue.json")).length());
        }
    }
}
