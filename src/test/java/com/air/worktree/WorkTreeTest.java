package com.air.worktree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkTreeTest {

    @TempDir
    Path dir;

    private Snapshotter snapshotter;
    private WorkTree tree;

    @BeforeEach
    void setUp() {
        snapshotter = mock(Snapshotter.class);
        var preparer = new TreePreparer(new ScriptedGitRunner(), new RemoteResolver(null, Map.of()), null,
                List.of(), Duration.ofSeconds(1));
        tree = new WorkTree(2, dir, preparer, snapshotter);
    }

    @Test
    @DisplayName("a bound tree cannot be bound again")
    void bindTwice() {
        try (var lease = tree.bind("alice", "r1")) {
            assertTrue(tree.isBound());
            assertEquals("r1", tree.boundReview().orElseThrow());
            var e = assertThrows(IllegalStateException.class, () -> tree.bind("bob", "r2"));
            assertTrue(e.getMessage().contains("wt-2"));
        }
        assertFalse(tree.isBound());
    }

    @Test
    @DisplayName("closing is idempotent and the tree can be rebound")
    void closeIsIdempotent() {
        var lease = tree.bind("alice", "r1");
        lease.close();
        lease.close();

        assertTrue(lease.isClosed());
        try (var next = tree.bind("bob", "r2")) {
            assertEquals("r2", next.reviewId());
            assertEquals("bob", next.owner());
            // a stale lease must not release someone else's binding
            lease.close();
            assertTrue(tree.isBound());
        }
    }

    @Test
    @DisplayName("operations on a closed lease fail")
    void operationsAfterClose() {
        var lease = tree.bind("alice", "r1");
        lease.close();

        assertThrows(IllegalStateException.class, () -> lease.snapshot(1, "c1"));
        assertThrows(IllegalStateException.class, () -> lease.index("a..b"));
        verifyNoInteractions(snapshotter);
    }

    @Test
    @DisplayName("snapshots are cut from the tree path for the bound review")
    void snapshotDelegates() throws Exception {
        var expected = new Snapshot("r1-1-abc", dir.resolve("snap"), "c1");
        when(snapshotter.create(dir, "r1", 1, "c1")).thenReturn(expected);

        try (var lease = tree.bind("alice", "r1")) {
            assertSame(expected, lease.snapshot(1, "c1"));
        }
    }
}
