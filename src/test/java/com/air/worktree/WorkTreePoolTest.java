package com.air.worktree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class WorkTreePoolTest {

    @TempDir
    Path dir;

    private ScriptedGitRunner git;
    private TreePreparer preparer;
    private Path base;
    private Path worktrees;

    @BeforeEach
    void setUp() {
        git = new ScriptedGitRunner();
        preparer = new TreePreparer(git, new RemoteResolver(null, Map.of()), null, List.of(), Duration.ofSeconds(1));
        base = dir.resolve("linux");
        worktrees = dir.resolve("worktrees");
    }

    private WorkTreePool pool(int size) {
        return new WorkTreePool(base, worktrees, size, git, preparer, mock(Snapshotter.class));
    }

    @Test
    @DisplayName("missing trees are cloned, existing ones reused")
    void initialize() throws Exception {
        Files.createDirectories(worktrees.resolve("wt-2").resolve(".git"));
        var pool = pool(3);

        pool.initialize();
        pool.initialize();

        var clones = git.commandLines().stream().filter(l -> l.startsWith("git clone")).toList();
        assertEquals(2, clones.size());
        assertTrue(clones.get(0).startsWith("git clone --shared --no-checkout " + base.toAbsolutePath()));
        assertTrue(clones.get(0).endsWith("wt-1"));
        assertTrue(clones.get(1).endsWith("wt-3"));
        assertEquals(3, pool.trees().size());
        assertEquals("wt-3", pool.tree(3).name());
        assertEquals(0, pool.boundCount());
    }

    @Test
    @DisplayName("clone failure is fatal")
    void cloneFails() {
        git.fail("git clone", "fatal: repository does not exist");

        var e = assertThrows(IllegalStateException.class, () -> pool(1).initialize());
        assertTrue(e.getMessage().contains("repository does not exist"));
    }

    @Test
    @DisplayName("trees are unavailable before initialization")
    void notInitialized() {
        assertThrows(IllegalStateException.class, () -> pool(2).tree(1));
        assertThrows(IllegalArgumentException.class, () -> pool(0));
    }

    @Test
    @DisplayName("bound trees are counted")
    void boundCount() {
        var pool = pool(2);
        pool.initialize();

        try (var lease = pool.tree(1).bind("alice", "r1")) {
            assertEquals(1, pool.boundCount());
        }
        assertEquals(0, pool.boundCount());
    }
}
