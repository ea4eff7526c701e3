package com.air.worktree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CopyOnWriteSnapshotterTest {

    @TempDir
    Path dir;

    private ScriptedGitRunner git;
    private Path tree;
    private Path snapshots;

    @BeforeEach
    void setUp() throws IOException {
        tree = Files.createDirectories(dir.resolve("wt-1"));
        snapshots = dir.resolve("snapshots");
        // cp creates the destination directory, like the real copy would
        git = new ScriptedGitRunner().onCall("cp -a", cmd -> {
            try {
                Files.createDirectories(Path.of(cmd.get(cmd.size() - 1)));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return ScriptedGitRunner.ok(cmd, "");
        });
    }

    @Nested
    @DisplayName("Create")
    class Create {

        @Test
        @DisplayName("copies the tree and resets the copy to the commit")
        void copiesAndResets() throws Exception {
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.AUTO, false);

            var snapshot = snapshotter.create(tree, "r1", 3, "c3");

            assertTrue(snapshot.id().startsWith("r1-3-"));
            assertEquals(snapshots.resolve(snapshot.id()), snapshot.path());
            assertEquals("c3", snapshot.commit());
            assertTrue(Files.isDirectory(snapshot.path()));
            assertTrue(git.ran("cp -a --reflink=auto " + tree + " " + snapshot.path()));
            assertTrue(git.ran("git reset --hard -q c3"));
        }

        @Test
        @DisplayName("snapshot ids are unique per call")
        void uniqueIds() throws Exception {
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.AUTO, false);

            assertNotEquals(snapshotter.create(tree, "r1", 1, "c1").id(),
                    snapshotter.create(tree, "r1", 1, "c1").id());
        }

        @Test
        @DisplayName("copy failure leaves nothing behind")
        void copyFails() {
            git.fail("cp -a", "cp: failed to clone: Operation not supported");
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.ALWAYS, false);

            var e = assertThrows(SnapshotException.class, () -> snapshotter.create(tree, "r1", 1, "c1"));
            assertTrue(e.getMessage().startsWith("Failed to copy work tree"));
        }

        @Test
        @DisplayName("reset failure removes the partial copy")
        void resetFails() throws Exception {
            git.fail("git reset", "fatal: bad object c1");
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.AUTO, false);

            var e = assertThrows(SnapshotException.class, () -> snapshotter.create(tree, "r1", 1, "c1"));
            assertTrue(e.getMessage().contains("bad object c1"));
            try (var left = Files.list(snapshots)) {
                assertEquals(0, left.count());
            }
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("removes the snapshot directory")
        void deletes() throws Exception {
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.AUTO, false);
            var snapshot = snapshotter.create(tree, "r1", 1, "c1");
            Files.writeString(snapshot.path().resolve("file.c"), "int x;");

            snapshotter.delete(snapshot);

            assertFalse(Files.exists(snapshot.path()));
        }

        @Test
        @DisplayName("keep mode retains snapshots")
        void keeps() throws Exception {
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.AUTO, true);
            var snapshot = snapshotter.create(tree, "r1", 1, "c1");

            snapshotter.delete(snapshot);

            assertTrue(Files.isDirectory(snapshot.path()));
        }
    }

    @Nested
    @DisplayName("Probe")
    class Probe {

        @Test
        @DisplayName("auto mode does not probe")
        void autoSkips() {
            new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.AUTO, false).probe();
            assertTrue(git.commandLines().isEmpty());
        }

        @Test
        @DisplayName("always mode fails when reflinks are unsupported")
        void alwaysFails() {
            git.fail("cp --reflink=always", "cp: failed to clone: Operation not supported");
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.ALWAYS, false);

            var e = assertThrows(IllegalStateException.class, snapshotter::probe);
            assertTrue(e.getMessage().contains("air.snapshot.reflink=auto"));
            assertFalse(Files.exists(snapshots.resolve(".reflink-probe")));
        }

        @Test
        @DisplayName("always mode passes when reflinks work")
        void alwaysPasses() {
            var snapshotter = new CopyOnWriteSnapshotter(git, snapshots, ReflinkMode.ALWAYS, false);

            assertDoesNotThrow(snapshotter::probe);
            assertTrue(git.ran("cp --reflink=always"));
        }
    }
}
