package com.air.core.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AtomicFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void writeCreatesParentsAndReplacesContent() throws Exception {
        Path target = tempDir.resolve("a").resolve("b").resolve("record.json");

        AtomicFiles.writeString(target, "first");
        AtomicFiles.writeString(target, "second");

        assertEquals("second", Files.readString(target));
        try (var siblings = Files.list(target.getParent())) {
            assertEquals(1, siblings.count(), "temporary files must not be left behind");
        }
    }

    @Test
    void writeFromInterruptedThreadLandsAndKeepsTheFlag() throws Exception {
        Path target = tempDir.resolve("reviews").resolve("r1").resolve("record.json");
        AtomicFiles.writeString(target, "before");

        Thread.currentThread().interrupt();
        try {
            AtomicFiles.writeString(target, "after");
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals("after", Files.readString(target));
        try (var siblings = Files.list(target.getParent())) {
            assertEquals(1, siblings.count());
        }
    }

    @Test
    void directorySyncToleratesInterruptAndMissingDirectories() {
        Thread.currentThread().interrupt();
        try {
            assertDoesNotThrow(() -> AtomicFiles.syncDirectory(tempDir));
        } finally {
            Thread.interrupted();
        }
        assertDoesNotThrow(() -> AtomicFiles.syncDirectory(tempDir.resolve("missing")));
        assertDoesNotThrow(() -> AtomicFiles.syncDirectory(tempDir));
    }

    @Test
    void writeFailsWithStorageExceptionWhenParentIsAFile() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");

        var e = assertThrows(StorageException.class,
                () -> AtomicFiles.writeString(blocker.resolve("record.json"), "content"));
        assertNotNull(e.getCause());
    }
}
