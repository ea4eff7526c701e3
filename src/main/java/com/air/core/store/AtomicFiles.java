package com.air.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Crash-safe file writes: content goes to a temporary sibling, is forced to
 * disk, then renamed over the target and the directory entry synced. A
 * reader sees either the old or the new file, never a partial one.
 *
 * <p>File content goes through {@link FileOutputStream} rather than an NIO
 * channel, so a write issued from an interrupted worker thread still lands.
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    static final int WRITE_ATTEMPTS = 3;

    private AtomicFiles() {}

    /** Object mapper shared by the queue and the store for their JSON files. */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes {@code content} to {@code target}, retrying transient failures.
     *
     * @throws StorageException when every attempt failed
     */
    public static void write(Path target, byte[] content) {
        IOException last = null;
        for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
            try {
                writeOnce(target, content);
                return;
            } catch (IOException e) {
                last = e;
                log.warn("Write of {} failed (attempt {}/{}): {}", target, attempt, WRITE_ATTEMPTS, e.getMessage());
            }
        }
        throw new StorageException("Failed to write " + target, last);
    }

    public static void writeString(Path target, String content) {
        write(target, content.getBytes(StandardCharsets.UTF_8));
    }

    private static void writeOnce(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            try (var out = new FileOutputStream(tmp.toFile())) {
                out.write(content);
                out.getFD().sync();
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        syncDirectory(dir);
    }

    /**
     * Forces the rename to disk. An interrupted thread skips the sync; the
     * new file is already in place and the interrupt flag stays set.
     */
    static void syncDirectory(Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (ClosedByInterruptException e) {
            log.debug("Directory sync of {} skipped: thread interrupted", dir);
        } catch (IOException e) {
            log.debug("Directory sync of {} not supported: {}", dir, e.getMessage());
        }
    }
}
