package com.raditha.extract.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.CRC32;

/**
 * Reads and writes documents on disk. The version of a file is the CRC32 of its bytes,
 * so any external change to the file makes older snapshots stale.
 */
public class FileDocumentStore implements SourceAccess, EditApplier {

    private static final Logger logger = LoggerFactory.getLogger(FileDocumentStore.class);

    private final Map<Path, Object> locks = new ConcurrentHashMap<>();
    private final Map<Path, byte[]> backups = new HashMap<>();

    @Override
    public SourceSnapshot snapshot(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return new SourceSnapshot(path, new String(bytes, StandardCharsets.UTF_8), checksum(bytes));
    }

    @Override
    public EditOutcome apply(Path path, long expectedVersion, List<TextEdit> edits) throws IOException {
        synchronized (lockFor(path)) {
            byte[] original = Files.readAllBytes(path);
            long current = checksum(original);
            if (current != expectedVersion) {
                logger.debug("Rejecting edit of {}: checksum changed", path.getFileName());
                return EditOutcome.stale(expectedVersion, current);
            }

            String updated = TextEdit.applyAll(new String(original, StandardCharsets.UTF_8), edits);
            byte[] updatedBytes = updated.getBytes(StandardCharsets.UTF_8);

            createBackup(path, original);
            try {
                write(path, updatedBytes);
            } catch (IOException e) {
                rollback(path);
                throw e;
            }
            clearBackup(path);

            logger.info("Applied {} edits to {}", edits.size(), path.getFileName());
            return EditOutcome.applied(checksum(updatedBytes));
        }
    }

    /**
     * Write through a temporary file in the same directory, then move it into place.
     */
    private void write(Path path, byte[] content) throws IOException {
        Path directory = path.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void createBackup(Path path, byte[] content) {
        synchronized (backups) {
            backups.put(path, content);
        }
    }

    private void clearBackup(Path path) {
        synchronized (backups) {
            backups.remove(path);
        }
    }

    private void rollback(Path path) throws IOException {
        byte[] content;
        synchronized (backups) {
            content = backups.remove(path);
        }
        if (content != null) {
            logger.warn("Write to {} failed, restoring original content", path.getFileName());
            Files.write(path, content);
        }
    }

    private Object lockFor(Path path) {
        return locks.computeIfAbsent(path.toAbsolutePath().normalize(), p -> new Object());
    }

    static long checksum(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes);
        return crc.getValue();
    }
}
