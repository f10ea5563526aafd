package com.raditha.extract.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps documents in memory with monotonically increasing versions.
 * Edits to one document are serialized by a per-document lock.
 */
public class InMemoryDocumentStore implements SourceAccess, EditApplier {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<Path, SourceSnapshot> documents = new ConcurrentHashMap<>();
    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Add or replace a document, bumping its version.
     */
    public SourceSnapshot open(Path path, String text) {
        ReentrantLock lock = lockFor(path);
        lock.lock();
        try {
            SourceSnapshot previous = documents.get(path);
            long version = previous == null ? 1 : previous.version() + 1;
            SourceSnapshot snapshot = new SourceSnapshot(path, text, version);
            documents.put(path, snapshot);
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SourceSnapshot snapshot(Path path) {
        SourceSnapshot snapshot = documents.get(path);
        if (snapshot == null) {
            throw new NoSuchElementException("No document open for " + path);
        }
        return snapshot;
    }

    public String text(Path path) {
        return snapshot(path).text();
    }

    @Override
    public EditOutcome apply(Path path, long expectedVersion, List<TextEdit> edits) {
        ReentrantLock lock = lockFor(path);
        lock.lock();
        try {
            SourceSnapshot current = snapshot(path);
            if (current.version() != expectedVersion) {
                logger.debug("Rejecting edit of {}: version {} != {}", path, expectedVersion, current.version());
                return EditOutcome.stale(expectedVersion, current.version());
            }
            String updated = TextEdit.applyAll(current.text(), edits);
            SourceSnapshot next = new SourceSnapshot(path, updated, current.version() + 1);
            documents.put(path, next);
            return EditOutcome.applied(next.version());
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Path path) {
        return locks.computeIfAbsent(path, p -> new ReentrantLock());
    }
}
