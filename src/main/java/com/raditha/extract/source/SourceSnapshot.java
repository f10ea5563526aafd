package com.raditha.extract.source;

import java.nio.file.Path;

/**
 * Immutable view of a document at one version.
 *
 * @param path    Document path
 * @param text    Full source text
 * @param version Version the text belongs to; edits are checked against it
 */
public record SourceSnapshot(Path path, String text, long version) {

    public SourceSnapshot {
        if (path == null || text == null) {
            throw new IllegalArgumentException("path and text are required");
        }
    }
}
