package com.raditha.extract.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies versioned source snapshots.
 */
public interface SourceAccess {

    /**
     * Read the current text and version of a document.
     *
     * @throws IOException if the document cannot be read
     */
    SourceSnapshot snapshot(Path path) throws IOException;
}
