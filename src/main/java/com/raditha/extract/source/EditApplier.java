package com.raditha.extract.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Applies a set of text edits to a document as one atomic change.
 */
public interface EditApplier {

    /**
     * Apply the edits if the document is still at the expected version.
     * Either every edit is applied or none is.
     *
     * @param path            Document to change
     * @param expectedVersion Version the edits were computed against
     * @param edits           Non-overlapping edits in any order
     * @return applied outcome with the new version, or a stale outcome
     * @throws IOException if the document cannot be written
     */
    EditOutcome apply(Path path, long expectedVersion, List<TextEdit> edits) throws IOException;
}
