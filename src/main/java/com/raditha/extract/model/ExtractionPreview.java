package com.raditha.extract.model;

/**
 * Before and after views of the file.
 *
 * @param originalSource Source text of the snapshot
 * @param modifiedSource Source text with both edits applied
 * @param unifiedDiff    Unified diff between the two
 */
public record ExtractionPreview(String originalSource, String modifiedSource, String unifiedDiff) {
}
