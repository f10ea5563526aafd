package com.raditha.extract.model;

import com.github.javaparser.ast.CompilationUnit;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.source.LineIndex;
import com.raditha.extract.source.SourceSnapshot;

/**
 * Per-request analysis input: the snapshot, its parse tree and the configuration in force.
 * Never shared between requests.
 *
 * @param snapshot        Source text and version
 * @param compilationUnit Tree parsed from the snapshot with a symbol resolver attached
 * @param lineIndex       Position to offset mapping for the snapshot text
 * @param config          Extraction configuration
 */
public record AnalysisContext(
        SourceSnapshot snapshot,
        CompilationUnit compilationUnit,
        LineIndex lineIndex,
        ExtractionConfig config) {
}
