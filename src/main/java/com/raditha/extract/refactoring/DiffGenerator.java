package com.raditha.extract.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.nio.file.Path;
import java.util.List;

/**
 * Generates unified diffs for extraction previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between original and refactored code.
     *
     * @param file           Path used in the diff header
     * @param originalCode   Source before the extraction
     * @param refactoredCode Source after the extraction
     * @return Unified diff as string, empty when nothing changed
     */
    public String generateUnifiedDiff(Path file, String originalCode, String refactoredCode) {
        return generateUnifiedDiff(file, originalCode, refactoredCode, CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(Path file, String originalCode, String refactoredCode, int contextLines) {
        List<String> original = originalCode.lines().toList();
        List<String> revised = refactoredCode.lines().toList();

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        String name = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + name,
                "b/" + name,
                original,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
