package com.raditha.flowcheck.fix;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for fix previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT = 3;

    /**
     * Generate a unified diff between two versions of a file.
     *
     * @param fileName name shown in the diff header
     * @param original text before the fix
     * @param revised  text after the fix
     * @return unified diff, empty when the texts are identical
     */
    public String generateUnifiedDiff(String fileName, String original, String revised) {
        return generateUnifiedDiff(fileName, original, revised, DEFAULT_CONTEXT);
    }

    public String generateUnifiedDiff(String fileName, String original, String revised, int contextLines) {
        List<String> originalLines = Arrays.asList(original.split("\n", -1));
        List<String> revisedLines = Arrays.asList(revised.split("\n", -1));

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
