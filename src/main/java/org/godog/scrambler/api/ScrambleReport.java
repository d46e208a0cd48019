package org.godog.scrambler.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a project-wide scramble run.
 *
 * @param scrambledFiles Files that were rewritten.
 * @param copiedFiles Files that were copied without changes.
 * @param failures Files that failed, with the reason.
 * @param publicLabelCount Number of public labels allocated during the run.
 * @param preservedBlocksDetected Whether any preserved preprocessor comment was kept.
 */
public record ScrambleReport(
        List<Path> scrambledFiles,
        List<Path> copiedFiles,
        List<ScrambleException> failures,
        int publicLabelCount,
        boolean preservedBlocksDetected
) {
    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
