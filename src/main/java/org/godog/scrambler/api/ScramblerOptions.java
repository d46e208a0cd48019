package org.godog.scrambler.api;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the {@code godog} configuration block.
 *
 * @param removeTypeCasting Whether type annotations and casts are removed from scripts.
 * @param meltEnabled Whether {@code res://} paths to structural files are validated against the project.
 * @param projectDir The project root that {@code res://} paths resolve against.
 * @param structuralExtensions Extensions of the engine's structural file types.
 * @param labelSeed Seed of the label generator.
 * @param labelLength Length of generated labels.
 * @param extraBannedFile Optional file with additional names that must never be renamed, or {@code null}.
 * @param preservedCommentPrefixes Comment prefixes that are kept verbatim for platform preprocessing.
 * @param fileModes File extension (without dot, lower case) to file mode.
 * @param excludedDirectories Directory names that are skipped when walking a project.
 * @param failFast Whether a project run stops at the first failing file.
 * @param labelMapFile Optional file the public label map is written to, or {@code null}.
 * @param indentWidth Number of spaces forming one indentation unit in space-indented scripts.
 */
public record ScramblerOptions(
        boolean removeTypeCasting,
        boolean meltEnabled,
        Path projectDir,
        List<String> structuralExtensions,
        long labelSeed,
        int labelLength,
        Path extraBannedFile,
        List<String> preservedCommentPrefixes,
        Map<String, FileMode> fileModes,
        List<String> excludedDirectories,
        boolean failFast,
        Path labelMapFile,
        int indentWidth
) {

    /**
     * Reads the options from a configuration.
     * @param config The resolved configuration; must contain the {@code godog} block.
     * @return The typed options.
     */
    public static ScramblerOptions fromConfig(Config config) {
        Config godog = config.getConfig("godog");

        Map<String, FileMode> modes = new LinkedHashMap<>();
        Config modeConfig = godog.getConfig("file-modes");
        for (String extension : modeConfig.root().keySet()) {
            modes.put(extension.toLowerCase(Locale.ROOT),
                    FileMode.valueOf(modeConfig.getString(extension).toUpperCase(Locale.ROOT)));
        }

        return new ScramblerOptions(
                godog.getBoolean("remove-type-casting"),
                godog.getBoolean("melt.enabled"),
                Path.of(godog.getString("project-dir")),
                godog.getStringList("melt.structural-extensions"),
                godog.getLong("label.seed"),
                godog.getInt("label.length"),
                godog.hasPath("label.extra-banned-file") ? Path.of(godog.getString("label.extra-banned-file")) : null,
                godog.getStringList("preserved-comment-prefixes"),
                Collections.unmodifiableMap(modes),
                godog.getStringList("excluded-directories"),
                godog.getBoolean("fail-fast"),
                godog.hasPath("label-map-file") ? Path.of(godog.getString("label-map-file")) : null,
                godog.getInt("indent-width"));
    }

    public ScramblerOptions withProjectDir(Path dir) {
        return new ScramblerOptions(removeTypeCasting, meltEnabled, dir, structuralExtensions, labelSeed, labelLength,
                extraBannedFile, preservedCommentPrefixes, fileModes, excludedDirectories, failFast, labelMapFile, indentWidth);
    }

    public ScramblerOptions withMeltEnabled(boolean enabled) {
        return new ScramblerOptions(removeTypeCasting, enabled, projectDir, structuralExtensions, labelSeed, labelLength,
                extraBannedFile, preservedCommentPrefixes, fileModes, excludedDirectories, failFast, labelMapFile, indentWidth);
    }

    public ScramblerOptions withRemoveTypeCasting(boolean remove) {
        return new ScramblerOptions(remove, meltEnabled, projectDir, structuralExtensions, labelSeed, labelLength,
                extraBannedFile, preservedCommentPrefixes, fileModes, excludedDirectories, failFast, labelMapFile, indentWidth);
    }

    public ScramblerOptions withLabelSeed(long seed) {
        return new ScramblerOptions(removeTypeCasting, meltEnabled, projectDir, structuralExtensions, seed, labelLength,
                extraBannedFile, preservedCommentPrefixes, fileModes, excludedDirectories, failFast, labelMapFile, indentWidth);
    }

    public ScramblerOptions withFailFast(boolean stopAtFirstFailure) {
        return new ScramblerOptions(removeTypeCasting, meltEnabled, projectDir, structuralExtensions, labelSeed, labelLength,
                extraBannedFile, preservedCommentPrefixes, fileModes, excludedDirectories, stopAtFirstFailure, labelMapFile, indentWidth);
    }

    public ScramblerOptions withLabelMapFile(Path file) {
        return new ScramblerOptions(removeTypeCasting, meltEnabled, projectDir, structuralExtensions, labelSeed, labelLength,
                extraBannedFile, preservedCommentPrefixes, fileModes, excludedDirectories, failFast, file, indentWidth);
    }
}
