package org.godog.scrambler;

import org.godog.scrambler.api.ScramblerOptions;
import org.godog.scrambler.frontend.directive.PreservedCommentClassifier;
import org.godog.scrambler.labels.BannedLabels;
import org.godog.scrambler.labels.LabelAllocator;
import org.godog.scrambler.labels.SeededLabelGenerator;
import org.godog.scrambler.labels.UserTypeRegistry;

import java.io.IOException;

/**
 * The state shared by every file of one scramble run.
 * <p>
 * The registries only grow during a run and later files depend on what earlier files
 * registered, so a context must be used by one thread at a time and never be reset mid-run.
 */
public class ScrambleContext {

    private final ScramblerOptions options;
    private final BannedLabels bannedLabels;
    private final LabelAllocator labels;
    private final UserTypeRegistry userTypes;
    private final PreservedCommentClassifier preservedComments;
    private boolean preservedBlocksDetected = false;

    /**
     * Creates a context from its parts.
     * @param options The run options.
     * @param bannedLabels The names that must never be renamed.
     * @param labels The public label allocator.
     * @param userTypes The registry of {@code class_name} types.
     */
    public ScrambleContext(ScramblerOptions options, BannedLabels bannedLabels, LabelAllocator labels, UserTypeRegistry userTypes) {
        this.options = options;
        this.bannedLabels = bannedLabels;
        this.labels = labels;
        this.userTypes = userTypes;
        this.preservedComments = new PreservedCommentClassifier(options.preservedCommentPrefixes());
    }

    /**
     * Creates a fresh context for a run: engine labels from the classpath, the optional extra
     * banned file, and a seeded label generator.
     * @param options The run options.
     * @return A new context.
     * @throws IOException if the extra banned file cannot be read.
     */
    public static ScrambleContext create(ScramblerOptions options) throws IOException {
        BannedLabels banned = BannedLabels.withEngineDefaults();
        if (options.extraBannedFile() != null) {
            banned.addFromFile(options.extraBannedFile());
        }
        LabelAllocator labels = new LabelAllocator(new SeededLabelGenerator(options.labelSeed(), options.labelLength()), banned);
        return new ScrambleContext(options, banned, labels, new UserTypeRegistry());
    }

    public ScramblerOptions getOptions() {
        return options;
    }

    public BannedLabels getBannedLabels() {
        return bannedLabels;
    }

    public LabelAllocator getLabels() {
        return labels;
    }

    public UserTypeRegistry getUserTypes() {
        return userTypes;
    }

    public PreservedCommentClassifier getPreservedComments() {
        return preservedComments;
    }

    public boolean isPreservedBlocksDetected() {
        return preservedBlocksDetected;
    }

    /**
     * Signals that a comment was kept for platform-specific preprocessing.
     */
    public void markPreservedBlocksDetected() {
        this.preservedBlocksDetected = true;
    }
}
