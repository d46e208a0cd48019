package org.godog.scrambler.frontend.directive;

import java.util.List;

/**
 * Recognizes comments that must survive verbatim because a platform-specific preprocessor
 * consumes them after scrambling.
 */
public class PreservedCommentClassifier {

    private final List<String> prefixes;

    /**
     * @param prefixes Whitespace-free comment prefixes, e.g. {@code #GODOG_IF:}.
     */
    public PreservedCommentClassifier(List<String> prefixes) {
        this.prefixes = List.copyOf(prefixes);
    }

    /**
     * @param strippedComment The comment text with all whitespace removed.
     * @return {@code true} if the comment must be kept.
     */
    public boolean isPreserved(String strippedComment) {
        for (String prefix : prefixes) {
            if (strippedComment.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
