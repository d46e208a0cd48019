package org.godog.scrambler.frontend.strings;

import org.godog.scrambler.api.ScrambleException;

/**
 * Rewrites a single segment of a node path.
 */
@FunctionalInterface
public interface SegmentRewriter {

    /**
     * Rewrites a path segment.
     * @param segment The segment text, without separators.
     * @return The rewritten segment.
     * @throws ScrambleException if rewriting the segment hits a fatal condition.
     */
    String rewrite(String segment) throws ScrambleException;
}
