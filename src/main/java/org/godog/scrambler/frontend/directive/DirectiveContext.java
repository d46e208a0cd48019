package org.godog.scrambler.frontend.directive;

import org.godog.scrambler.ScrambleContext;
import org.godog.scrambler.frontend.rewrite.RewriteState;

/**
 * What a directive handler may touch while a file is being rewritten.
 */
public interface DirectiveContext {

    /**
     * @return The run-scoped registries.
     */
    ScrambleContext getScrambleContext();

    /**
     * @return The state of the file currently being rewritten.
     */
    RewriteState getState();

    /**
     * @return The logical name of the file currently being rewritten.
     */
    String getFileName();
}
