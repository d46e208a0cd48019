package org.godog.scrambler.frontend.directive;

import java.util.List;

/**
 * The base interface for all directive handlers.
 * Each handler is responsible for one directive comment (e.g., {@code #GODOG_PRIVATE:}).
 */
public interface IDirectiveHandler {

    /**
     * Applies the directive.
     *
     * @param arguments The comma-separated payload of the directive with empty entries removed.
     *                  Directives without a payload receive an empty list.
     * @param line The source line of the directive comment.
     * @param context The context of the file being rewritten.
     */
    void handle(List<String> arguments, int line, DirectiveContext context);
}
