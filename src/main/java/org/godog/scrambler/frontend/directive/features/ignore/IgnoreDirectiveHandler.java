package org.godog.scrambler.frontend.directive.features.ignore;

import org.godog.scrambler.frontend.directive.DirectiveContext;
import org.godog.scrambler.frontend.directive.IDirectiveHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Handles {@code #GODOG_IGNORE}, which opens and closes a block whose tokens are all deleted.
 * Any payload after the marker is ignored.
 */
public class IgnoreDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(IgnoreDirectiveHandler.class);

    @Override
    public void handle(List<String> arguments, int line, DirectiveContext context) {
        boolean opened = context.getState().toggleSpecialBlock();
        LOG.debug("{}:{} {} ignore block", context.getFileName(), line, opened ? "opens" : "closes");
    }
}
