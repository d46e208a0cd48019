package org.godog.scrambler.frontend.directive.features.expose;

import org.godog.scrambler.frontend.directive.DirectiveContext;
import org.godog.scrambler.frontend.directive.IDirectiveHandler;
import org.godog.scrambler.labels.BannedLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Handles {@code #GODOG_EXPOSE: a, b}: the listed names keep their source spelling
 * for the rest of the run, in every file.
 */
public class ExposeDirectiveHandler implements IDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ExposeDirectiveHandler.class);

    @Override
    public void handle(List<String> arguments, int line, DirectiveContext context) {
        BannedLabels banned = context.getScrambleContext().getBannedLabels();
        for (String name : arguments) {
            banned.banExplicitly(name);
        }
        LOG.debug("{}:{} exposes {}", context.getFileName(), line, arguments);
    }
}
