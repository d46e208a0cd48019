package org.godog.scrambler.frontend.directive.features.label;

import org.godog.scrambler.frontend.directive.DirectiveContext;
import org.godog.scrambler.frontend.directive.IDirectiveHandler;
import org.godog.scrambler.labels.LabelAllocator;

import java.util.List;

/**
 * Handles {@code #GODOG_LABEL: a, b}: registers public labels for names that only
 * appear inside strings built at runtime, so every file maps them the same way.
 */
public class LabelDirectiveHandler implements IDirectiveHandler {

    @Override
    public void handle(List<String> arguments, int line, DirectiveContext context) {
        LabelAllocator labels = context.getScrambleContext().getLabels();
        for (String name : arguments) {
            labels.get(name);
        }
    }
}
