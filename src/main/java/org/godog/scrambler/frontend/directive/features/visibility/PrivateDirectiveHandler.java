package org.godog.scrambler.frontend.directive.features.visibility;

import org.godog.scrambler.frontend.directive.DirectiveContext;
import org.godog.scrambler.frontend.directive.IDirectiveHandler;
import org.godog.scrambler.frontend.rewrite.RewriteState;
import org.godog.scrambler.labels.LabelAllocator;

import java.util.List;

/**
 * Handles {@code #GODOG_PRIVATE: a, b}: the listed names get file-private labels that
 * also apply after declaration keywords such as {@code func} or {@code const}.
 */
public class PrivateDirectiveHandler implements IDirectiveHandler {

    @Override
    public void handle(List<String> arguments, int line, DirectiveContext context) {
        RewriteState state = context.getState();
        LabelAllocator labels = context.getScrambleContext().getLabels();
        for (String name : arguments) {
            state.getOrAddPrivateLabel(name, true, labels);
        }
    }
}
