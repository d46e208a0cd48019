package org.godog.scrambler.frontend.directive;

import org.godog.scrambler.frontend.directive.features.expose.ExposeDirectiveHandler;
import org.godog.scrambler.frontend.directive.features.ignore.IgnoreDirectiveHandler;
import org.godog.scrambler.frontend.directive.features.label.LabelDirectiveHandler;
import org.godog.scrambler.frontend.directive.features.visibility.PrivateDirectiveHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for directive handlers. This class holds a map of directive markers
 * to their corresponding handlers. Markers are matched as prefixes of a comment whose
 * whitespace has been removed.
 */
public class DirectiveHandlerRegistry {
    private final Map<String, IDirectiveHandler> handlers = new LinkedHashMap<>();

    /**
     * A directive found in a comment.
     *
     * @param handler The handler registered for the marker.
     * @param arguments The parsed payload.
     */
    public record DirectiveMatch(IDirectiveHandler handler, List<String> arguments) {}

    /**
     * Registers a new directive handler.
     * @param marker The whitespace-free comment prefix (e.g., "#GODOG_LABEL:").
     * @param handler The handler for the directive.
     */
    public void register(String marker, IDirectiveHandler handler) {
        handlers.put(marker, handler);
    }

    /**
     * Finds the directive a comment carries.
     * @param strippedComment The comment text with all whitespace removed.
     * @return The match, or empty if the comment is not a directive.
     */
    public Optional<DirectiveMatch> find(String strippedComment) {
        for (Map.Entry<String, IDirectiveHandler> entry : handlers.entrySet()) {
            if (strippedComment.startsWith(entry.getKey())) {
                String payload = strippedComment.substring(entry.getKey().length());
                return Optional.of(new DirectiveMatch(entry.getValue(), splitPayload(payload)));
            }
        }
        return Optional.empty();
    }

    private static List<String> splitPayload(String payload) {
        List<String> arguments = new ArrayList<>();
        for (String entry : payload.split(",")) {
            if (!entry.isEmpty()) {
                arguments.add(entry);
            }
        }
        return arguments;
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();
        registry.register("#GODOG_EXPOSE:", new ExposeDirectiveHandler());
        registry.register("#GODOG_IGNORE", new IgnoreDirectiveHandler());
        registry.register("#GODOG_LABEL:", new LabelDirectiveHandler());
        registry.register("#GODOG_PRIVATE:", new PrivateDirectiveHandler());
        return registry;
    }
}
