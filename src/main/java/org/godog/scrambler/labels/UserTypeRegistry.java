package org.godog.scrambler.labels;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The run-wide set of type names introduced by {@code class_name} declarations.
 */
public class UserTypeRegistry {

    private final Set<String> types = new LinkedHashSet<>();

    /**
     * Registers a user type.
     * @param name The declared class name.
     * @return {@code true} if the name was not registered before.
     */
    public boolean register(String name) {
        return types.add(name);
    }

    public boolean contains(String name) {
        return types.contains(name);
    }

    public Set<String> all() {
        return Collections.unmodifiableSet(types);
    }
}
