package org.godog.scrambler.labels;

import java.util.function.Predicate;

/**
 * A strategy for producing opaque identifiers.
 * Implementations must be deterministic for a given configuration so that repeated runs
 * over identical input produce identical output.
 */
public interface ILabelGenerator {

    /**
     * Generates the next opaque identifier.
     *
     * @param rejected a predicate naming identifiers that must not be returned
     *                 (already issued labels, banned names)
     * @return a valid identifier for which {@code rejected} returned false
     */
    String next(Predicate<String> rejected);
}
