package org.godog.scrambler.api;

/**
 * The kind of file being scrambled. The mode selects both the lexing rules and the
 * identifier rename rules of the rewrite engine.
 */
public enum FileMode {
    /** GDScript source. The richest rule set: scopes, directives, casts and private labels. */
    SCRIPT,
    /** Shader-like text. Bare identifiers take their public label unless banned. */
    GENERIC,
    /** Scene, resource and project files. Bare identifiers are only replaced if already known. */
    SCENE_RESOURCE,
    /** A single node path segment, rewritten on behalf of a string literal. */
    PATH_FRAGMENT
}
