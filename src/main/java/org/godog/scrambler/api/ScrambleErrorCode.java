package org.godog.scrambler.api;

/**
 * Defines unique, testable error codes for all fatal conditions of a scramble run.
 * This decouples the test logic from the translated error messages.
 */
public enum ScrambleErrorCode {
    // region Rewrite Errors
    /** A string literal is formatted through a placeholder-based {@code .format(...)} call. */
    UNSUPPORTED_FORMATTING,
    /** A resolved structural resource path contains a '%' and can therefore be built at runtime. */
    ILLEGAL_DYNAMIC_PATH,
    /** A resolved structural resource path does not exist in the project. */
    MISSING_RESOURCE,
    /** An ignore block was opened but never closed before the end of the file. */
    UNTERMINATED_SPECIAL_BLOCK,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a source file. */
    IO_ERROR_READING_FILE,
    /** An I/O error occurred while writing a scrambled or copied file. */
    IO_ERROR_WRITING_FILE
    // endregion
}
