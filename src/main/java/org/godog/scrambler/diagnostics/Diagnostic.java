package org.godog.scrambler.diagnostics;

/**
 * Represents a single non-fatal diagnostic message raised while lexing a file.
 *
 * @param type The type of the diagnostic (e.g., WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem worth reporting that does not stop the file from being scrambled. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
