package org.godog.scrambler.frontend.lexer;

/**
 * Represents a single token extracted from a source file by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, string, newline).
 * @param text The exact text of the token from the source file.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {
    /**
     * Checks whether this token has exactly the given text.
     * @param expected The text to compare with.
     * @return {@code true} if the texts are equal.
     */
    public boolean is(String expected) {
        return text.equals(expected);
    }
}
