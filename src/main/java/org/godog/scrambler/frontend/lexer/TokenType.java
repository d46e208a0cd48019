package org.godog.scrambler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A bare identifier, such as a variable, function, class or keyword. */
    IDENTIFIER,
    /** A token starting with a digit. */
    NUMBER,
    /** A quoted string literal, including its quotes and an optional raw prefix. */
    STRING,

    // Symbols.
    /** A comment, including its leading marker. */
    COMMENT,
    /** An operator or punctuation, possibly several characters long. */
    SYMBOL,

    // Layout.
    /** A newline character. */
    NEWLINE,
    /** One unit of leading indentation. Only produced in script mode. */
    INDENT,
    /** A run of insignificant whitespace. Only produced in modes that keep layout. */
    WHITESPACE,

    /** Represents the end of the source file. */
    END_OF_FILE
}
