package org.godog.scrambler.frontend.lexer;

import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.diagnostics.DiagnosticsEngine;
import org.godog.scrambler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer converts the text of a script, scene or shader file into a flat sequence of tokens.
 * <p>
 * In {@link FileMode#SCRIPT} mode newlines and leading indentation units are tokens of their own,
 * because scope is defined by indentation. The other modes keep every whitespace run so the
 * file can be reassembled verbatim.
 */
public class Lexer {

    private static final Set<String> THREE_CHAR_OPERATORS = Set.of("**=", "<<=", ">>=");
    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "==", "!=", "<=", ">=", "->", ":=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "<<", ">>", "**", "&&", "||", "..");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final FileMode mode;
    private final String logicalFileName;
    private final int indentWidth;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;
    private boolean atLineStart = true;
    private int detectedSpaceUnit = 0;

    /**
     * Creates a new Lexer with the default indentation width of four spaces.
     * @param source The complete file content.
     * @param mode The file mode that selects the lexing rules.
     * @param diagnostics The engine for reporting non-fatal anomalies.
     * @param logicalFileName The name of the file being lexed, for diagnostics.
     */
    public Lexer(String source, FileMode mode, DiagnosticsEngine diagnostics, String logicalFileName) {
        this(source, mode, diagnostics, logicalFileName, 4);
    }

    /**
     * Creates a new Lexer.
     * @param source The complete file content.
     * @param mode The file mode that selects the lexing rules.
     * @param diagnostics The engine for reporting non-fatal anomalies.
     * @param logicalFileName The name of the file being lexed, for diagnostics.
     * @param indentWidth Number of spaces that make up one indentation unit in space-indented scripts.
     *                    A file whose first space-indented line is shallower uses that depth as its unit.
     */
    public Lexer(String source, FileMode mode, DiagnosticsEngine diagnostics, String logicalFileName, int indentWidth) {
        this.source = source;
        this.mode = mode;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.indentWidth = Math.max(1, indentWidth);
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, always terminated by an END_OF_FILE token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            if (mode == FileMode.SCRIPT && atLineStart) {
                scanIndentation();
                atLineStart = false;
                continue;
            }
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, column, logicalFileName));
        return tokens;
    }

    private void scanIndentation() {
        int runEnd = current;
        while (runEnd < source.length() && (source.charAt(runEnd) == '\t' || source.charAt(runEnd) == ' ')) runEnd++;
        boolean blank = runEnd >= source.length() || source.charAt(runEnd) == '\n' || source.charAt(runEnd) == '\r';
        int unit = spaceUnit(runEnd, blank);
        int spaces = 0;
        while (current < runEnd) {
            start = current;
            startColumn = column;
            char c = advance();
            if (c == '\t') {
                spaces = 0;
                tokens.add(new Token(TokenType.INDENT, "\t", line, startColumn, logicalFileName));
            } else if (++spaces == unit) {
                spaces = 0;
                tokens.add(new Token(TokenType.INDENT, "\t", line, startColumn, logicalFileName));
            }
        }
        if (spaces != 0 && !blank) {
            diagnostics.reportWarning(Messages.get("lexer.partialIndentation", spaces, unit), logicalFileName, line);
        }
    }

    /**
     * The first non-blank line indented purely with spaces fixes the unit for the rest of the file.
     * A run shorter than the configured width becomes the unit, so two-space scripts keep their nesting.
     */
    private int spaceUnit(int runEnd, boolean blank) {
        if (detectedSpaceUnit == 0 && !blank && runEnd > current) {
            int leading = 0;
            while (current + leading < runEnd && source.charAt(current + leading) == ' ') leading++;
            if (leading == runEnd - current) {
                detectedSpaceUnit = Math.min(leading, indentWidth);
            }
        }
        return detectedSpaceUnit == 0 ? indentWidth : detectedSpaceUnit;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                column = 1;
                atLineStart = true;
                break;
            case '\r':
                if (mode != FileMode.SCRIPT) addToken(TokenType.WHITESPACE);
                break;
            case ' ', '\t':
                whitespace();
                break;
            case '"', '\'':
                string(c);
                break;
            case '#':
                if (mode == FileMode.SCRIPT || mode == FileMode.GENERIC) {
                    lineComment();
                } else {
                    addToken(TokenType.SYMBOL);
                }
                break;
            case ';':
                if (mode == FileMode.SCENE_RESOURCE) {
                    lineComment();
                } else {
                    addToken(TokenType.SYMBOL);
                }
                break;
            case '/':
                if (mode == FileMode.GENERIC && peek() == '/') {
                    lineComment();
                } else if (mode == FileMode.GENERIC && peek() == '*') {
                    blockComment();
                } else {
                    operator();
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    if (c == 'r' && (peek() == '"' || peek() == '\'') && mode == FileMode.SCRIPT) {
                        string(advance());
                    } else {
                        identifier();
                    }
                } else {
                    operator();
                }
                break;
        }
    }

    private void whitespace() {
        while (peek() == ' ' || peek() == '\t') advance();
        if (mode != FileMode.SCRIPT) addToken(TokenType.WHITESPACE);
    }

    private void lineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
        addToken(TokenType.COMMENT);
    }

    private void blockComment() {
        advance(); // consume '*'
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (advance() == '\n') {
                line++;
                column = 1;
            }
        }
        if (isAtEnd()) {
            diagnostics.reportWarning(Messages.get("lexer.unterminatedComment"), logicalFileName, line);
        } else {
            advance();
            advance();
        }
        addToken(TokenType.COMMENT);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (!isAtEnd()) {
            char c = peek();
            if (isAlphaNumeric(c)) {
                advance();
                if ((c == 'e' || c == 'E') && (peek() == '+' || peek() == '-') && isDigit(peekNext())
                        && !source.substring(start, current).toLowerCase().startsWith("0x")) {
                    advance();
                }
            } else if (c == '.' && isDigit(peekNext())) {
                advance();
            } else {
                break;
            }
        }
        addToken(TokenType.NUMBER);
    }

    private void string(char quote) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\\') {
                advance();
                if (!isAtEnd()) advanceTrackingLines();
                continue;
            }
            if (c == quote && (!triple || (peekNext() == quote && peekAt(2) == quote))) {
                break;
            }
            if (c == '\n' && !triple && mode != FileMode.SCENE_RESOURCE) {
                break;
            }
            advanceTrackingLines();
        }

        if (isAtEnd() || peek() != quote) {
            diagnostics.reportWarning(Messages.get("lexer.unterminatedString"), logicalFileName, line);
            addToken(TokenType.STRING);
            return;
        }

        advance();
        if (triple) {
            advance();
            advance();
        }
        addToken(TokenType.STRING);
    }

    private void operator() {
        if (current + 1 < source.length() && THREE_CHAR_OPERATORS.contains(source.substring(start, current + 2))) {
            advance();
            advance();
        } else if (!isAtEnd() && TWO_CHAR_OPERATORS.contains(source.substring(start, current + 1))) {
            advance();
        }
        addToken(TokenType.SYMBOL);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line, startColumn, logicalFileName));
    }

    private void advanceTrackingLines() {
        if (advance() == '\n') {
            line++;
            column = 1;
        }
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || (c > 127 && Character.isLetter(c));
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
