package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.frontend.lexer.Token;
import org.godog.scrambler.frontend.lexer.TokenType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The token sequence of one file together with the text emitted for each position.
 * <p>
 * The original tokens never change, so lookahead and lookback by offset always see the source
 * neighbours. Deleting a token only records an empty emission at its index.
 */
public final class TokenTape {

    private final List<Token> tokens;
    private final String[] emitted;

    /**
     * @param tokens The lexed tokens of the file.
     */
    public TokenTape(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.emitted = new String[tokens.size()];
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * Returns the source text at an index.
     * @param index Any index; positions outside the tape read as an empty string.
     * @return The token text.
     */
    public String text(int index) {
        if (index < 0 || index >= tokens.size()) return "";
        return tokens.get(index).text();
    }

    /**
     * Returns the token type at an index.
     * @param index Any index; positions outside the tape read as END_OF_FILE.
     * @return The token type.
     */
    public TokenType type(int index) {
        if (index < 0 || index >= tokens.size()) return TokenType.END_OF_FILE;
        return tokens.get(index).type();
    }

    public boolean is(int index, String text) {
        return text(index).equals(text);
    }

    public void emit(int index, String text) {
        emitted[index] = text;
    }

    public void delete(int index) {
        emitted[index] = "";
    }

    /**
     * @return The emitted texts; positions never emitted read as {@code null}.
     */
    public List<String> emitted() {
        return Collections.unmodifiableList(Arrays.asList(emitted));
    }
}
