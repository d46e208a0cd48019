package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.frontend.lexer.TokenType;

/**
 * Indentation depth of every token position, computed in one forward pass.
 * The depth of a position is the number of indentation units before it on its line.
 */
public final class IndentationMap {

    private final int[] depth;
    private final TokenTape tape;

    private IndentationMap(TokenTape tape, int[] depth) {
        this.tape = tape;
        this.depth = depth;
    }

    /**
     * Builds the map for a tape.
     * @param tape The tokens of a file.
     * @return The indentation map.
     */
    public static IndentationMap of(TokenTape tape) {
        int[] depth = new int[tape.size() + 1];
        int count = 0;
        for (int i = 0; i < tape.size(); i++) {
            depth[i] = count;
            TokenType type = tape.type(i);
            if (type == TokenType.NEWLINE) {
                count = 0;
            } else if (type == TokenType.INDENT) {
                count++;
            }
        }
        depth[tape.size()] = count;
        return new IndentationMap(tape, depth);
    }

    /**
     * @param index A token position; the tape size denotes the end of the file.
     * @return The indentation depth of the line the position is on.
     */
    public int depthAt(int index) {
        return depth[Math.max(0, Math.min(index, depth.length - 1))];
    }

    /**
     * @param index A token position.
     * @return {@code true} if only indentation precedes the position on its line.
     */
    public boolean startsLine(int index) {
        if (index == 0) return true;
        TokenType previous = tape.type(index - 1);
        return previous == TokenType.INDENT || previous == TokenType.NEWLINE;
    }
}
