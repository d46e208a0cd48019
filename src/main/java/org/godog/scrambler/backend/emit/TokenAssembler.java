package org.godog.scrambler.backend.emit;

import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.frontend.lexer.Token;
import org.godog.scrambler.frontend.lexer.TokenType;

import java.util.List;

/**
 * Turns rewritten token texts back into file content.
 * <p>
 * Scripts are rebuilt line by line: indentation is re-emitted as tabs, adjacent tokens are
 * separated by a single space only where they would otherwise merge, and lines left without
 * content are dropped. All other modes keep their whitespace tokens and are concatenated verbatim.
 */
public final class TokenAssembler {

    private static final String OPERATOR_CHARS = "=<>!+-*/%&|^~:.";

    private TokenAssembler() {}

    /**
     * Assembles the output of one file.
     * @param tokens The original tokens.
     * @param emitted The rewritten text of each token, index-aligned with {@code tokens}.
     * @param mode The file mode.
     * @return The file content.
     */
    public static String assemble(List<Token> tokens, List<String> emitted, FileMode mode) {
        if (tokens.size() != emitted.size()) {
            throw new IllegalArgumentException("Token count " + tokens.size() + " does not match emitted count " + emitted.size());
        }
        if (mode != FileMode.SCRIPT) {
            StringBuilder sb = new StringBuilder();
            for (String text : emitted) {
                if (text != null) sb.append(text);
            }
            return sb.toString();
        }
        return assembleScript(tokens, emitted);
    }

    private static String assembleScript(List<Token> tokens, List<String> emitted) {
        StringBuilder out = new StringBuilder();
        StringBuilder indent = new StringBuilder();
        StringBuilder content = new StringBuilder();
        String previous = "";

        for (int i = 0; i < tokens.size(); i++) {
            String text = emitted.get(i);
            if (text == null || text.isEmpty()) continue;
            TokenType type = tokens.get(i).type();

            if (type == TokenType.NEWLINE) {
                if (content.length() > 0) {
                    out.append(indent).append(content).append('\n');
                }
                indent.setLength(0);
                content.setLength(0);
                previous = "";
            } else if (type == TokenType.INDENT && content.length() == 0) {
                indent.append(text);
            } else {
                if (needsSeparator(previous, text)) content.append(' ');
                content.append(text);
                previous = text;
            }
        }
        if (content.length() > 0) {
            out.append(indent).append(content);
        }
        return out.toString();
    }

    /**
     * Checks whether two adjacent token texts would be read as one token without a space.
     * @param left The text already emitted.
     * @param right The text to append.
     * @return {@code true} if a space is required between them.
     */
    static boolean needsSeparator(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) return false;
        char a = left.charAt(left.length() - 1);
        char b = right.charAt(0);
        if (isWordChar(a)) {
            return isWordChar(b) || b == '"' || b == '\'';
        }
        if ((a == '"' || a == '\'') && isWordChar(b)) return true;
        return OPERATOR_CHARS.indexOf(a) >= 0 && OPERATOR_CHARS.indexOf(b) >= 0;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
