package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.frontend.lexer.TokenType;

import java.util.Set;

/**
 * Deletes static type information around a type name: declaration annotations
 * ({@code var hp: int = 3}), return types ({@code func f() -> int:}) and explicit casts
 * ({@code x as int}).
 * <p>
 * Annotations of exported members are kept because the editor inspector needs them.
 */
final class TypeCastRemover {

    private static final Set<String> ANNOTATION_TERMINATORS = Set.of("=", ",", ")");
    private static final Set<String> VARIABLE_KEYWORDS = Set.of("var", "const");
    private static final Set<String> SIGNATURE_KEYWORDS = Set.of("func", "signal");

    private final TokenTape tape;
    private final boolean enabled;

    TypeCastRemover(TokenTape tape, boolean enabled) {
        this.tape = tape;
        this.enabled = enabled;
    }

    /**
     * Applies type removal to the type name at {@code index}.
     * @param rendered The text the type name would otherwise be emitted as.
     * @param index The position of the type name.
     * @return The text to emit for the type name; empty if it was removed.
     */
    String strip(String rendered, int index) {
        if (!enabled) return rendered;

        if (tape.is(index - 1, ":") && endsAnnotation(index + 1) && isDeclarationAnnotation(index)) {
            if (isExported(index)) return rendered;
            tape.delete(index - 1);
            return "";
        }
        if (tape.is(index - 2, ")") && tape.is(index - 1, "->") && tape.is(index + 1, ":")) {
            tape.delete(index - 1);
            return "";
        }
        if (tape.is(index - 1, "as")) {
            tape.delete(index - 1);
            return "";
        }
        return rendered;
    }

    private boolean endsAnnotation(int index) {
        TokenType type = tape.type(index);
        return type == TokenType.NEWLINE || type == TokenType.END_OF_FILE || type == TokenType.COMMENT
                || ANNOTATION_TERMINATORS.contains(tape.text(index));
    }

    /**
     * Only a colon after a declared name is an annotation. Block colons ({@code if x: pass})
     * and dictionary entries look the same locally.
     */
    private boolean isDeclarationAnnotation(int index) {
        if (tape.type(index - 2) != TokenType.IDENTIFIER) return false;
        String beforeName = tape.text(index - 3);
        if (VARIABLE_KEYWORDS.contains(beforeName)) return true;
        if (!beforeName.equals("(") && !beforeName.equals(",")) return false;
        int opener = findOpeningParen(index - 3);
        if (opener < 0) return false;
        if (SIGNATURE_KEYWORDS.contains(tape.text(opener - 1))) return true;
        return tape.type(opener - 1) == TokenType.IDENTIFIER && SIGNATURE_KEYWORDS.contains(tape.text(opener - 2));
    }

    private int findOpeningParen(int from) {
        int depth = 0;
        for (int i = from; i >= 0; i--) {
            String text = tape.text(i);
            if (text.equals(")")) {
                depth++;
            } else if (text.equals("(")) {
                if (depth == 0) return i;
                depth--;
            }
        }
        return -1;
    }

    private boolean isExported(int index) {
        int bracesStack = 0;
        for (int i = index - 4; i >= 0; i--) {
            String text = tape.text(i);
            if (text.equals(")")) {
                bracesStack++;
            } else if (text.equals("(")) {
                bracesStack--;
            }
            if (bracesStack != 0) continue;
            if (text.equals("export")) return true;
            if (tape.type(i) == TokenType.NEWLINE) break;
        }
        return false;
    }
}
