package org.godog.scrambler.frontend.strings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.util.Optional;

/**
 * Decodes string literal tokens to their content and encodes content back to literals.
 * <p>
 * Script literals in every quote style are normalised to a JSON string literal and decoded with
 * Gson. Scene and resource files allow raw newlines inside strings, so their literals keep them
 * when encoded.
 */
public final class StringLiterals {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private StringLiterals() {}

    /**
     * Checks whether a literal is a raw string ({@code r"..."}), whose content is never decoded.
     * @param literal The literal token text.
     * @return {@code true} for raw string literals.
     */
    public static boolean isRaw(String literal) {
        return literal.startsWith("r");
    }

    /**
     * Decodes a string literal.
     * @param literal The literal token text, including its quotes.
     * @param sceneMode Whether the literal comes from a scene or resource file.
     * @return The decoded content, or empty if the literal is raw, unterminated or has escapes
     *         that cannot be decoded.
     */
    public static Optional<String> decode(String literal, boolean sceneMode) {
        if (isRaw(literal) || literal.length() < 2) {
            return Optional.empty();
        }
        char quote = literal.charAt(0);
        if (quote != '"' && quote != '\'') {
            return Optional.empty();
        }
        int quoteLength = literal.length() >= 6 && literal.startsWith(String.valueOf(quote).repeat(3))
                && literal.endsWith(String.valueOf(quote).repeat(3)) ? 3 : 1;
        if (literal.charAt(literal.length() - 1) != quote) {
            return Optional.empty();
        }
        String body = literal.substring(quoteLength, literal.length() - quoteLength);
        try {
            String json = toJsonLiteral(body, sceneMode);
            return Optional.ofNullable(GSON.fromJson(json, String.class));
        } catch (JsonParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Encodes content as a double-quoted string literal.
     * @param content The content.
     * @param sceneMode Whether the literal is written to a scene or resource file.
     * @return The literal text.
     */
    public static String encode(String content, boolean sceneMode) {
        if (!sceneMode) {
            return GSON.toJson(content);
        }
        StringBuilder sb = new StringBuilder(content.length() + 2).append('"');
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String toJsonLiteral(String body, boolean sceneMode) {
        StringBuilder sb = new StringBuilder(body.length() + 2).append('"');
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                if (next == '\'') {
                    sb.append('\'');
                } else if (next == '\n') {
                    // Line continuation inside a literal.
                    continue;
                } else {
                    sb.append('\\').append(next);
                }
            } else if (c == '"') {
                sb.append("\\\"");
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append(sceneMode ? "\\r" : "");
            } else if (c == '\t') {
                sb.append("\\t");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
