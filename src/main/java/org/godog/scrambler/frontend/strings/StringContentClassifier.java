package org.godog.scrambler.frontend.strings;

import org.godog.scrambler.api.ScrambleException;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes what a decoded string literal carries: translation text, a protocol path
 * such as {@code res://...}, or a node path such as {@code Player/Sprite2D}.
 */
public final class StringContentClassifier {

    private static final Pattern TRANSLATION_MARKER = Pattern.compile("\\{\\{(.*?)}}", Pattern.DOTALL);
    private static final Pattern PROTOCOL_PATH = Pattern.compile("^([a-z][a-z0-9+.-]*)://(.*)$", Pattern.DOTALL);
    private static final String SEGMENT = "(?:%?[A-Za-z_][A-Za-z0-9_]*|\\.\\.?)";
    private static final Pattern NODE_PATH = Pattern.compile(
            "^/?" + SEGMENT + "(?:/" + SEGMENT + ")*(?::[A-Za-z_][A-Za-z0-9_]*)*$");
    private static final Pattern NODE_PATH_PART = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private StringContentClassifier() {}

    /**
     * A protocol path split into its scheme and the remainder.
     *
     * @param protocol The scheme, e.g. {@code res}.
     * @param path Everything after {@code ://}.
     */
    public record ProtocolPath(String protocol, String path) {}

    /**
     * Checks whether a string contains at least one complete translation marker.
     * @param str The decoded string.
     * @return {@code true} if a {@code {{...}}} pair is present.
     */
    public static boolean hasTranslations(String str) {
        return TRANSLATION_MARKER.matcher(str).find();
    }

    /**
     * Removes translation markers and keeps the marked text verbatim.
     * @param str The decoded string.
     * @return The string without marker braces.
     */
    public static String parseTranslations(String str) {
        Matcher matcher = TRANSLATION_MARKER.matcher(str);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static boolean looksLikeProtocolPath(String str) {
        return PROTOCOL_PATH.matcher(str).matches();
    }

    /**
     * Splits a protocol path.
     * @param str A string for which {@link #looksLikeProtocolPath(String)} holds.
     * @return The scheme and path.
     * @throws IllegalArgumentException if the string is not a protocol path.
     */
    public static ProtocolPath getProtocolAndPath(String str) {
        Matcher matcher = PROTOCOL_PATH.matcher(str);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a protocol path: " + str);
        }
        return new ProtocolPath(matcher.group(1), matcher.group(2));
    }

    /**
     * Checks a file's extension, ignoring case.
     * @param file The file.
     * @param extensions Extensions without the leading dot.
     * @return {@code true} if the file name ends with one of the extensions.
     */
    public static boolean checkFileExtension(Path file, Collection<String> extensions) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(e -> e.toLowerCase(Locale.ROOT).equals(extension));
    }

    public static boolean looksLikeNodePath(String str) {
        return NODE_PATH.matcher(str).matches();
    }

    /**
     * Rewrites every identifier part of a node path and keeps all separators, relative
     * segments and unique-name markers.
     * @param str A string for which {@link #looksLikeNodePath(String)} holds.
     * @param rewriter The rewriter applied to each identifier part.
     * @return The rewritten node path.
     * @throws ScrambleException if the rewriter fails.
     */
    public static String processNodePath(String str, SegmentRewriter rewriter) throws ScrambleException {
        Matcher matcher = NODE_PATH_PART.matcher(str);
        StringBuilder sb = new StringBuilder(str.length());
        int last = 0;
        while (matcher.find()) {
            sb.append(str, last, matcher.start());
            sb.append(rewriter.rewrite(matcher.group()));
            last = matcher.end();
        }
        sb.append(str, last, str.length());
        return sb.toString();
    }
}
