package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.api.ScrambleErrorCode;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.api.ScramblerOptions;
import org.godog.scrambler.frontend.lexer.TokenType;
import org.godog.scrambler.frontend.strings.SegmentRewriter;
import org.godog.scrambler.frontend.strings.StringContentClassifier;
import org.godog.scrambler.frontend.strings.StringContentClassifier.ProtocolPath;
import org.godog.scrambler.frontend.strings.StringLiterals;
import org.godog.scrambler.internal.i18n.Messages;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites string literals. Translation text loses its markers, node paths get their
 * identifier parts renamed, and everything else is kept.
 */
final class StringLiteralRewriter {

    private static final Set<String> REGEX_PATTERN_METHODS = Set.of("compile", "search", "search_all");
    private static final String APPLICATION_SECTION = "application";
    private static final String PROJECT_NAME_KEY = "config/name";

    private final TokenTape tape;
    private final FileMode mode;
    private final ScramblerOptions options;
    private final String fileName;
    private final SegmentRewriter segmentRewriter;

    StringLiteralRewriter(TokenTape tape, FileMode mode, ScramblerOptions options, String fileName, SegmentRewriter segmentRewriter) {
        this.tape = tape;
        this.mode = mode;
        this.options = options;
        this.fileName = fileName;
        this.segmentRewriter = segmentRewriter;
    }

    /**
     * @param index The position of a STRING token.
     * @return The text to emit for the literal.
     * @throws ScrambleException if the literal uses unsupported formatting or names an invalid resource.
     */
    String rewrite(int index) throws ScrambleException {
        String literal = tape.text(index);

        if (mode == FileMode.SCRIPT) {
            if (tape.is(index + 1, ".") && tape.is(index + 2, "format") && tape.is(index + 3, "(")) {
                throw new ScrambleException(ScrambleErrorCode.UNSUPPORTED_FORMATTING, fileName,
                        Messages.get("rewrite.unsupportedFormatting", literal));
            }
            if (isRegexArgument(index)) return literal;
        } else if (mode == FileMode.SCENE_RESOURCE && isProjectDisplayName(index)) {
            return literal;
        }

        boolean sceneMode = mode == FileMode.SCENE_RESOURCE;
        Optional<String> decoded = StringLiterals.decode(literal, sceneMode);
        if (decoded.isEmpty()) return literal;
        String content = decoded.get();

        if (StringContentClassifier.hasTranslations(content)) {
            content = StringContentClassifier.parseTranslations(content);
        } else if (StringContentClassifier.looksLikeProtocolPath(content)) {
            validateResourcePath(content);
            return literal;
        } else if (StringContentClassifier.looksLikeNodePath(content)) {
            content = StringContentClassifier.processNodePath(content, segmentRewriter);
        }
        return StringLiterals.encode(content, sceneMode);
    }

    private boolean isRegexArgument(int index) {
        if (tape.is(index - 3, ".") && REGEX_PATTERN_METHODS.contains(tape.text(index - 2)) && tape.is(index - 1, "(")) {
            return true;
        }
        return tape.is(index - 5, ".") && tape.is(index - 4, "sub") && tape.is(index - 3, "(") && tape.is(index - 1, ",");
    }

    private void validateResourcePath(String content) throws ScrambleException {
        if (mode != FileMode.SCRIPT || !options.meltEnabled()) return;
        ProtocolPath protocolPath = StringContentClassifier.getProtocolAndPath(content);
        if (!protocolPath.protocol().equals("res")) return;

        String joined = options.projectDir().toString() + "/" + protocolPath.path();
        Path filePath;
        try {
            filePath = options.projectDir().resolve(protocolPath.path());
        } catch (InvalidPathException e) {
            throw new ScrambleException(ScrambleErrorCode.MISSING_RESOURCE, fileName,
                    Messages.get("rewrite.missingResource", joined), e);
        }
        if (!StringContentClassifier.checkFileExtension(filePath, options.structuralExtensions())) return;

        if (joined.contains("%")) {
            throw new ScrambleException(ScrambleErrorCode.ILLEGAL_DYNAMIC_PATH, fileName,
                    Messages.get("rewrite.illegalDynamicPath", joined));
        }
        if (!Files.exists(filePath)) {
            throw new ScrambleException(ScrambleErrorCode.MISSING_RESOURCE, fileName,
                    Messages.get("rewrite.missingResource", filePath));
        }
    }

    /**
     * Recognizes the value of {@code config/name} in the {@code [application]} section of a
     * project file. The engine shows that string as the window title.
     */
    private boolean isProjectDisplayName(int index) {
        int i = skipWhitespaceBackwards(index - 1);
        if (!tape.is(i, "=")) return false;
        i = skipWhitespaceBackwards(i - 1);

        List<String> keyParts = new ArrayList<>();
        while (i >= 0 && tape.type(i) != TokenType.NEWLINE && tape.type(i) != TokenType.WHITESPACE) {
            keyParts.add(tape.text(i));
            i--;
        }
        Collections.reverse(keyParts);
        if (!String.join("", keyParts).equals(PROJECT_NAME_KEY)) return false;

        for (; i >= 0; i--) {
            if (tape.is(i, "[") && (i == 0 || tape.type(i - 1) == TokenType.NEWLINE)) {
                return tape.is(i + 1, APPLICATION_SECTION) && tape.is(i + 2, "]");
            }
        }
        return false;
    }

    private int skipWhitespaceBackwards(int index) {
        int i = index;
        while (i >= 0 && tape.type(i) == TokenType.WHITESPACE) i--;
        return i;
    }
}
