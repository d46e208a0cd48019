package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.ScrambleContext;
import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.api.ScrambleErrorCode;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.frontend.directive.DirectiveContext;
import org.godog.scrambler.frontend.directive.DirectiveHandlerRegistry;
import org.godog.scrambler.frontend.directive.DirectiveHandlerRegistry.DirectiveMatch;
import org.godog.scrambler.frontend.lexer.Token;
import org.godog.scrambler.frontend.lexer.TokenType;
import org.godog.scrambler.frontend.strings.SegmentRewriter;
import org.godog.scrambler.internal.i18n.Messages;
import org.godog.scrambler.labels.BannedLabels;
import org.godog.scrambler.labels.LabelAllocator;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides, token by token, what each token of one file becomes.
 * <p>
 * The rewriter walks the tape once from left to right. Most decisions look at a fixed
 * window of neighbours; some rules also delete the tokens directly before the current one
 * (a type annotation colon, a cast operator). A rewriter instance handles exactly one file.
 */
public class TokenRewriter implements DirectiveContext {

    /** Keywords that open a declaration at class level. */
    private static final Set<String> SCOPE_KEYWORDS = Set.of(
            "extends", "tool", "class_name", "var", "const", "enum", "signal", "export", "onready",
            "func", "static", "remote", "master", "puppet", "remotesync", "mastersync", "puppetsync");

    /** A private name after one of these keywords is declared publicly and gets its public label. */
    private static final Set<String> PUBLIC_DECLARATION_KEYWORDS = Set.of(
            "extends", "class_name", "const", "enum", "signal", "func");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ScrambleContext context;
    private final FileMode mode;
    private final String fileName;
    private final DirectiveHandlerRegistry directives;
    private final RewriteState state = new RewriteState();
    private final BannedLabels banned;
    private final LabelAllocator labels;
    private final SegmentRewriter segmentRewriter;

    private TokenTape tape;
    private IndentationMap indentation;
    private TypeCastRemover typeCasts;
    private StringLiteralRewriter strings;

    /**
     * Creates a rewriter for one file.
     * @param context The run-scoped registries.
     * @param mode The mode of the file.
     * @param fileName The logical file name, used in errors.
     * @param segmentRewriter Rewrites one identifier part of a node path found in a string.
     */
    public TokenRewriter(ScrambleContext context, FileMode mode, String fileName, SegmentRewriter segmentRewriter) {
        this.context = context;
        this.mode = mode;
        this.fileName = fileName;
        this.directives = DirectiveHandlerRegistry.initialize();
        this.banned = context.getBannedLabels();
        this.labels = context.getLabels();
        this.segmentRewriter = segmentRewriter;
    }

    /**
     * Rewrites all tokens of the file.
     * @param tokens The lexed tokens.
     * @return The emitted text for each token, index-aligned with the input.
     * @throws ScrambleException if the file contains a construct that cannot be scrambled safely.
     */
    public List<String> rewrite(List<Token> tokens) throws ScrambleException {
        this.tape = new TokenTape(tokens);
        this.indentation = IndentationMap.of(tape);
        this.typeCasts = new TypeCastRemover(tape, context.getOptions().removeTypeCasting());
        this.strings = new StringLiteralRewriter(tape, mode, context.getOptions(), fileName, segmentRewriter);

        for (int i = 0; i < tape.size(); i++) {
            tape.emit(i, rewriteToken(i));
        }
        return tape.emitted();
    }

    /**
     * Verifies that the file left no block open.
     * @throws ScrambleException if an ignore block was opened but never closed.
     */
    public void checkIntegrity() throws ScrambleException {
        if (state.isInSpecialBlock()) {
            throw new ScrambleException(ScrambleErrorCode.UNTERMINATED_SPECIAL_BLOCK, fileName,
                    Messages.get("rewrite.unterminatedIgnoreBlock", fileName));
        }
    }

    private String rewriteToken(int i) throws ScrambleException {
        Token token = tape.get(i);
        switch (token.type()) {
            case END_OF_FILE:
                return "";
            case IDENTIFIER:
                return rewriteIdentifier(i);
            case NUMBER:
                return state.isInSpecialBlock() ? "" : token.text();
            default:
                return rewriteSymbol(i);
        }
    }

    private String rewriteSymbol(int i) throws ScrambleException {
        Token token = tape.get(i);
        if (mode == FileMode.SCRIPT) {
            if (token.type() == TokenType.COMMENT) return rewriteComment(token);
            if (state.isInSpecialBlock()) return "";
            if (token.is(":=")) return context.getOptions().removeTypeCasting() ? "=" : token.text();
        }
        if (token.type() == TokenType.STRING) return strings.rewrite(i);
        return token.text();
    }

    private String rewriteComment(Token token) {
        String stripped = WHITESPACE.matcher(token.text()).replaceAll("");
        if (context.getPreservedComments().isPreserved(stripped)) {
            context.markPreservedBlocksDetected();
            return token.text();
        }
        Optional<DirectiveMatch> directive = directives.find(stripped);
        if (directive.isPresent()) {
            directive.get().handler().handle(directive.get().arguments(), token.line(), this);
        }
        return "";
    }

    private String rewriteIdentifier(int i) {
        if (state.isInSpecialBlock()) return "";
        String text = tape.text(i);
        switch (mode) {
            case PATH_FRAGMENT:
            case GENERIC:
                return banned.contains(text) ? text : labels.get(text);
            case SCENE_RESOURCE:
                if (banned.contains(text)) return text;
                return labels.has(text) ? labels.get(text) : text;
            case SCRIPT:
                return rewriteScriptIdentifier(i);
            default:
                throw new IllegalStateException("Unknown file mode: " + mode);
        }
    }

    private String rewriteScriptIdentifier(int i) {
        String text = tape.text(i);
        String previous = tape.text(i - 1);

        if (previous.equals("@")) {
            // An annotation opening a line belongs to the declaration that follows it.
            if (indentation.startsLine(i - 1)) {
                state.lowerScopeFloor(indentation.depthAt(i - 1));
            }
            return text;
        }

        if (banned.contains(text)) return rewriteBanned(i);

        String privateLabel = state.getPrivateLabel(text);
        if (privateLabel != null) {
            if (PUBLIC_DECLARATION_KEYWORDS.contains(previous) && !state.isExplicitlyPrivate(text)) {
                return labels.get(text);
            }
            if (previous.equals(".")) return labels.get(text);
            return privateLabel;
        }

        if (context.getUserTypes().contains(text)) {
            return typeCasts.strip(labels.get(text), i);
        }
        return labels.get(text);
    }

    private String rewriteBanned(int i) {
        String text = tape.text(i);
        if (banned.isExplicitlyBanned(text)) return text;

        if (text.equals("class")) {
            enterInnerClass(i);
            return text;
        }

        if (SCOPE_KEYWORDS.contains(text) && indentation.startsLine(i)) {
            state.lowerScopeFloor(indentation.depthAt(i));
        }

        switch (text) {
            case "class_name":
                if (tape.type(i + 1) == TokenType.IDENTIFIER) {
                    context.getUserTypes().register(tape.text(i + 1));
                }
                return text;
            case "func":
                harvestParameters(i);
                return text;
            case "var":
                declareVariable(i);
                return text;
            default:
                return typeCasts.strip(text, i);
        }
    }

    /** Members of an inner class sit one level deeper than the class line. */
    private void enterInnerClass(int i) {
        int j = i + 1;
        while (j < tape.size() && tape.type(j) != TokenType.NEWLINE && tape.type(j) != TokenType.END_OF_FILE) j++;
        j++;
        while (j < tape.size() && tape.type(j) == TokenType.INDENT) j++;
        state.enterClassBody(indentation.depthAt(j));
    }

    /**
     * Every name directly after the opening parenthesis or a comma of the parameter list
     * becomes file-private, including names inside default-value calls.
     */
    private void harvestParameters(int i) {
        int j = i + 1;
        while (j < tape.size() && !tape.is(j, "(")) j++;
        int depth = 1;
        for (j++; j < tape.size(); j++) {
            String text = tape.text(j);
            if (text.equals("(")) {
                depth++;
                continue;
            }
            if (text.equals(")")) {
                if (--depth == 0) break;
                continue;
            }
            if (tape.type(j) != TokenType.IDENTIFIER) continue;
            String previous = tape.text(previousSignificant(j));
            if (previous.equals(",") || previous.equals("(")) {
                state.getOrAddPrivateLabel(text, false, labels);
            }
        }
    }

    private int previousSignificant(int index) {
        int j = index - 1;
        while (j >= 0 && (tape.type(j) == TokenType.NEWLINE || tape.type(j) == TokenType.INDENT)) j--;
        return j;
    }

    private void declareVariable(int i) {
        if (indentation.depthAt(i) == state.getScopeFloor()) return;
        if (tape.type(i + 1) == TokenType.IDENTIFIER) {
            state.getOrAddPrivateLabel(tape.text(i + 1), false, labels);
        }
    }

    @Override
    public ScrambleContext getScrambleContext() {
        return context;
    }

    @Override
    public RewriteState getState() {
        return state;
    }

    @Override
    public String getFileName() {
        return fileName;
    }
}
