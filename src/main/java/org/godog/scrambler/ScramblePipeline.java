package org.godog.scrambler;

import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.backend.emit.TokenAssembler;
import org.godog.scrambler.diagnostics.DiagnosticsEngine;
import org.godog.scrambler.frontend.lexer.Lexer;
import org.godog.scrambler.frontend.lexer.Token;
import org.godog.scrambler.frontend.rewrite.TokenRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scrambles the content of single files: lexing, rewriting and assembly.
 * <p>
 * All files of a run must go through the same pipeline so that they share one
 * {@link ScrambleContext}.
 */
public class ScramblePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ScramblePipeline.class);

    private final ScrambleContext context;

    public ScramblePipeline(ScrambleContext context) {
        this.context = context;
    }

    public ScrambleContext getContext() {
        return context;
    }

    /**
     * Scrambles one source text.
     * @param source The file content.
     * @param mode The mode that selects the lexing and rewrite rules.
     * @param fileName The logical file name, used in errors and logs.
     * @return The scrambled content.
     * @throws ScrambleException if the file cannot be scrambled; no partial output is produced.
     */
    public String scramble(String source, FileMode mode, String fileName) throws ScrambleException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, mode, diagnostics, fileName, context.getOptions().indentWidth()).scanTokens();
        if (diagnostics.hasWarnings()) {
            LOG.warn("Lexer reported problems in {}:\n{}", fileName, diagnostics.summary());
        }

        TokenRewriter rewriter = new TokenRewriter(context, mode, fileName,
                segment -> scramble(segment, FileMode.PATH_FRAGMENT, fileName));
        List<String> emitted = rewriter.rewrite(tokens);
        rewriter.checkIntegrity();
        return TokenAssembler.assemble(tokens, emitted, mode);
    }
}
