package org.godog.scrambler;

import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.diagnostics.DiagnosticsEngine;
import org.godog.scrambler.frontend.lexer.Lexer;
import org.godog.scrambler.frontend.lexer.Token;
import org.godog.scrambler.frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Collects the project-wide declarations of a script before any file is rewritten:
 * {@code class_name} types and {@code #GODOG_EXPOSE:} names.
 * <p>
 * Without this pass a file would only see the declarations of files rewritten before it.
 */
public class DiscoveryPass {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryPass.class);
    private static final String EXPOSE_MARKER = "#GODOG_EXPOSE:";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ScrambleContext context;

    public DiscoveryPass(ScrambleContext context) {
        this.context = context;
    }

    /**
     * Registers the declarations of one script.
     * @param source The script content.
     * @param fileName The logical file name.
     */
    public void scan(String source, String fileName) {
        List<Token> tokens = new Lexer(source, FileMode.SCRIPT, new DiagnosticsEngine(), fileName,
                context.getOptions().indentWidth()).scanTokens();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.IDENTIFIER && token.is("class_name")
                    && i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.IDENTIFIER) {
                String typeName = tokens.get(i + 1).text();
                if (context.getUserTypes().register(typeName)) {
                    LOG.debug("{} declares class_name {}", fileName, typeName);
                }
            } else if (token.type() == TokenType.COMMENT) {
                String stripped = WHITESPACE.matcher(token.text()).replaceAll("");
                if (stripped.startsWith(EXPOSE_MARKER)) {
                    for (String name : stripped.substring(EXPOSE_MARKER.length()).split(",")) {
                        if (!name.isEmpty()) context.getBannedLabels().banExplicitly(name);
                    }
                }
            }
        }
    }
}
