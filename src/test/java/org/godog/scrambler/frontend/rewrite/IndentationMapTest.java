package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.diagnostics.DiagnosticsEngine;
import org.godog.scrambler.frontend.lexer.Lexer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class IndentationMapTest {

    @Test
    @Tag("unit")
    void testDepthAndLineStart() {
        // Tokens: func f ( ) : NL INDENT var b NL INDENT INDENT pass EOF
        TokenTape tape = new TokenTape(new Lexer("func f():\n\tvar b\n\t\tpass", FileMode.SCRIPT, new DiagnosticsEngine(), "t.gd").scanTokens());
        IndentationMap map = IndentationMap.of(tape);

        assertThat(map.depthAt(0)).isZero();
        assertThat(map.startsLine(0)).isTrue();
        assertThat(map.depthAt(7)).isEqualTo(1);
        assertThat(map.startsLine(7)).isTrue();
        assertThat(map.startsLine(8)).isFalse();
        assertThat(map.depthAt(12)).isEqualTo(2);
        assertThat(map.depthAt(tape.size())).isEqualTo(2);
    }
}
