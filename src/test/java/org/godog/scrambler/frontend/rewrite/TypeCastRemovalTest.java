package org.godog.scrambler.frontend.rewrite;

import com.typesafe.config.ConfigFactory;
import org.godog.scrambler.ScrambleContext;
import org.godog.scrambler.ScramblePipeline;
import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.api.ScramblerOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the removal of type annotations, return types and casts.
 */
public class TypeCastRemovalTest {

    private ScrambleContext context;

    private String scramble(String source, boolean removeTypeCasting) throws IOException, ScrambleException {
        ScramblerOptions options = ScramblerOptions.fromConfig(ConfigFactory.defaultReference())
                .withRemoveTypeCasting(removeTypeCasting);
        context = ScrambleContext.create(options);
        return new ScramblePipeline(context).scramble(source, FileMode.SCRIPT, "casts.gd");
    }

    private String label(String name) {
        return context.getLabels().get(name);
    }

    /**
     * Verifies that an explicit cast leaves only the left-hand expression.
     */
    @Test
    @Tag("unit")
    void testExplicitCastIsRemoved() throws Exception {
        String out = scramble("func heal(amount):\n\thealth = amount as int", true);

        assertThat(out).matches("func " + label("heal") + "\\((\\w+)\\):\n\t" + label("health") + "=\\1");
    }

    /**
     * Verifies that variable annotations and the inferred assignment operator are simplified.
     */
    @Test
    @Tag("unit")
    void testVariableAnnotationIsRemoved() throws Exception {
        String out = scramble("var health: int = 10\nvar coins := 3\nconst LIMIT: float = 2.5", true);

        assertThat(out).isEqualTo("var " + label("health") + "=10\nvar " + label("coins") + "=3\nconst "
                + label("LIMIT") + "=2.5");
    }

    /**
     * Verifies that annotations of exported members survive, in both annotation styles.
     */
    @Test
    @Tag("unit")
    void testExportedAnnotationIsKept() throws Exception {
        String out = scramble("@export var health: int = 10\nexport var coins: int = 3", true);

        assertThat(out).isEqualTo("@export var " + label("health") + ":int=10\nexport var " + label("coins") + ":int=3");
    }

    @Test
    @Tag("unit")
    void testReturnTypeIsRemoved() throws Exception {
        String out = scramble("func heal() -> int:\n\tpass", true);

        assertThat(out).isEqualTo("func " + label("heal") + "():\n\tpass");
    }

    @Test
    @Tag("unit")
    void testParameterAnnotationIsRemoved() throws Exception {
        String out = scramble("func heal(amount: int = 1, target: Vector2):\n\tpass", true);

        assertThat(out).matches("func " + label("heal") + "\\(\\w+=1,\\w+\\):\n\tpass");
    }

    /**
     * Verifies that a colon which ends a block header is not mistaken for an annotation.
     */
    @Test
    @Tag("unit")
    void testBlockColonIsNotAnAnnotation() throws Exception {
        String out = scramble("if health: pass", true);

        assertThat(out).isEqualTo("if " + label("health") + ":pass");
    }

    /**
     * Verifies that nothing is removed when type casting removal is disabled.
     */
    @Test
    @Tag("unit")
    void testDisabledRemovalKeepsEverything() throws Exception {
        String out = scramble("var health: int = 10\nvar coins := 3\nfunc heal() -> int:\n\treturn health as int", false);

        assertThat(out).isEqualTo("var " + label("health") + ":int=10\nvar " + label("coins") + ":=3\nfunc "
                + label("heal") + "()->int:\n\treturn " + label("health") + " as int");
    }
}
