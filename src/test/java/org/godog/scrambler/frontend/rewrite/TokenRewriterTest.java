package org.godog.scrambler.frontend.rewrite;

import com.typesafe.config.ConfigFactory;
import org.godog.scrambler.ScrambleContext;
import org.godog.scrambler.ScramblePipeline;
import org.godog.scrambler.api.FileMode;
import org.godog.scrambler.api.ScrambleErrorCode;
import org.godog.scrambler.api.ScrambleException;
import org.godog.scrambler.api.ScramblerOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link TokenRewriter}, driven through the per-file pipeline so that
 * lexing and assembly are applied as in a real run.
 */
public class TokenRewriterTest {

    private ScrambleContext context;
    private ScramblePipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        context = ScrambleContext.create(ScramblerOptions.fromConfig(ConfigFactory.defaultReference()));
        pipeline = new ScramblePipeline(context);
    }

    private String scramble(String source) throws ScrambleException {
        return pipeline.scramble(source, FileMode.SCRIPT, "test.gd");
    }

    private String label(String name) {
        return context.getLabels().get(name);
    }

    @Test
    @Tag("unit")
    void testCommentsAreRemovedAndParametersArePrivate() throws Exception {
        String out = scramble("func heal(amount):\n\thealth += amount # add it");

        assertThat(out).doesNotContain("#").doesNotContain("amount");
        assertThat(out).matches("func " + label("heal") + "\\((\\w+)\\):\n\t" + label("health") + "\\+=\\1");
    }

    @Test
    @Tag("unit")
    void testMemberVariableIsPublicAndLocalVariableIsPrivate() throws Exception {
        String out = scramble("var health = 10\nfunc heal():\n\tvar bonus = 2\n\thealth += bonus");

        assertThat(context.getLabels().has("health")).isTrue();
        assertThat(context.getLabels().has("bonus")).isFalse();
        assertThat(out).matches("var " + label("health") + "=10\nfunc " + label("heal")
                + "\\(\\):\n\tvar (\\w+)=2\n\t" + label("health") + "\\+=\\1");
    }

    @Test
    @Tag("unit")
    void testInnerClassMembersArePublic() throws Exception {
        scramble("var health = 1\nclass Inner:\n\tvar armor = 2\n\tfunc heal():\n\t\tvar bonus = 3\n");

        assertThat(context.getLabels().has("armor")).isTrue();
        assertThat(context.getLabels().has("bonus")).isFalse();
    }

    @Test
    @Tag("unit")
    void testScopeFloorDropsBackAfterInnerClass() throws Exception {
        scramble("class Inner:\n\tvar armor = 2\nvar coins_total = 1\nfunc f():\n\tvar bonus = 3\n");

        assertThat(context.getLabels().has("armor")).isTrue();
        assertThat(context.getLabels().has("coins_total")).isTrue();
        assertThat(context.getLabels().has("bonus")).isFalse();
    }

    @Test
    @Tag("unit")
    void testAnnotatedMemberAfterInnerClassIsPublic() throws Exception {
        scramble("class Inner:\n\tvar armor = 2\n@export var speed = 3\n");

        assertThat(context.getLabels().has("speed")).isTrue();
    }

    @Test
    @Tag("unit")
    void testNamesInsideDefaultValueCallsArePrivate() throws Exception {
        String out = scramble("func spawn(amount_left, delay = wait_for(1, cooldown)):\n\tpass\n");

        assertThat(context.getLabels().has("amount_left")).isFalse();
        assertThat(context.getLabels().has("delay")).isFalse();
        assertThat(context.getLabels().has("cooldown")).isFalse();
        assertThat(context.getLabels().has("wait_for")).isTrue();
        assertThat(out).matches("func " + label("spawn") + "\\(\\w+,\\w+=" + label("wait_for")
                + "\\(1,\\w+\\)\\):\n\tpass\n");
    }

    @Test
    @Tag("unit")
    void testTwoSpaceIndentedScriptKeepsNesting() throws Exception {
        String out = scramble("var hp = 1\nfunc f():\n  var bonus = 2\n  if hp:\n    return bonus\n");

        assertThat(context.getLabels().has("bonus")).isFalse();
        assertThat(out).matches("var " + label("hp") + "=1\nfunc " + label("f") + "\\(\\):\n\tvar (\\w+)=2\n\tif "
                + label("hp") + ":\n\t\treturn \\1\n");
    }

    @Test
    @Tag("unit")
    void testNumbersAndKeywordsPassThrough() throws Exception {
        String out = scramble("if health > 3:\n\treturn 0x1F");

        assertThat(out).isEqualTo("if " + label("health") + ">3:\n\treturn 0x1F");
    }

    @Test
    @Tag("unit")
    void testAnnotationNameIsKept() throws Exception {
        String out = scramble("@onready var sprite = $Icon");

        assertThat(out).isEqualTo("@onready var " + label("sprite") + "=$" + label("Icon"));
    }

    @Test
    @Tag("unit")
    void testMemberAccessUsesPublicLabel() throws Exception {
        String out = scramble("func heal(amount):\n\tself.amount = amount");

        String publicLabel = label("amount");
        assertThat(out).matches("func " + label("heal") + "\\((\\w+)\\):\n\tself\\." + publicLabel + "=\\1");
        assertThat(out).doesNotMatch("(?s).*self\\.(\\w+)=\\1$");
    }

    @Test
    @Tag("unit")
    void testPrivateNameAfterDeclarationKeywordUsesPublicLabel() throws Exception {
        String out = scramble("func heal(amount):\n\tpass\nfunc amount():\n\tpass");

        assertThat(out).contains("\nfunc " + label("amount") + "():\n\tpass");
    }

    @Test
    @Tag("unit")
    void testClassNameRegistersUserTypeAndCastIsRemoved() throws Exception {
        String out = scramble("class_name Player\nfunc heal(other):\n\tvar hero = other as Player");

        assertThat(context.getUserTypes().contains("Player")).isTrue();
        assertThat(out).matches("class_name " + label("Player") + "\nfunc " + label("heal")
                + "\\((\\w+)\\):\n\tvar \\w+=\\1");
    }

    @Test
    @Tag("unit")
    void testUnsupportedFormattingIsFatal() {
        assertThatThrownBy(() -> scramble("var s = \"{0} pts\".format([health])"))
                .isInstanceOfSatisfying(ScrambleException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ScrambleErrorCode.UNSUPPORTED_FORMATTING);
                    assertThat(e.getFileName()).isEqualTo("test.gd");
                });
    }

    @Test
    @Tag("unit")
    void testIgnoreBlockContentIsDeleted() throws Exception {
        String out = scramble("#GODOG_IGNORE\nprint(1)\nvar debug_hp = 3\n#GODOG_IGNORE\nvar health = 1");

        assertThat(out).isEqualTo("var " + label("health") + "=1");
        assertThat(context.getLabels().has("debug_hp")).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnterminatedIgnoreBlockIsFatal() {
        assertThatThrownBy(() -> scramble("#GODOG_IGNORE\nvar health = 1\n"))
                .isInstanceOfSatisfying(ScrambleException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ScrambleErrorCode.UNTERMINATED_SPECIAL_BLOCK);
                    assertThat(e.getMessage()).contains("test.gd");
                });
    }

    @Test
    @Tag("unit")
    void testExposeDirectiveKeepsNames() throws Exception {
        String out = scramble("# GODOG_EXPOSE: health, coins\nvar health = 1\nvar coins = 2");

        assertThat(out).isEqualTo("var health=1\nvar coins=2");
        assertThat(context.getBannedLabels().isExplicitlyBanned("coins")).isTrue();
    }

    @Test
    @Tag("unit")
    void testLabelDirectiveRegistersPublicLabels() throws Exception {
        String out = scramble("#GODOG_LABEL: spawn_enemy,,coins\npass");

        assertThat(out).isEqualTo("pass");
        assertThat(context.getLabels().has("spawn_enemy")).isTrue();
        assertThat(context.getLabels().has("coins")).isTrue();
    }

    @Test
    @Tag("unit")
    void testPrivateDirectiveOverridesDeclarationKeyword() throws Exception {
        String out = scramble("#GODOG_PRIVATE: helper_fn\nfunc helper_fn():\n\tpass\nfunc heal():\n\thelper_fn()");

        assertThat(context.getLabels().has("helper_fn")).isFalse();
        assertThat(out).matches("func (\\w+)\\(\\):\n\tpass\nfunc " + label("heal") + "\\(\\):\n\t\\1\\(\\)");
    }

    @Test
    @Tag("unit")
    void testPreservedCommentsAreKept() throws Exception {
        String out = scramble("#GODOG_IF:web\nvar health = 1\n#GODOG_ENDIF");

        assertThat(out).isEqualTo("#GODOG_IF:web\nvar " + label("health") + "=1\n#GODOG_ENDIF");
        assertThat(context.isPreservedBlocksDetected()).isTrue();
    }

    @Test
    @Tag("unit")
    void testNodePathStringIsRenamedPerPart() throws Exception {
        String out = scramble("var target = get_node(\"hud/coins\")");

        assertThat(out).isEqualTo("var " + label("target") + "=get_node(\"" + label("hud") + "/" + label("coins") + "\")");
    }

    @Test
    @Tag("unit")
    void testTranslationMarkersAreStripped() throws Exception {
        String out = scramble("print(\"{{Hello there}}\")");

        assertThat(out).isEqualTo("print(\"Hello there\")");
    }

    @Test
    @Tag("unit")
    void testRegexPatternsPassThrough() throws Exception {
        String out = scramble("regex.compile('hud')\nregex.sub(subject, 'coins')");

        assertThat(out).contains(".compile('hud')").contains(",'coins')");
        assertThat(context.getLabels().has("hud")).isFalse();
        assertThat(context.getLabels().has("coins")).isFalse();
    }

    @Test
    @Tag("unit")
    void testResourcePathIsKeptWithoutMelt() throws Exception {
        String out = scramble("var scene = preload(\"res://missing/hero.tscn\")");

        assertThat(out).endsWith("=preload(\"res://missing/hero.tscn\")");
    }

    @Test
    @Tag("unit")
    void testGenericModeRenamesUnbannedIdentifiers() throws Exception {
        String source = "uniform float tint;\nvoid fragment() { COLOR = vec4(tint); }";

        String out = pipeline.scramble(source, FileMode.GENERIC, "tint.gdshader");

        String tint = label("tint");
        assertThat(out).isEqualTo("uniform float " + tint + ";\nvoid fragment() { COLOR = vec4(" + tint + "); }");
    }

    @Test
    @Tag("unit")
    void testSceneModeOnlyRenamesKnownIdentifiers() throws Exception {
        scramble("var health = 1");

        String out = pipeline.scramble("[node name=\"hud\"]\nhealth = 5\nunknown_prop = 2\n", FileMode.SCENE_RESOURCE, "main.tscn");

        assertThat(out).isEqualTo("[node name=\"" + label("hud") + "\"]\n" + label("health") + " = 5\nunknown_prop = 2\n");
        assertThat(context.getLabels().has("unknown_prop")).isFalse();
    }

    @Test
    @Tag("unit")
    void testProjectDisplayNameIsKept() throws Exception {
        String source = "[application]\n\nconfig/name=\"Hero\"\n\n[other]\nconfig/name=\"hero\"\n";

        String out = pipeline.scramble(source, FileMode.SCENE_RESOURCE, "project.godot");

        assertThat(out).isEqualTo("[application]\n\nconfig/name=\"Hero\"\n\n[other]\nconfig/name=\"" + label("hero") + "\"\n");
        assertThat(context.getLabels().has("Hero")).isFalse();
    }
}
