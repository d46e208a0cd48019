package org.godog.scrambler.frontend.strings;

import org.godog.scrambler.frontend.strings.StringContentClassifier.ProtocolPath;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link StringContentClassifier}.
 */
public class StringContentClassifierTest {

    @Test
    @Tag("unit")
    void testTranslations() {
        assertThat(StringContentClassifier.hasTranslations("{{Start game}}")).isTrue();
        assertThat(StringContentClassifier.hasTranslations("{not marked}")).isFalse();
        assertThat(StringContentClassifier.parseTranslations("{{Score}}: {{Lives}}")).isEqualTo("Score: Lives");
        assertThat(StringContentClassifier.parseTranslations("{{$1 off}}")).isEqualTo("$1 off");
    }

    @Test
    @Tag("unit")
    void testProtocolPaths() {
        assertThat(StringContentClassifier.looksLikeProtocolPath("res://scenes/hero.tscn")).isTrue();
        assertThat(StringContentClassifier.looksLikeProtocolPath("hud/coins")).isFalse();
        assertThat(StringContentClassifier.getProtocolAndPath("user://save.cfg"))
                .isEqualTo(new ProtocolPath("user", "save.cfg"));
    }

    @Test
    @Tag("unit")
    void testFileExtension() {
        List<String> structural = List.of("tscn", "tres", "gd");

        assertThat(StringContentClassifier.checkFileExtension(Path.of("scenes/hero.TSCN"), structural)).isTrue();
        assertThat(StringContentClassifier.checkFileExtension(Path.of("icon.png"), structural)).isFalse();
        assertThat(StringContentClassifier.checkFileExtension(Path.of("README"), structural)).isFalse();
    }

    @Test
    @Tag("unit")
    void testNodePaths() {
        assertThat(StringContentClassifier.looksLikeNodePath("hud")).isTrue();
        assertThat(StringContentClassifier.looksLikeNodePath("../hud/%coins")).isTrue();
        assertThat(StringContentClassifier.looksLikeNodePath("/root/main:position:x")).isTrue();
        assertThat(StringContentClassifier.looksLikeNodePath("two words")).isFalse();
        assertThat(StringContentClassifier.looksLikeNodePath("")).isFalse();
        assertThat(StringContentClassifier.looksLikeNodePath("3d")).isFalse();
    }

    @Test
    @Tag("unit")
    void testProcessNodePathKeepsSeparators() throws Exception {
        String out = StringContentClassifier.processNodePath("../hud/%coins:position",
                part -> part.toUpperCase(Locale.ROOT));

        assertThat(out).isEqualTo("../HUD/%COINS:POSITION");
    }
}
