package org.godog.scrambler.labels;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the {@link BannedLabels} registry and the shipped engine label list.
 */
public class BannedLabelsTest {

    @Test
    @Tag("unit")
    void testEngineDefaultsContainKeywordsAndCallbacks() {
        BannedLabels banned = BannedLabels.withEngineDefaults();

        assertThat(banned.contains("func")).isTrue();
        assertThat(banned.contains("_ready")).isTrue();
        assertThat(banned.contains("Vector2")).isTrue();
        assertThat(banned.contains("player_score")).isFalse();
        assertThat(banned.isExplicitlyBanned("func")).isFalse();
    }

    @Test
    @Tag("unit")
    void testExplicitBan() {
        BannedLabels banned = BannedLabels.withEngineDefaults();

        banned.banExplicitly("player_score");

        assertThat(banned.contains("player_score")).isTrue();
        assertThat(banned.isExplicitlyBanned("player_score")).isTrue();
    }

    @Test
    @Tag("integration")
    void testAddFromFileSkipsCommentsAndBlanks(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("banned.txt");
        Files.writeString(file, "# plugin API\nplugin_hook\n\n  other_hook  \n");
        BannedLabels banned = BannedLabels.withEngineDefaults();

        banned.addFromFile(file);

        assertThat(banned.contains("plugin_hook")).isTrue();
        assertThat(banned.contains("other_hook")).isTrue();
        assertThat(banned.contains("# plugin API")).isFalse();
    }
}
