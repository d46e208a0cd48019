package org.godog.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigLoaderTest {

    @Test
    @Tag("integration")
    void testExplicitFileOverridesDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "godog.label.seed = 7\ngodog.melt.enabled = true\n");

        Config config = ConfigLoader.load(file.toFile());

        assertThat(config.getLong("godog.label.seed")).isEqualTo(7L);
        assertThat(config.getBoolean("godog.melt.enabled")).isTrue();
        assertThat(config.getInt("godog.label.length")).isEqualTo(8);
    }

    @Test
    @Tag("unit")
    void testMissingExplicitFileIsRejected(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.load(dir.resolve("missing.conf").toFile()))
                .isInstanceOf(ConfigException.class);
    }
}
