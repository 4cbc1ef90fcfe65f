package org.ontodsl.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the precedence of configuration sources in {@link ConfigLoader} and the mapping to
 * {@link CompilerOptions}.
 */
@ExtendWith(LogWatchExtension.class)
public class ConfigLoaderTest {

    private static final String PREFIX_PROPERTY = "ontodsl.codegen.import-prefix";

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(PREFIX_PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @Tag("unit")
    void testDefaultsComeFromReferenceConf() {
        Config config = ConfigLoader.load(null);

        CompilerOptions options = CompilerOptions.fromConfig(config);
        assertThat(options.maxExpressionDepth()).isEqualTo(64);
        assertThat(options.importPrefix()).isEqualTo("file:///");
        assertThat(options.factory().keyField()).isEqualTo("factory_id");
        assertThat(options.unitTable().factorColumn()).isEqualTo("factor");
        assertThat(options.sourceRelationshipPrefix()).isEqualTo("FROM_");
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    @Tag("unit")
    void testFileOverridesDefaults(@TempDir Path dir) throws IOException {
        File file = dir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), String.join("\n",
                "ontodsl.compiler.max-expression-depth = 8",
                "ontodsl.codegen.factory { label = \"Site\", key-field = \"site_id\" }"));

        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.load(file));

        assertThat(options.maxExpressionDepth()).isEqualTo(8);
        assertThat(options.factory().label()).isEqualTo("Site");
        assertThat(options.factory().keyField()).isEqualTo("site_id");
        assertThat(options.factory().relationship()).isEqualTo("AT_FACTORY");
    }

    /**
     * Verifies that a system property wins over the configuration file.
     */
    @Test
    @Tag("unit")
    void testSystemPropertyOverridesFile(@TempDir Path dir) throws IOException {
        File file = dir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), PREFIX_PROPERTY + " = \"file:///from-file/\"");
        System.setProperty(PREFIX_PROPERTY, "https://from-property/");
        ConfigFactory.invalidateCaches();

        CompilerOptions options = CompilerOptions.fromConfig(ConfigLoader.load(file));

        assertThat(options.importPrefix()).isEqualTo("https://from-property/");
    }

    @Test
    @Tag("unit")
    void testMissingExplicitFileIsRejected(@TempDir Path dir) {
        File missing = dir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing.conf");
    }

    @Test
    @Tag("unit")
    void testInvalidExpressionDepthIsRejected() {
        Config config = ConfigFactory.parseString("ontodsl.compiler.max-expression-depth = 0")
                .withFallback(ConfigFactory.defaultReference());

        assertThatThrownBy(() -> CompilerOptions.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-expression-depth");
    }
}
