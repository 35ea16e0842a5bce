package im.arun.texmml.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

final class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void bundledDefaultsAreLoaded() {
        TexMmlConfig config = new ConfigLoader().load();

        assertThat(config.getLocalization()).isEqualTo("en");
        assertThat(config.getEncoding()).isEqualTo("UTF-8");
        assertThat(config.getTimeoutSeconds()).isEqualTo(120);
        assertThat(config.isFailOnMissingImport()).isTrue();
        assertThat(config.isFailOnMissingBibliography()).isFalse();
        assertThat(config.getMaxMacroExpansionDepth()).isEqualTo(32);
        assertThat(config.isVerifyTree()).isTrue();
    }

    @Test
    void overridesAcceptBothKeyStyles() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("timeout_seconds", "5");
        overrides.put("failOnMissingImport", "no");
        overrides.put("localization", "ru");
        overrides.put("verify_tree", false);

        TexMmlConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getTimeoutSeconds()).isEqualTo(5);
        assertThat(config.isFailOnMissingImport()).isFalse();
        assertThat(config.getLocalization()).isEqualTo("ru");
        assertThat(config.isVerifyTree()).isFalse();
    }

    @Test
    void badValuesKeepDefaults() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("timeout_seconds", "soon");
        overrides.put("no_such_key", 1);

        TexMmlConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getTimeoutSeconds()).isEqualTo(120);
    }

    @Test
    void explicitFileWins() throws IOException {
        Path file = dir.resolve("texmml.yaml");
        Files.writeString(file, "localization: ru\nmax_macro_expansion_depth: 4\nunknown_key: true\n");

        TexMmlConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getLocalization()).isEqualTo("ru");
        assertThat(config.getMaxMacroExpansionDepth()).isEqualTo(4);
        assertThat(config.getTimeoutSeconds()).isEqualTo(120);
    }

    @Test
    void missingExplicitFileFallsBackToBundled() {
        TexMmlConfig config = new ConfigLoader(dir.resolve("absent.yaml").toString()).load();

        assertThat(config.getLocalization()).isEqualTo("en");
    }

    @Test
    void loadedConfigsAreIndependent() {
        ConfigLoader loader = new ConfigLoader();
        TexMmlConfig first = loader.load();
        first.setLocalization("ru");

        assertThat(loader.load().getLocalization()).isEqualTo("en");
    }
}
