package com.compid.core.config;

import com.compid.core.platform.CompilerRootResolver;
import com.compid.core.version.IntersectionMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("compid.yaml");
        Files.writeString(configFile, """
            versions:
              intersection: LEGACY

            compiler:
              rootVariable: TOOLBOX_COMPILER_ROOT
            """);

        CompidConfig config = ConfigLoader.load(configFile);

        assertThat(config.intersectionMode()).isEqualTo(IntersectionMode.LEGACY);
        assertThat(config.rootVariable()).isEqualTo("TOOLBOX_COMPILER_ROOT");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("compid.yaml");
        Files.writeString(configFile, """
            versions:
              intersection: LEGACY
            unknownSection:
              key: value
            """);

        CompidConfig config = ConfigLoader.load(configFile);

        assertThat(config.compiler()).isNull();
        assertThat(config.intersectionMode()).isEqualTo(IntersectionMode.LEGACY);
        assertThat(config.rootVariable()).isEqualTo(CompilerRootResolver.DEFAULT_ROOT_VARIABLE);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        CompidConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(CompidConfig.defaults());
        assertThat(config.intersectionMode()).isEqualTo(IntersectionMode.RANGE);
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("compid.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CompidConfig.defaults());
    }

    @Test
    void load_unknownEnumValue_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("compid.yaml");
        Files.writeString(configFile, """
            versions:
              intersection: SOMETIMES
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CompidConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("compid.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(CompidConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(CompidConfig.defaults());
    }

    @Test
    void load_null_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(CompidConfig.defaults());
    }
}
