package com.architecture.memory.graphexport.service;

import com.architecture.memory.graphexport.exception.InputValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IncludePathsLoaderTest {

    private final IncludePathsLoader loader = new IncludePathsLoader();

    @TempDir
    Path tempDir;

    @Test
    void resolvesRelativeEntriesAgainstFileDirectory() throws IOException {
        Path configDir = Files.createDirectories(tempDir.resolve("config"));
        Path absolute = tempDir.resolve("libs").toAbsolutePath();
        Path includes = Files.writeString(configDir.resolve("includes.txt"),
                "  ../shared/src  \n\n" + absolute + "\nvendor\n");

        List<Path> paths = loader.load(includes);

        assertThat(paths).containsExactly(
                tempDir.resolve("shared/src").toAbsolutePath().normalize(),
                absolute.normalize(),
                configDir.resolve("vendor").toAbsolutePath().normalize());
    }

    @Test
    void emptyFileGivesNoIncludes() throws IOException {
        Path includes = Files.writeString(tempDir.resolve("includes.txt"), "\n   \n");

        assertThat(loader.load(includes)).isEmpty();
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nope.txt")))
                .isInstanceOf(InputValidationException.class);
    }
}
