package com.architecture.memory.graphexport.service;

import com.architecture.memory.graphexport.dto.ValidatedSources;
import com.architecture.memory.graphexport.exception.InputValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputPathValidatorTest {

    private final InputPathValidator validator = new InputPathValidator();

    @TempDir
    Path tempDir;

    @Test
    void filesInSameDirectoryShareTopLevel() throws IOException {
        Path first = Files.createFile(tempDir.resolve("A.java"));
        Path second = Files.createFile(tempDir.resolve("B.java"));

        ValidatedSources sources = validator.validate(List.of(first.toString(), second.toString()));

        assertThat(sources.getTopLevel()).isEqualTo(tempDir.toRealPath());
        assertThat(sources.getLocations()).hasSize(2);
    }

    @Test
    void directoryIsItsOwnTopLevel() throws IOException {
        Path src = Files.createDirectory(tempDir.resolve("src"));

        ValidatedSources sources = validator.validate(List.of(src.toString()));

        assertThat(sources.getTopLevel()).isEqualTo(src.toRealPath());
    }

    @Test
    void pathsAreNormalized() throws IOException {
        Path src = Files.createDirectory(tempDir.resolve("src"));
        Path file = Files.createFile(src.resolve("A.java"));

        ValidatedSources sources = validator.validate(List.of(src.resolve("../src/A.java").toString()));

        assertThat(sources.getLocations()).containsExactly(file.toRealPath());
    }

    @Test
    void symlinkedDirectoryResolvesToItsTarget() throws IOException {
        Path real = Files.createDirectory(tempDir.resolve("real"));
        Path link = Files.createSymbolicLink(tempDir.resolve("link"), real);

        ValidatedSources sources = validator.validate(List.of(link.toString()));

        assertThat(sources.getLocations()).containsExactly(real.toRealPath());
        assertThat(sources.getTopLevel()).isEqualTo(real.toRealPath());
    }

    @Test
    void fileThroughSymlinkedDirectorySharesTopLevelWithRealFile() throws IOException {
        Path real = Files.createDirectory(tempDir.resolve("real"));
        Path first = Files.createFile(real.resolve("A.java"));
        Files.createFile(real.resolve("B.java"));
        Path link = Files.createSymbolicLink(tempDir.resolve("link"), real);

        ValidatedSources sources = validator.validate(List.of(first.toString(), link.resolve("B.java").toString()));

        assertThat(sources.getTopLevel()).isEqualTo(real.toRealPath());
        assertThat(sources.getLocations()).containsExactly(first.toRealPath(), real.resolve("B.java").toRealPath());
    }

    @Test
    void rejectsMissingPath() {
        assertThatThrownBy(() -> validator.validate(List.of(tempDir.resolve("missing.java").toString())))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("Please use a correct path");
    }

    @Test
    void rejectsHiddenPath() throws IOException {
        Path hidden = Files.createFile(tempDir.resolve(".Hidden.java"));

        assertThatThrownBy(() -> validator.validate(List.of(hidden.toString())))
                .isInstanceOf(InputValidationException.class);
    }

    @Test
    void rejectsDifferentTopLevels() throws IOException {
        Path root = Files.createFile(tempDir.resolve("A.java"));
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Path other = Files.createFile(nested.resolve("B.java"));

        assertThatThrownBy(() -> validator.validate(List.of(root.toString(), other.toString())))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("same top level path");
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> validator.validate(List.of()))
                .isInstanceOf(InputValidationException.class);
    }
}
