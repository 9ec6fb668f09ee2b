package com.architecture.memory.graphexport.service;

import com.architecture.memory.graphexport.exception.InputValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads include paths from a file, one per line. Relative entries are resolved against the
 * directory that holds the file.
 */
@Component
@Slf4j
public class IncludePathsLoader {

    public List<Path> load(Path includesFile) {
        Path file = includesFile.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new InputValidationException("Includes file does not exist: " + file);
        }
        log.info("[graph-export] Load includes from file: {}", file);

        Path baseDir = file.getParent();
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> resolve(baseDir, line))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException ex) {
            throw new InputValidationException("Cannot read includes file " + file, ex);
        }
    }

    private Path resolve(Path baseDir, String entry) {
        try {
            Path path = Paths.get(entry);
            return path.isAbsolute() ? path.normalize() : baseDir.resolve(path).normalize();
        } catch (InvalidPathException ex) {
            throw new InputValidationException("Invalid include path '" + entry + "'", ex);
        }
    }
}
