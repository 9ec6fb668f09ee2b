package com.architecture.memory.graphexport.service;

import com.architecture.memory.graphexport.dto.ValidatedSources;
import com.architecture.memory.graphexport.exception.InputValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the paths to analyze before any work starts.
 *
 * Every path must exist and must not be hidden. Paths are resolved to their real location, so
 * symbolic links are followed. The top level of a directory is the directory itself, of a file
 * its parent; all paths must share the same top level.
 */
@Component
@Slf4j
public class InputPathValidator {

    public ValidatedSources validate(List<String> paths) {
        if (paths == null || paths.isEmpty()) {
            throw new InputValidationException("At least one path to analyze is required");
        }

        List<Path> locations = new ArrayList<>(paths.size());
        Path topLevel = null;
        for (String raw : paths) {
            Path path = toAbsolute(raw);
            if (!Files.exists(path) || isHidden(path)) {
                throw new InputValidationException("Please use a correct path. It was: " + path);
            }
            path = toReal(path);
            Path currentTopLevel = Files.isDirectory(path) ? path : path.getParent();
            if (topLevel == null) {
                topLevel = currentTopLevel;
            } else if (!topLevel.equals(currentTopLevel)) {
                throw new InputValidationException("All files should have the same top level path. Expected "
                        + topLevel + " but " + path + " is under " + currentTopLevel);
            }
            locations.add(path);
        }

        log.debug("[graph-export] Validated {} path(s) under {}", locations.size(), topLevel);
        return new ValidatedSources(List.copyOf(locations), topLevel);
    }

    private Path toAbsolute(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InputValidationException("Please use a correct path. It was empty");
        }
        try {
            return Paths.get(raw).toAbsolutePath().normalize();
        } catch (InvalidPathException ex) {
            throw new InputValidationException("Please use a correct path. It was: " + raw, ex);
        }
    }

    private Path toReal(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            throw new InputValidationException("Cannot resolve path " + path, ex);
        }
    }

    private boolean isHidden(Path path) {
        try {
            return Files.isHidden(path);
        } catch (IOException ex) {
            throw new InputValidationException("Cannot inspect path " + path, ex);
        }
    }
}
