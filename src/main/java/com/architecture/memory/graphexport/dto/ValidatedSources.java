package com.architecture.memory.graphexport.dto;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Absolute, normalized input locations that all share {@link #topLevel}.
 */
@Value
public class ValidatedSources {
    List<Path> locations;
    Path topLevel;
}
