package com.architecture.memory.graphexport.runner;

import com.architecture.memory.graphexport.dto.ExportRequest;
import com.architecture.memory.graphexport.exception.InputValidationException;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

/**
 * Turns command line arguments into an {@link ExportRequest}.
 *
 * Options use Spring's {@code --name=value} form; {@code --user neo4j} with a space is not
 * understood. Dotted options ({@code --graph-export.batch-size=500},
 * {@code --logging.level.root=debug}) are configuration properties and are left to Spring.
 */
@Component
public class ExportArgumentsParser {

    static final String USER = "user";
    static final String PASSWORD = "password";
    static final String SAVE_DEPTH = "save-depth";
    static final String LOAD_INCLUDES = "load-includes";
    static final String INCLUDES_FILE = "includes-file";

    private static final Set<String> KNOWN_OPTIONS = Set.of(USER, PASSWORD, SAVE_DEPTH, LOAD_INCLUDES, INCLUDES_FILE);

    public ExportRequest parse(ApplicationArguments args) {
        for (String option : args.getOptionNames()) {
            if (!option.contains(".") && !KNOWN_OPTIONS.contains(option)) {
                throw new InputValidationException("Unknown option --" + option);
            }
        }

        List<String> paths = args.getNonOptionArgs();
        if (paths.isEmpty()) {
            throw new InputValidationException("At least one path to analyze is required");
        }

        String includesFile = single(args, INCLUDES_FILE);
        return ExportRequest.builder()
                .paths(List.copyOf(paths))
                .username(single(args, USER))
                .password(single(args, PASSWORD))
                .saveDepth(parseDepth(single(args, SAVE_DEPTH)))
                .loadIncludes(flag(args, LOAD_INCLUDES))
                .includesFile(includesFile != null ? Paths.get(includesFile) : null)
                .build();
    }

    private String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return null;
        }
        if (values.size() != 1 || values.get(0).isBlank()) {
            throw new InputValidationException("Option --" + name + " expects exactly one value, written as --"
                    + name + "=<value>");
        }
        return values.get(0);
    }

    private boolean flag(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return false;
        }
        if (values.isEmpty()) {
            return true;
        }
        String value = values.get(values.size() - 1);
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new InputValidationException("Option --" + name + " expects true or false, was " + value);
    }

    private Integer parseDepth(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InputValidationException("Option --" + SAVE_DEPTH + " expects an integer, was " + value, ex);
        }
    }
}
