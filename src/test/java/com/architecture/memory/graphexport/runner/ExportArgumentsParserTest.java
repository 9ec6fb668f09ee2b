package com.architecture.memory.graphexport.runner;

import com.architecture.memory.graphexport.dto.ExportRequest;
import com.architecture.memory.graphexport.exception.InputValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportArgumentsParserTest {

    private final ExportArgumentsParser parser = new ExportArgumentsParser();

    @Test
    void defaultsLeaveOverridesUnset() {
        ExportRequest request = parser.parse(new DefaultApplicationArguments("src/A.java", "src/B.java"));

        assertThat(request.getPaths()).containsExactly("src/A.java", "src/B.java");
        assertThat(request.getUsername()).isNull();
        assertThat(request.getPassword()).isNull();
        assertThat(request.getSaveDepth()).isNull();
        assertThat(request.isLoadIncludes()).isFalse();
        assertThat(request.getIncludesFile()).isNull();
    }

    @Test
    void readsAllOptions() {
        ExportRequest request = parser.parse(new DefaultApplicationArguments(
                "--user=admin", "--password=s3cret", "--save-depth=2",
                "--load-includes", "--includes-file=conf/includes.txt", "src"));

        assertThat(request.getPaths()).containsExactly("src");
        assertThat(request.getUsername()).isEqualTo("admin");
        assertThat(request.getPassword()).isEqualTo("s3cret");
        assertThat(request.getSaveDepth()).isEqualTo(2);
        assertThat(request.isLoadIncludes()).isTrue();
        assertThat(request.getIncludesFile()).isEqualTo(Paths.get("conf/includes.txt"));
    }

    @Test
    void acceptsUnboundedDepth() {
        ExportRequest request = parser.parse(new DefaultApplicationArguments("--save-depth=-1", "src"));

        assertThat(request.getSaveDepth()).isEqualTo(-1);
    }

    @Test
    void leavesConfigurationPropertiesToSpring() {
        ExportRequest request = parser.parse(new DefaultApplicationArguments("--graph-export.batch-size=10", "src"));

        assertThat(request.getPaths()).containsExactly("src");
    }

    @Test
    void rejectsMissingPaths() {
        assertThatThrownBy(() -> parser.parse(new DefaultApplicationArguments("--user=neo4j")))
                .isInstanceOf(InputValidationException.class);
    }

    @Test
    void spaceSeparatedValueAsksForEqualsForm() {
        assertThatThrownBy(() -> parser.parse(new DefaultApplicationArguments("--user", "admin", "src")))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("--user=<value>");
    }

    @Test
    void rejectsNonNumericDepth() {
        assertThatThrownBy(() -> parser.parse(new DefaultApplicationArguments("--save-depth=deep", "src")))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("save-depth");
    }

    @Test
    void rejectsUnknownOption() {
        assertThatThrownBy(() -> parser.parse(new DefaultApplicationArguments("--purge=false", "src")))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("--purge");
    }
}
