package com.architecture.memory.graphexport.runner;

import com.architecture.memory.graphexport.exception.CodeAnalysisException;
import com.architecture.memory.graphexport.exception.GraphConnectionException;
import com.architecture.memory.graphexport.exception.GraphExportException;
import com.architecture.memory.graphexport.exception.InputValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.ExitCodeEvent;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.GenericApplicationContext;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * A runner failure reaches Spring Boot wrapped in an {@link IllegalStateException}; the exit
 * status still comes from the {@link GraphExportException} in the cause chain.
 */
class ExportExitCodeTest {

    @Test
    void connectionFailureExitsWithThree() {
        assertThat(exitCodeOf(new GraphConnectionException("Unable to connect to bolt://localhost after 10 attempt(s)")))
                .containsExactly(GraphConnectionException.EXIT_CODE);
    }

    @Test
    void invalidInputExitsWithTwo() {
        assertThat(exitCodeOf(new InputValidationException("Please use a correct path. It was: /missing")))
                .containsExactly(InputValidationException.EXIT_CODE);
    }

    @Test
    void nestedCauseStillDecidesTheCode() {
        CodeAnalysisException analysis = new CodeAnalysisException("Spoon could not build a model of /src",
                new IllegalArgumentException("bad source"));

        assertThat(exitCodeOf(new IllegalStateException("wrapped", analysis)))
                .containsExactly(CodeAnalysisException.EXIT_CODE);
    }

    private List<Integer> exitCodeOf(RuntimeException thrown) {
        ExitCodeRecorder recorder = new ExitCodeRecorder();
        SpringApplication application = new SpringApplication(EmptyConfig.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setBannerMode(Banner.Mode.OFF);
        application.setLogStartupInfo(false);
        application.addListeners(recorder);
        application.addInitializers(context -> ((GenericApplicationContext) context)
                .registerBean(ApplicationRunner.class, () -> args -> {
                    throw thrown;
                }));

        assertThatThrownBy(() -> application.run()).isInstanceOf(IllegalStateException.class);
        return recorder.codes;
    }

    @Configuration(proxyBeanMethods = false)
    static class EmptyConfig {
    }

    static class ExitCodeRecorder implements ApplicationListener<ExitCodeEvent> {

        private final List<Integer> codes = new ArrayList<>();

        @Override
        public void onApplicationEvent(ExitCodeEvent event) {
            codes.add(event.getExitCode());
        }
    }
}
