package com.architecture.memory.graphexport.service.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ProcessExitFatalErrorHandler implements FatalErrorHandler {

    @Override
    public void terminate(int status, String message, Throwable cause) {
        log.error("[graph-export] {} Terminating with status {}", message, status, cause);
        System.exit(status);
    }
}
