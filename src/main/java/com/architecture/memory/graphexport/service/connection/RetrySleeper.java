package com.architecture.memory.graphexport.service.connection;

import java.time.Duration;

@FunctionalInterface
public interface RetrySleeper {

    void sleep(Duration delay) throws InterruptedException;
}
