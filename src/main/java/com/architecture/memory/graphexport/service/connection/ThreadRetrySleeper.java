package com.architecture.memory.graphexport.service.connection;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ThreadRetrySleeper implements RetrySleeper {

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        Thread.sleep(delay.toMillis());
    }
}
