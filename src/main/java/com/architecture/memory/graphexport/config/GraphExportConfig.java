package com.architecture.memory.graphexport.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GraphExportProperties.class)
public class GraphExportConfig {
    // Binds graph-export.* from application.yml
}
