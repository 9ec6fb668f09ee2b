package com.architecture.memory.graphexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;

/**
 * Command line entry point: analyzes source files into a code graph and pushes it to Neo4j.
 *
 * <pre>
 * java -jar graph-export.jar [--user=neo4j] [--password=password] [--save-depth=-1]
 *      [--load-includes] [--includes-file=includes.txt] &lt;paths...&gt;
 * </pre>
 *
 * Option values must be attached with {@code =}, as in {@code --save-depth=3}.
 *
 * The Neo4j driver is created per run by the connection layer, so Boot's driver
 * auto-configuration is switched off.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
public class GraphExportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GraphExportApplication.class, args)));
    }
}
