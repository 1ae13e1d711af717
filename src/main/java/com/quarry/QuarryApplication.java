package com.quarry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Quarry query engine.
 *
 * Quarry answers queries against datasets stored in ClickHouse. Each request is
 * mapped to a storage, rewritten by the storage's query processors and executed,
 * possibly in several adaptive round trips when a single one would read too much.
 *
 * @author Quarry Team
 * @version 1.0.0
 */
@SpringBootApplication
public class QuarryApplication {

    /**
     * Main entry point for the Quarry query engine.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(QuarryApplication.class, args);
    }
}
