package com.durableflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the DurableFlow engine: HTTP submission API, worker,
 * timer scheduler and recovery in one process.
 */
@SpringBootApplication
public class DurableFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DurableFlowApplication.class, args);
    }
}
