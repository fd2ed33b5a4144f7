package com.infergate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Infergate - admission control and dynamic batching in
 * front of local embedding models.
 */
@SpringBootApplication
public class InfergateApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfergateApplication.class, args);
    }
}
