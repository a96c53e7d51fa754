package com.vidnyan.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Harness Guard - pre-execution rule enforcement for coding agent tool calls.
 */
@SpringBootApplication
public class GuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardApplication.class, args);
    }
}
