package com.kotsin.advisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Signal advisor: synthesizes advisory signals per category and tracks each one until it
 * completes, stops out or expires.
 */
@SpringBootApplication
public class SignalAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalAdvisorApplication.class, args);
    }
}
