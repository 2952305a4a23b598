package com.valuebet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the value-bet interpreter service.
 */
@SpringBootApplication
public class ValueBetApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValueBetApplication.class, args);
    }
}
