package com.sportsdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the sports data federation service.
 */
@SpringBootApplication
public class SportsDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(SportsDataApplication.class, args);
    }
}
