package com.whereq.foundry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Foundry.
 * This service supervises long-running beatmap generation workers, infers their
 * progress from console output and exposes job state for polling and live streaming.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class FoundryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoundryApplication.class, args);
    }
}
