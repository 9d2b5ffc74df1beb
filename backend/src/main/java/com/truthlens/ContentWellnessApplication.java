package com.truthlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Server side of the content wellness pipeline: session coordination,
 * threshold evaluation and notification delivery.
 */
@SpringBootApplication
@EnableScheduling
public class ContentWellnessApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentWellnessApplication.class, args);
    }
}
