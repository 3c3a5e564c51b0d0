package com.raceplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RaceOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaceOrchestratorApplication.class, args);
    }
}
