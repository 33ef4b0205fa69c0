package com.revenueplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RevenueOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RevenueOrchestratorApplication.class, args);
    }
}
