package com.researchplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {
    "com.researchplatform.orchestrator",
    "com.researchplatform.marketdata",
    "com.researchplatform.analysis"
})
public class ResearchOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchOrchestratorApplication.class, args);
    }
}
