package com.researchplatform.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {
    "com.researchplatform.monitor",
    "com.researchplatform.marketdata"
})
public class WatchlistMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchlistMonitorApplication.class, args);
    }
}
