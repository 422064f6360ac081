package com.portfoliosync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioSyncApplication.class, args);
    }
}
