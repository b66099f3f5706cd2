package com.myorg.lhub.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IngestionHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(IngestionHubApplication.class, args);
    }
}
