package com.lumen.query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QueryEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(QueryEngineApplication.class, args);
    }
}
