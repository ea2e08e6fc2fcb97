package com.production.log_rag_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogRagServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogRagServiceApplication.class, args);
    }
}
