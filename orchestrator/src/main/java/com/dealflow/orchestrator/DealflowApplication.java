package com.dealflow.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DealflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealflowApplication.class, args);
    }
}
