package com.gillianbc.retirement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetirementEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetirementEngineApplication.class, args);
    }
}
