package com.ai.prescreening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PreScreeningApplication {

    public static void main(String[] args) {
        SpringApplication.run(PreScreeningApplication.class, args);
    }
}
