package com.wellnessplatform.decision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DecisionServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(DecisionServiceApplication.class, args);
    }
}
