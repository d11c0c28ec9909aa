package com.adaptivelearning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdaptiveLearningApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveLearningApplication.class, args);
    }
}
