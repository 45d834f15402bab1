package com.trainingplatform.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrainingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainingEngineApplication.class, args);
    }
}
