package com.lungrisk.training;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrainingServiceApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TrainingServiceApplication.class, args)));
    }
}
