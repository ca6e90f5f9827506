package com.vitalwatch.detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriftDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftDetectorApplication.class, args);
    }
}
