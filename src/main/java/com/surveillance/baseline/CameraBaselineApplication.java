package com.surveillance.baseline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CameraBaselineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CameraBaselineApplication.class, args);
    }
}
