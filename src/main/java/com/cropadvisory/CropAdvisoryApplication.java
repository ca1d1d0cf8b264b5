package com.cropadvisory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CropAdvisoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CropAdvisoryApplication.class, args);
    }
}
