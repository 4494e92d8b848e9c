package com.modelops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ModelOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelOpsApplication.class, args);
    }
}
