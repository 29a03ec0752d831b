package com.project.regimen.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegimenBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegimenBackendApplication.class, args);
    }
}
