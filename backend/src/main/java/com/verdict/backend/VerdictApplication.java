package com.verdict.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VerdictApplication {
    public static void main(String[] args) {
        SpringApplication.run(VerdictApplication.class, args);
    }
}
