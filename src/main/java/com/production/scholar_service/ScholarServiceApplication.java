package com.production.scholar_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScholarServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScholarServiceApplication.class, args);
    }
}
