package com.lemur.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LemurApplication {

    public static void main(String[] args) {
        SpringApplication.run(LemurApplication.class, args);
    }
}
