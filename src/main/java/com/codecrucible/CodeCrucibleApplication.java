package com.codecrucible;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeCrucibleApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeCrucibleApplication.class, args);
    }
}
