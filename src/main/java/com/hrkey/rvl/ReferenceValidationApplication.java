package com.hrkey.rvl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReferenceValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReferenceValidationApplication.class, args);
    }
}
