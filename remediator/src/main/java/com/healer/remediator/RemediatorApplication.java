package com.healer.remediator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RemediatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemediatorApplication.class, args);
    }
}
