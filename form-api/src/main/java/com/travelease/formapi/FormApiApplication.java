package com.travelease.formapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormApiApplication.class, args);
    }
}
