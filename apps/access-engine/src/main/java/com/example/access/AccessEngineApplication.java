package com.example.access;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessEngineApplication.class, args);
    }

}
