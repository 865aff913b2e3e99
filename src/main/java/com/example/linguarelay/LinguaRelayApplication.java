package com.example.linguarelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinguaRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinguaRelayApplication.class, args);
    }
}
