package com.golfdraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GolfDraftApplication {
    public static void main(String[] args) {
        SpringApplication.run(GolfDraftApplication.class, args);
    }
}
