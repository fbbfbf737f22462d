package com.tradegate.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GatingEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(GatingEngineApplication.class, args);
    }
}
