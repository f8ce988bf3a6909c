package com.example.requestgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RequestGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RequestGateApplication.class, args);
    }
}
