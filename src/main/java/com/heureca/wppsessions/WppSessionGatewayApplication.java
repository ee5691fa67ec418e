package com.heureca.wppsessions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WppSessionGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WppSessionGatewayApplication.class, args);
    }
}
