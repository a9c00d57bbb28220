package com.example.promptgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromptGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptGatewayApplication.class, args);
    }

}
