package com.llmbridge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.llmbridge")
public class LlmBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmBridgeApplication.class, args);
    }
}
