package com.example.promptstudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromptStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptStudioApplication.class, args);
    }
}
