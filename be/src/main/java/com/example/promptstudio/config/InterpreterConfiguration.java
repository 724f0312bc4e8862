package com.example.promptstudio.config;

import com.example.promptstudio.interpreter.PipelineGraphInterpreter;
import com.example.promptstudio.service.JsonDocuments;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InterpreterConfiguration {

    @Bean
    public PipelineGraphInterpreter pipelineGraphInterpreter(JsonDocuments jsonDocuments) {
        return new PipelineGraphInterpreter(jsonDocuments);
    }
}
