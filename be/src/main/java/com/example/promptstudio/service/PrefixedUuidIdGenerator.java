package com.example.promptstudio.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class PrefixedUuidIdGenerator implements IdGenerator {

    @Override
    public String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
