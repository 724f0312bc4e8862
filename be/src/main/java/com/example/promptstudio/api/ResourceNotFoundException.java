package com.example.promptstudio.api;

/**
 * Thrown when a referenced entity does not exist. Mapped to 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String type, String id) {
        return new ResourceNotFoundException(type + " with id " + id + " not found");
    }
}
