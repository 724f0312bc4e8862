package com.example.promptstudio.api;

/**
 * Thrown when an operation is well-formed but breaks a business rule
 * (wrong experiment state, version of another prompt, ...). Mapped to 409.
 */
public class DomainRuleViolationException extends RuntimeException {

    public DomainRuleViolationException(String message) {
        super(message);
    }
}
