package com.example.promptstudio.service;

/**
 * Source of entity identifiers. All services take ids from here so tests can substitute a predictable one.
 */
public interface IdGenerator {

    /** Returns a new unique id starting with {@code prefix + "_"}. */
    String newId(String prefix);
}
