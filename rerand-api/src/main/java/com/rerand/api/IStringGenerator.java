/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api;

/**
 * Produces random strings from the language of a pattern.
 *
 * <p>Implementations are safe for concurrent use by multiple threads.
 */
public interface IStringGenerator {

    /**
     * Generates one random string that matches the pattern.
     */
    String generate();

    /**
     * The pattern text this generator was built from, exactly as supplied.
     */
    String pattern();
}
