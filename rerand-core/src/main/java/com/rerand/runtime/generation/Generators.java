/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.generation;

import com.rerand.api.IStringGenerator;
import com.rerand.infra.config.GeneratorConfig;

/**
 * Convenience factories for the common generator configurations.
 *
 * <pre>{@code
 * IStringGenerator ids = Generators.create("[A-Z]{3}-[0-9]{4}");
 * String id = ids.generate();
 * }</pre>
 */
public final class Generators {

    private Generators() {
    }

    /**
     * Every string of the language is equally likely, counting each character
     * class as a single choice.
     */
    public static IStringGenerator create(String pattern) {
        return create(pattern, GeneratorConfig.defaults());
    }

    /**
     * Every string of the language is equally likely, counting every code point
     * of a character class as its own string.
     */
    public static IStringGenerator distinctCodePoints(String pattern) {
        return create(pattern, GeneratorConfig.builder().distinctCodePoints(true).build());
    }

    /**
     * Every branch takes its primary side (continue a repetition, take the
     * earlier alternative) with the given probability. Works with unbounded
     * repetition; output length is then unbounded in the worst case.
     *
     * @param probability in {@code (0, 1)}, not so close to 0 or 1 that it rounds away over {@link Long#MAX_VALUE}
     */
    public static IStringGenerator withProbability(String pattern, double probability) {
        if (!(probability > 0.0 && probability < 1.0)) {
            throw new IllegalArgumentException("probability must be in (0, 1): " + probability);
        }
        return create(pattern, GeneratorConfig.builder().branchProbability(probability).build());
    }

    public static IStringGenerator create(String pattern, GeneratorConfig config) {
        return new GeneratorCompiler().compile(pattern, config);
    }
}
