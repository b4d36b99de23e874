/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.infra.config;

import com.rerand.api.CompileFlag;
import com.rerand.runtime.weights.WeightCompiler;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Settings for building a string generator.
 *
 * <p><b>Weighting:</b> with {@code branchProbability == 0} (the default) the
 * generator is combinatorial and every matching string is equally likely. In
 * that mode {@code distinctCodePoints} decides whether {@code [a-z]} counts as 26
 * strings or as one. A probability in {@code (0, 1)} switches to fixed mode,
 * where every branch takes its primary side with that probability.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #loadDefault()} reads the following keys, first from the environment
 * and then from system properties of the same name:
 * <pre>
 * RERAND_DISTINCT_CODE_POINTS=true
 * RERAND_BRANCH_PROBABILITY=0.25
 * RERAND_SEED=42
 * RERAND_CASE_INSENSITIVE=true
 * RERAND_DOT_MATCHES_NEWLINE=false
 * </pre>
 * Values that do not parse, or are out of range, are logged and ignored.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * GeneratorConfig config = GeneratorConfig.builder()
 *     .distinctCodePoints(true)
 *     .seed(42)
 *     .build();
 *
 * IStringGenerator generator = Generators.create("[a-f0-9]{8}", config);
 * }</pre>
 */
public final class GeneratorConfig {

    private static final Logger logger = Logger.getLogger(GeneratorConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_DISTINCT_CODE_POINTS = "RERAND_DISTINCT_CODE_POINTS";
    static final String ENV_BRANCH_PROBABILITY = "RERAND_BRANCH_PROBABILITY";
    static final String ENV_SEED = "RERAND_SEED";
    static final String ENV_CASE_INSENSITIVE = "RERAND_CASE_INSENSITIVE";
    static final String ENV_DOT_MATCHES_NEWLINE = "RERAND_DOT_MATCHES_NEWLINE";

    private final boolean distinctCodePoints;
    private final double branchProbability;
    private final Long seed;
    private final Random random;
    private final Set<CompileFlag> compileFlags;

    private GeneratorConfig(Builder builder) {
        this.distinctCodePoints = builder.distinctCodePoints;
        this.branchProbability = builder.branchProbability;
        this.seed = builder.seed;
        this.random = builder.random;
        this.compileFlags = builder.compileFlags.isEmpty()
                ? Set.of()
                : Set.copyOf(builder.compileFlags);

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Combinatorial mode, one count per character class, time-seeded.
     */
    public static GeneratorConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by environment variables and system properties.
     */
    public static GeneratorConfig loadDefault() {
        return builder().fromEnvironment().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.distinctCodePoints = distinctCodePoints;
        builder.branchProbability = branchProbability;
        builder.seed = seed;
        builder.random = random;
        builder.compileFlags.addAll(compileFlags);
        return builder;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public boolean isDistinctCodePoints() {
        return distinctCodePoints;
    }

    public double getBranchProbability() {
        return branchProbability;
    }

    /**
     * Whether branch weights come from path counting rather than a fixed probability.
     */
    public boolean isCombinatorial() {
        return branchProbability == 0.0;
    }

    public Optional<Long> getSeed() {
        return Optional.ofNullable(seed);
    }

    public Set<CompileFlag> getCompileFlags() {
        return compileFlags;
    }

    /**
     * The random source for a generator built from this config.
     *
     * <p>A {@link Random} passed to {@link Builder#random(Random)} is returned as-is
     * on every call, so all generators built from this config share it. Otherwise
     * each call creates a new one, seeded with {@link #getSeed()} if present and
     * with the current time if not.
     */
    public Random randomSource() {
        if (random != null) {
            return random;
        }
        return seed != null ? new Random(seed) : new Random(System.nanoTime());
    }

    private void validate() {
        if (!isValidProbability(branchProbability)) {
            throw new IllegalArgumentException("branchProbability must be 0 or a representable value in (0, 1): "
                    + branchProbability);
        }
    }

    private static boolean isValidProbability(double p) {
        if (p == 0.0) {
            return true;
        }
        try {
            WeightCompiler.fixedNumerator(p);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "GeneratorConfig{" +
                "distinctCodePoints=" + distinctCodePoints +
                ", branchProbability=" + branchProbability +
                ", seed=" + seed +
                ", compileFlags=" + compileFlags +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private boolean distinctCodePoints = false;
        private double branchProbability = 0.0;
        private Long seed;
        private Random random;
        private final Set<CompileFlag> compileFlags = EnumSet.noneOf(CompileFlag.class);

        private Builder() {
        }

        public Builder distinctCodePoints(boolean distinct) {
            this.distinctCodePoints = distinct;
            return this;
        }

        /**
         * @param probability in {@code [0, 1)}; 0 selects combinatorial mode
         */
        public Builder branchProbability(double probability) {
            this.branchProbability = probability;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Use this source for every generator built from the config. Takes
         * precedence over {@link #seed(long)}.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder flag(CompileFlag flag) {
            this.compileFlags.add(flag);
            return this;
        }

        public Builder caseInsensitive(boolean enable) {
            return toggle(CompileFlag.CASE_INSENSITIVE, enable);
        }

        public Builder dotMatchesNewline(boolean enable) {
            return toggle(CompileFlag.DOT_MATCHES_NEWLINE, enable);
        }

        private Builder toggle(CompileFlag flag, boolean enable) {
            if (enable) {
                compileFlags.add(flag);
            } else {
                compileFlags.remove(flag);
            }
            return this;
        }

        /**
         * Applies overrides from environment variables, falling back to system
         * properties.
         */
        public Builder fromEnvironment() {
            getBoolean(ENV_DISTINCT_CODE_POINTS).ifPresent(val -> this.distinctCodePoints = val);
            getDouble(ENV_BRANCH_PROBABILITY).ifPresent(val -> {
                if (isValidProbability(val)) {
                    this.branchProbability = val;
                } else {
                    logger.warning("Ignoring out-of-range value for " + ENV_BRANCH_PROBABILITY + ": " + val);
                }
            });
            getLong(ENV_SEED).ifPresent(val -> this.seed = val);
            getBoolean(ENV_CASE_INSENSITIVE).ifPresent(val -> toggle(CompileFlag.CASE_INSENSITIVE, val));
            getBoolean(ENV_DOT_MATCHES_NEWLINE).ifPresent(val -> toggle(CompileFlag.DOT_MATCHES_NEWLINE, val));
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private static Optional<String> getEnvOrProperty(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded setting: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> getLong(String key) {
            return getEnvOrProperty(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Double> getDouble(String key) {
            return getEnvOrProperty(key).map(val -> {
                try {
                    return Double.parseDouble(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid double value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Boolean> getBoolean(String key) {
            return getEnvOrProperty(key).map(val -> {
                String normalized = val.toLowerCase();
                return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
            });
        }
    }
}
