/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api;

import java.util.Map;

/**
 * Observes the construction of a string generator from a pattern.
 *
 * <p>Building a generator from pattern text reports four stages, numbered out of
 * {@code 4}:
 * <ol>
 *   <li>{@code PARSING}: the pattern becomes an instruction program.
 *       Metrics {@code instructions} and {@code branches}.</li>
 *   <li>{@code WEIGHTING}: every reachable branch gets a weight, from path
 *       counts or the configured fixed probability. Metric {@code weightedBranches}.</li>
 *   <li>{@code SAMPLER_BUILDING}: each character class and dot gets an alias
 *       table. Metric {@code samplers}.</li>
 *   <li>{@code VERIFICATION}: no reachable instruction is a dead end or
 *       a passthrough. Metric {@code reachableInstructions}.</li>
 * </ol>
 * Building from an already compiled program skips {@code PARSING} and reports
 * stages 2 to 4 only.
 *
 * <p>A failing stage calls {@link #onError} and the same exception then
 * propagates out of the build, so a listener never needs to rethrow it. Callbacks
 * run on the building thread.
 *
 * <pre>
 * compiler.setCompilationListener(new CompilationListener() {
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) { }
 *
 *     public void onStageComplete(String stageName, StageResult result) {
 *         log.fine(stageName + " took " + result.durationMicros() + " us, " + result.metrics());
 *     }
 *
 *     public void onError(String stageName, Exception error) {
 *         log.warning("pattern rejected in " + stageName + ": " + error.getMessage());
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    /**
     * @param stageNumber 1-based position of the stage among {@code totalStages}
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    /**
     * The stage threw {@code error}; the build rethrows it once this returns.
     */
    void onError(String stageName, Exception error);

    /**
     * Timing and counters of one finished stage.
     *
     * @param metrics counters named per stage, see the class documentation
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
