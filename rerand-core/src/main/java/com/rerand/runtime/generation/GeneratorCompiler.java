/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.generation;

import com.rerand.api.CompilationListener;
import com.rerand.api.IPatternCompiler;
import com.rerand.compiler.PatternCompiler;
import com.rerand.infra.config.GeneratorConfig;
import com.rerand.runtime.internal.pool.CodePointBufferPool;
import com.rerand.runtime.model.Alphabet;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Opcode;
import com.rerand.runtime.model.Program;
import com.rerand.runtime.random.SharedRandom;
import com.rerand.runtime.sampling.AliasSampler;
import com.rerand.runtime.weights.BranchWeight;
import com.rerand.runtime.weights.WeightCompiler;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Builds {@link RegexGenerator}s from pattern text.
 *
 * <p>Construction runs four stages, each reported to the optional
 * {@link CompilationListener}:
 * <ol>
 *   <li>PARSING: pattern text to {@link Program}</li>
 *   <li>WEIGHTING: branch weights, by path counting or a fixed probability</li>
 *   <li>SAMPLER_BUILDING: alias tables for classes and the any-character opcodes</li>
 *   <li>VERIFICATION: no dead end or passthrough reachable</li>
 * </ol>
 * Any failure aborts construction; no generator is returned.
 */
public class GeneratorCompiler {
    private static final Logger logger = Logger.getLogger(GeneratorCompiler.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.rerand.core";
    private static final int TOTAL_STAGES = 4;

    private final IPatternCompiler patternCompiler;
    private Tracer tracer;
    private CompilationListener listener;

    public GeneratorCompiler() {
        this(new PatternCompiler(), GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    public GeneratorCompiler(Tracer tracer) {
        this(new PatternCompiler(tracer), tracer);
    }

    public GeneratorCompiler(IPatternCompiler patternCompiler, Tracer tracer) {
        this.patternCompiler = Objects.requireNonNull(patternCompiler, "patternCompiler");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
        patternCompiler.setTracer(tracer);
    }

    /**
     * Set to null to stop receiving events.
     */
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    /**
     * Compiles {@code pattern} and builds a generator for it.
     *
     * @throws com.rerand.api.exceptions.PatternCompileException       on a syntax error
     * @throws com.rerand.api.exceptions.UnboundedRepetitionException  on a cycle in combinatorial mode
     * @throws com.rerand.api.exceptions.UnsatisfiablePatternException if the pattern matches nothing
     */
    public RegexGenerator compile(String pattern, GeneratorConfig config) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(config, "config");

        Span span = tracer.spanBuilder("compile-generator").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("patternLength", pattern.length());
            span.setAttribute("combinatorial", config.isCombinatorial());
            span.setAttribute("distinctCodePoints", config.isDistinctCodePoints());
            long startTime = System.nanoTime();

            Program program = runStage("PARSING", 1,
                    () -> patternCompiler.compile(pattern, config.getCompileFlags()),
                    p -> Map.of("instructions", p.size(), "branches", p.count(Opcode.BRANCH)));
            RegexGenerator generator = assemble(pattern, program, config);

            double millis = (System.nanoTime() - startTime) / 1_000_000.0;
            span.setAttribute("instructions", program.size());
            logger.info(String.format("Built generator for '%s' in %.2f ms (%d instructions, %s)",
                    pattern, millis, program.size(), describeMode(config)));
            return generator;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Builds a generator for an already compiled program. {@code pattern} is
     * only kept for diagnostics.
     */
    public RegexGenerator build(String pattern, Program program, GeneratorConfig config) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(config, "config");
        return assemble(pattern, program, config);
    }

    private RegexGenerator assemble(String pattern, Program program, GeneratorConfig config) {
        SharedRandom random = new SharedRandom(config.randomSource());

        BranchWeight[] weights = runStage("WEIGHTING", 2,
                () -> config.isCombinatorial()
                        ? WeightCompiler.combinatorial(program, config.isDistinctCodePoints())
                        : WeightCompiler.fixed(program, config.getBranchProbability()),
                w -> Map.of("weightedBranches", countNonNull(w)));

        AliasSampler[] samplers = runStage("SAMPLER_BUILDING", 3,
                () -> buildSamplers(program, random),
                s -> Map.of("samplers", countNonNull(s)));

        runStage("VERIFICATION", 4,
                () -> ProgramVerifier.verify(pattern, program, weights),
                reachable -> Map.of("reachableInstructions", reachable));

        return new RegexGenerator(pattern, program, weights, samplers, random, CodePointBufferPool.create());
    }

    private static AliasSampler[] buildSamplers(Program program, SharedRandom random) {
        AliasSampler[] samplers = new AliasSampler[program.size()];
        AliasSampler any = null;
        AliasSampler anyNotNewline = null;
        for (int i = 0; i < program.size(); i++) {
            Instruction instruction = program.instruction(i);
            switch (instruction.opcode()) {
                case CHAR_CLASS -> samplers[i] = AliasSampler.sharing(instruction.ranges(), random);
                case ANY -> {
                    if (any == null) {
                        any = AliasSampler.sharing(Alphabet.ANY, random);
                    }
                    samplers[i] = any;
                }
                case ANY_NOT_NEWLINE -> {
                    if (anyNotNewline == null) {
                        anyNotNewline = AliasSampler.sharing(Alphabet.ANY_NOT_NEWLINE, random);
                    }
                    samplers[i] = anyNotNewline;
                }
                default -> {
                }
            }
        }
        return samplers;
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try {
            T result = stage.get();
            long duration = System.nanoTime() - start;
            logger.fine(() -> String.format("Stage %s completed in %.3f ms", stageName, duration / 1_000_000.0));
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, duration, metrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        }
    }

    private static int countNonNull(Object[] values) {
        int n = 0;
        for (Object value : values) {
            if (value != null) {
                n++;
            }
        }
        return n;
    }

    private static String describeMode(GeneratorConfig config) {
        if (!config.isCombinatorial()) {
            return "fixed probability " + config.getBranchProbability();
        }
        return config.isDistinctCodePoints() ? "combinatorial, distinct code points" : "combinatorial";
    }
}
