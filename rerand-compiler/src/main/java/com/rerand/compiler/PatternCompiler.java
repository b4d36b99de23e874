/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.compiler;

import com.rerand.api.CompileFlag;
import com.rerand.api.IPatternCompiler;
import com.rerand.api.exceptions.PatternCompileException;
import com.rerand.compiler.parser.PatternParser;
import com.rerand.compiler.parser.RegexNode;
import com.rerand.runtime.model.Opcode;
import com.rerand.runtime.model.Program;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles pattern text into a {@link Program}: parse, then emit.
 */
public class PatternCompiler implements IPatternCompiler {
    private static final Logger logger = Logger.getLogger(PatternCompiler.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.rerand.compiler";

    private Tracer tracer;

    public PatternCompiler() {
        this(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    public PatternCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    public Program compile(String pattern) {
        return compile(pattern, Set.of());
    }

    @Override
    public Program compile(String pattern, Set<CompileFlag> flags) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(flags, "flags");

        Span span = tracer.spanBuilder("compile-pattern").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("patternLength", pattern.length());

            PatternParser parser = new PatternParser(pattern, flags);
            RegexNode root = parser.parse();
            Program program = new ProgramEmitter(pattern).emit(root);

            span.setAttribute("instructions", program.size());
            span.setAttribute("branches", program.count(Opcode.BRANCH));
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Compiled pattern '%s' (%d groups) into %d instructions:%n%s",
                        pattern, parser.groupCount(), program.size(), program));
            }
            return program;
        } catch (PatternCompileException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
}
