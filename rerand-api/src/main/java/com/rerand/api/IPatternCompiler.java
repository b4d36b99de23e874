/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api;

import com.rerand.api.exceptions.PatternCompileException;
import com.rerand.runtime.model.Program;

import io.opentelemetry.api.trace.Tracer;
import java.util.Set;

/**
 * Contract for compiling pattern text into an executable {@link Program}.
 */
public interface IPatternCompiler {

    /**
     * Compiles a pattern.
     *
     * @param pattern pattern text
     * @param flags   interpretation options
     * @return compiled program
     * @throws PatternCompileException if the pattern is malformed or uses unsupported syntax
     */
    Program compile(String pattern, Set<CompileFlag> flags);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
