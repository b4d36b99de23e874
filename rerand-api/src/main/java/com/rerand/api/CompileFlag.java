/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.api;

/**
 * Options that change how pattern text is interpreted.
 */
public enum CompileFlag {
    /** Letters match their simple upper/lower/title case variants. Same as {@code (?i)}. */
    CASE_INSENSITIVE,
    /** {@code .} also matches a line feed. Same as {@code (?s)}. */
    DOT_MATCHES_NEWLINE,
    /** The whole pattern is literal text; no metacharacters. */
    LITERAL
}
