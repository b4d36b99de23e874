/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.model;

/**
 * Instruction kinds of a compiled pattern program.
 */
public enum Opcode {
    /** No continuation; a walk that reaches it cannot produce a string. */
    DEAD_END,
    /** Empty step to the successor. Never emitted by the bundled compiler. */
    PASSTHROUGH,
    /** One code point drawn from a set of ranges. */
    CHAR_CLASS,
    /** One fixed code point. */
    LITERAL,
    /** Any code point of {@link Alphabet#ANY}. */
    ANY,
    /** Any code point of {@link Alphabet#ANY_NOT_NEWLINE}. */
    ANY_NOT_NEWLINE,
    /** Two mutually exclusive continuations: primary and alternate. */
    BRANCH,
    /** Capture group boundary; no output. */
    GROUP,
    /** Successful end of a match. */
    ACCEPT
}
