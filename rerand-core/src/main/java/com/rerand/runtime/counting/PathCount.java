/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.runtime.counting;

import java.math.BigInteger;

/**
 * Result of counting the accepting paths from an instruction: either a count,
 * or the instruction at which a cycle was closed.
 */
public sealed interface PathCount {

    record Counted(BigInteger value) implements PathCount {
    }

    record CycleDetected(int instruction) implements PathCount {
    }
}
