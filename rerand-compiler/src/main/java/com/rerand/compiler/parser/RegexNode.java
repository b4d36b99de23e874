/*
 * Copyright (c) 2025 Rerand
 * Licensed under the Apache License, Version 2.0
 */
package com.rerand.compiler.parser;

import com.rerand.runtime.model.CodePointRange;

import java.util.List;

/**
 * Parsed pattern syntax tree.
 */
public sealed interface RegexNode {

    /** Matches the empty string. */
    record Empty() implements RegexNode {
    }

    record Literal(int codePoint) implements RegexNode {
    }

    /** Normalized ranges; an empty list matches nothing. */
    record CharClass(List<CodePointRange> ranges) implements RegexNode {
        public CharClass {
            ranges = List.copyOf(ranges);
        }
    }

    record AnyChar(boolean matchesNewline) implements RegexNode {
    }

    record Concat(List<RegexNode> items) implements RegexNode {
        public Concat {
            items = List.copyOf(items);
        }
    }

    record Alternate(List<RegexNode> alternatives) implements RegexNode {
        public Alternate {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * {@code max} is {@link #UNBOUNDED} for {@code *}, {@code +} and {@code {n,}}.
     */
    record Repeat(RegexNode node, int min, int max, boolean greedy) implements RegexNode {
        public static final int UNBOUNDED = -1;

        public boolean isUnbounded() {
            return max == UNBOUNDED;
        }
    }

    record Group(RegexNode node, int index) implements RegexNode {
    }
}
