package com.rerand.runtime.counting;

import com.rerand.compiler.PatternCompiler;
import com.rerand.runtime.model.Alphabet;
import com.rerand.runtime.model.Program;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PathCounterTest {

    private PatternCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new PatternCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Should count each character class once by default")
    void shouldCountClassesOnce() {
        assertThat(count("a[bc]d", false)).isEqualTo(BigInteger.ONE);
        assertThat(count("ab|cde", false)).isEqualTo(BigInteger.TWO);
        assertThat(count("[ab]|c", false)).isEqualTo(BigInteger.TWO);
    }

    @Test
    @DisplayName("Should multiply by class width when counting distinct code points")
    void shouldCountDistinctCodePoints() {
        assertThat(count("a[bc]d", true)).isEqualTo(BigInteger.TWO);
        assertThat(count("[ab]|c", true)).isEqualTo(BigInteger.valueOf(3));
        assertThat(count(".{2}", true))
                .isEqualTo(BigInteger.valueOf(Alphabet.ANY_NOT_NEWLINE_SIZE).pow(2));
        assertThat(count("(?s).", true)).isEqualTo(BigInteger.valueOf(Alphabet.ANY_SIZE));
    }

    @Test
    @DisplayName("Optional repetition should add one string per extra length")
    void shouldCountBoundedRepetition() {
        assertThat(count("a{0,1000}", false)).isEqualTo(BigInteger.valueOf(1001));
        assertThat(count("x?y?", false)).isEqualTo(BigInteger.valueOf(4));
    }

    @Test
    @DisplayName("Should count very deep programs without overflowing the stack")
    void shouldHandleDeepPrograms() {
        assertThat(count("(?:a|b){1000}", false)).isEqualTo(BigInteger.TWO.pow(1000));
    }

    @Test
    @DisplayName("Empty and unsatisfiable patterns should count one and zero")
    void shouldCountTrivialPatterns() {
        assertThat(count("", false)).isEqualTo(BigInteger.ONE);
        assertThat(count("[^\\x00-\\x{10FFFF}]", true)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("Should report a cycle instead of a count for unbounded repetition")
    void shouldDetectCycle() {
        Program program = compiler.compile("a*");
        PathCounter counter = new PathCounter(program, false);

        PathCount result = counter.count(program.start());

        assertThat(result).isInstanceOf(PathCount.CycleDetected.class);
        assertThat(((PathCount.CycleDetected) result).instruction()).isEqualTo(program.start());

        // Counter stays usable after an aborted walk
        assertThat(counter.count(1)).isEqualTo(new PathCount.Counted(BigInteger.ONE));
        assertThat(counter.count(program.start())).isInstanceOf(PathCount.CycleDetected.class);
    }

    private BigInteger count(String pattern, boolean distinct) {
        Program program = compiler.compile(pattern);
        PathCount result = new PathCounter(program, distinct).count(program.start());
        assertThat(result).isInstanceOf(PathCount.Counted.class);
        return ((PathCount.Counted) result).value();
    }
}
