package com.rerand.runtime.generation;

import com.rerand.api.IStringGenerator;
import com.rerand.api.exceptions.UnboundedRepetitionException;
import com.rerand.api.exceptions.UnsatisfiablePatternException;
import com.rerand.infra.config.GeneratorConfig;
import com.rerand.runtime.internal.pool.CodePointBufferPool;
import com.rerand.runtime.model.Instruction;
import com.rerand.runtime.model.Program;
import com.rerand.runtime.random.SharedRandom;
import com.rerand.runtime.sampling.AliasSampler;
import com.rerand.runtime.weights.BranchWeight;
import com.rerand.runtime.weights.WeightCompiler;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class RegexGeneratorTest {

    private static final List<String> ACYCLIC_PATTERNS = List.of(
            "a[bc]d",
            "ab|cde",
            "[a-z]{3,6}",
            "(foo|ba[rz]){2}",
            "\\d{4}-\\d{2}-\\d{2}",
            "[^a-z]{5}",
            ".{3}",
            "x?y{0,3}z",
            "a{1,3}?b",
            "^(?:\\x{1F600}|\\u00e9)[\\s]\\W$",
            "(?i:[a-c]x)y",
            "[A-Fa-f0-9]{8}(?:-[A-Fa-f0-9]{4}){3}",
            "\\Q.*+\\E!");

    private GeneratorCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new GeneratorCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Generated strings should match the pattern in every mode")
    void generatedStringsShouldMatch() {
        List<GeneratorConfig> configs = List.of(
                GeneratorConfig.builder().seed(1).build(),
                GeneratorConfig.builder().seed(2).distinctCodePoints(true).build(),
                GeneratorConfig.builder().seed(3).branchProbability(0.5).build());

        for (String pattern : ACYCLIC_PATTERNS) {
            Pattern matcher = Pattern.compile(pattern, Pattern.UNIX_LINES);
            for (GeneratorConfig config : configs) {
                RegexGenerator generator = compiler.compile(pattern, config);
                for (int i = 0; i < 200; i++) {
                    String s = generator.generate();
                    assertThat(matcher.matcher(s).matches())
                            .as("'%s' should match /%s/ with %s", s, pattern, config)
                            .isTrue();
                }
            }
        }
    }

    @Test
    @DisplayName("Dot should cover newline only when enabled")
    void dotShouldHonourNewlineFlag() {
        GeneratorConfig config = GeneratorConfig.builder().seed(5).dotMatchesNewline(true).build();
        RegexGenerator generator = compiler.compile(".{4}", config);
        Pattern matcher = Pattern.compile(".{4}", Pattern.DOTALL);

        for (int i = 0; i < 500; i++) {
            assertThat(matcher.matcher(generator.generate()).matches()).isTrue();
        }
    }

    @Test
    @DisplayName("Case-insensitive config should produce both cases")
    void shouldGenerateBothCases() {
        GeneratorConfig config = GeneratorConfig.builder().seed(8).caseInsensitive(true).build();
        RegexGenerator generator = compiler.compile("abc", config);

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String s = generator.generate();
            assertThat(s).isEqualToIgnoringCase("abc");
            seen.add(s);
        }
        assertThat(seen).contains("abc", "ABC");
    }

    @Test
    @DisplayName("Strings of a small language should be equally likely")
    void shouldBeUniformOverSmallLanguage() {
        RegexGenerator generator = compiler.compile("a[bc]d", GeneratorConfig.builder().seed(11).build());

        Map<String, Integer> counts = histogram(generator, 10_000);

        assertThat(counts.keySet()).containsExactlyInAnyOrder("abd", "acd");
        assertThat(counts.get("abd")).isBetween(4_700, 5_300);
    }

    @Test
    @DisplayName("Distinct mode should weight a class by its width")
    void distinctModeShouldWeightByWidth() {
        RegexGenerator distinct = compiler.compile("[ab]|c",
                GeneratorConfig.builder().seed(12).distinctCodePoints(true).build());
        RegexGenerator perClass = compiler.compile("[ab]|c",
                GeneratorConfig.builder().seed(13).build());

        Map<String, Integer> distinctCounts = histogram(distinct, 30_000);
        assertThat(distinctCounts.get("a")).isBetween(9_400, 10_600);
        assertThat(distinctCounts.get("b")).isBetween(9_400, 10_600);
        assertThat(distinctCounts.get("c")).isBetween(9_400, 10_600);

        Map<String, Integer> perClassCounts = histogram(perClass, 30_000);
        assertThat(perClassCounts.get("c")).isBetween(14_400, 15_600);
    }

    @Test
    @DisplayName("Unbounded repetition should fail in combinatorial mode and work with a fixed probability")
    void shouldHandleUnboundedRepetition() {
        assertThatThrownBy(() -> compiler.compile("a*", GeneratorConfig.defaults()))
                .isInstanceOf(UnboundedRepetitionException.class);

        RegexGenerator generator = compiler.compile("a*",
                GeneratorConfig.builder().seed(21).branchProbability(0.5).build());

        Set<Integer> lengths = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            String s = generator.generate();
            assertThat(s).matches("a*").hasSizeLessThan(200);
            lengths.add(s.length());
        }
        assertThat(lengths).hasSizeGreaterThan(5).contains(0, 1, 2);
    }

    @Test
    @DisplayName("Fixed mode should match patterns with loops")
    void fixedModeShouldMatchLoops() {
        String pattern = "(?:ab|c)+d*[x-z]{2,}";
        RegexGenerator generator = compiler.compile(pattern,
                GeneratorConfig.builder().seed(22).branchProbability(0.3).build());

        for (int i = 0; i < 1_000; i++) {
            assertThat(generator.generate()).matches(pattern);
        }
    }

    @Test
    @DisplayName("A lazy loop should always be able to exit in fixed mode")
    void lazyLoopShouldTerminate() {
        // Given: a probability that would round the exit weight of a*? down to zero
        GeneratorConfig.Builder tiny = GeneratorConfig.builder().seed(23).branchProbability(1e-20);

        // When/Then: it is refused up front rather than yielding a generator that never returns
        assertThatThrownBy(() -> compiler.compile("a*?", tiny.build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Generators.withProbability("a*?", 1e-20))
                .isInstanceOf(IllegalArgumentException.class);

        // And: a small but representable exit probability still terminates
        RegexGenerator generator = compiler.compile("a*?",
                GeneratorConfig.builder().seed(23).branchProbability(0.05).build());
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            for (int i = 0; i < 1_000; i++) {
                assertThat(generator.generate()).matches("a*");
            }
        });
    }

    @Test
    @DisplayName("Branches too wide for a long ratio should still split draws by language size")
    void shouldDrawWithArbitraryPrecisionWeights() {
        // Given: two alternatives of 4 free code points whose counts share no factor
        String pattern = "(?s:x.{4})|y.{4}";
        RegexGenerator generator = compiler.compile(pattern,
                GeneratorConfig.builder().seed(24).distinctCodePoints(true).build());
        Program program = generator.program();
        BranchWeight weight = WeightCompiler.combinatorial(program, true)[program.start()];
        assertThat(weight).isInstanceOf(BranchWeight.BigRatio.class);

        // When: drawing through the arbitrary-precision branch decision
        Pattern matcher = Pattern.compile(pattern, Pattern.UNIX_LINES);
        int xs = 0;
        for (int i = 0; i < 4_000; i++) {
            String s = generator.generate();
            assertThat(matcher.matcher(s).matches()).as(s).isTrue();
            if (s.startsWith("x")) {
                xs++;
            }
        }

        // Then: both alternatives come up about half the time
        assertThat(xs).isBetween(1_800, 2_200);
    }

    @Test
    @DisplayName("Concurrent callers should each get valid strings")
    void shouldBeSafeUnderConcurrency() throws Exception {
        String pattern = "[a-z]{8}-\\d{4}|(?:foo|bar){1,3}";
        RegexGenerator generator = compiler.compile(pattern, GeneratorConfig.defaults());
        Pattern matcher = Pattern.compile(pattern);

        int numThreads = 8;
        int callsPerThread = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        AtomicBoolean success = new AtomicBoolean(true);
        AtomicInteger generated = new AtomicInteger();

        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < callsPerThread; i++) {
                        if (!matcher.matcher(generator.generate()).matches()) {
                            success.set(false);
                        }
                        generated.incrementAndGet();
                    }
                } catch (RuntimeException e) {
                    success.set(false);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(success.get()).isTrue();
        assertThat(generated.get()).isEqualTo(numThreads * callsPerThread);
    }

    @Test
    @DisplayName("Pattern accessor should return the original text unchanged")
    void shouldExposeOriginalPattern() {
        String pattern = "^  (?<word>[a-z]{1,3}){0,2} \\t|x$";
        IStringGenerator generator = compiler.compile(pattern, GeneratorConfig.defaults());

        assertThat(generator.pattern()).isEqualTo(pattern);
        assertThat(generator.toString()).isEqualTo(pattern);
    }

    @Test
    @DisplayName("Same seed should reproduce the same strings")
    void shouldBeReproducibleWithSeed() {
        GeneratorConfig config = GeneratorConfig.builder().seed(42).distinctCodePoints(true).build();
        RegexGenerator first = compiler.compile("[a-z0-9]{4}|\\d+?x{0,5}", config.toBuilder().branchProbability(0.4).build());
        RegexGenerator second = compiler.compile("[a-z0-9]{4}|\\d+?x{0,5}", config.toBuilder().branchProbability(0.4).build());

        List<String> a = new ArrayList<>();
        List<String> b = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            a.add(first.generate());
            b.add(second.generate());
        }
        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("Empty and literal patterns should generate themselves")
    void shouldGenerateFixedStrings() {
        assertThat(compiler.compile("", GeneratorConfig.defaults()).generate()).isEmpty();
        assertThat(compiler.compile("hello", GeneratorConfig.defaults()).generate()).isEqualTo("hello");
        assertThat(compiler.compile("\\x{1F600}", GeneratorConfig.defaults()).generate())
                .isEqualTo(new String(Character.toChars(0x1F600)));
    }

    @Test
    @DisplayName("A pattern that matches nothing should fail at construction")
    void shouldRejectUnsatisfiablePattern() {
        assertThatThrownBy(() -> compiler.compile("[^\\x00-\\x{10FFFF}]", GeneratorConfig.defaults()))
                .isInstanceOf(UnsatisfiablePatternException.class);
        assertThatThrownBy(() -> compiler.compile("a|[^\\x00-\\x{10FFFF}]b",
                GeneratorConfig.builder().branchProbability(0.5).build()))
                .isInstanceOf(UnsatisfiablePatternException.class);
    }

    @Test
    @DisplayName("A dead alternative should never be taken in combinatorial mode")
    void shouldSkipDeadAlternative() {
        RegexGenerator generator = compiler.compile("a|[^\\x00-\\x{10FFFF}]b", GeneratorConfig.defaults());

        for (int i = 0; i < 100; i++) {
            assertThat(generator.generate()).isEqualTo("a");
        }
    }

    @Test
    @DisplayName("A reachable passthrough should be rejected as a malformed program")
    void shouldRejectPassthroughAtConstruction() {
        Program program = passthroughProgram();

        assertThatThrownBy(() -> compiler.build("malformed", program, GeneratorConfig.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("passthrough");
    }

    @Test
    @DisplayName("Walking into a passthrough should fail instead of looping")
    void walkerShouldFailOnPassthrough() {
        Program program = passthroughProgram();
        RegexGenerator generator = new RegexGenerator("malformed", program,
                new BranchWeight[program.size()], new AliasSampler[program.size()],
                new SharedRandom(new Random(1)), CodePointBufferPool.create());

        assertThatThrownBy(generator::generate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PASSTHROUGH");
    }

    @Test
    @DisplayName("Output buffers should be reused across calls")
    void shouldReuseBuffers() {
        RegexGenerator generator = compiler.compile("[a-z]{16}", GeneratorConfig.defaults());

        for (int i = 0; i < 100; i++) {
            generator.generate();
        }

        assertThat(generator.bufferPool().getReuseRate()).isGreaterThan(0.9);
    }

    private static Program passthroughProgram() {
        Program.Builder builder = Program.builder();
        builder.add(Instruction.deadEnd());
        builder.add(Instruction.accept());
        int nop = builder.add(Instruction.passthrough(1));
        return builder.start(nop).build();
    }

    private static Map<String, Integer> histogram(IStringGenerator generator, int draws) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < draws; i++) {
            counts.merge(generator.generate(), 1, Integer::sum);
        }
        return counts;
    }
}
