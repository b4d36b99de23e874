package com.rerand.infra.config;

import com.rerand.api.CompileFlag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneratorConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(GeneratorConfig.ENV_DISTINCT_CODE_POINTS);
        System.clearProperty(GeneratorConfig.ENV_BRANCH_PROBABILITY);
        System.clearProperty(GeneratorConfig.ENV_SEED);
        System.clearProperty(GeneratorConfig.ENV_CASE_INSENSITIVE);
        System.clearProperty(GeneratorConfig.ENV_DOT_MATCHES_NEWLINE);
    }

    @Test
    @DisplayName("Defaults should select combinatorial mode with no flags")
    void shouldHaveSensibleDefaults() {
        GeneratorConfig config = GeneratorConfig.defaults();

        assertThat(config.isCombinatorial()).isTrue();
        assertThat(config.isDistinctCodePoints()).isFalse();
        assertThat(config.getSeed()).isEmpty();
        assertThat(config.getCompileFlags()).isEmpty();
    }

    @Test
    @DisplayName("Should reject branch probabilities outside [0, 1)")
    void shouldValidateProbability() {
        assertThatThrownBy(() -> GeneratorConfig.builder().branchProbability(1.0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("branchProbability");
        assertThatThrownBy(() -> GeneratorConfig.builder().branchProbability(-0.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(GeneratorConfig.builder().branchProbability(0.25).build().isCombinatorial()).isFalse();
    }

    @Test
    @DisplayName("Should read overrides from system properties")
    void shouldLoadFromSystemProperties() {
        // Given
        System.setProperty(GeneratorConfig.ENV_DISTINCT_CODE_POINTS, "true");
        System.setProperty(GeneratorConfig.ENV_BRANCH_PROBABILITY, "0.75");
        System.setProperty(GeneratorConfig.ENV_SEED, "1234");
        System.setProperty(GeneratorConfig.ENV_CASE_INSENSITIVE, "yes");

        // When
        GeneratorConfig config = GeneratorConfig.loadDefault();

        // Then
        assertThat(config.isDistinctCodePoints()).isTrue();
        assertThat(config.getBranchProbability()).isEqualTo(0.75);
        assertThat(config.getSeed()).contains(1234L);
        assertThat(config.getCompileFlags()).containsExactly(CompileFlag.CASE_INSENSITIVE);
    }

    @Test
    @DisplayName("Should ignore values that do not parse or are out of range")
    void shouldIgnoreInvalidOverrides() {
        System.setProperty(GeneratorConfig.ENV_BRANCH_PROBABILITY, "1.5");
        System.setProperty(GeneratorConfig.ENV_SEED, "not-a-number");

        GeneratorConfig config = GeneratorConfig.loadDefault();

        assertThat(config.isCombinatorial()).isTrue();
        assertThat(config.getSeed()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a fixed probability that rounds to zero over Long.MAX_VALUE")
    void shouldRejectUnrepresentableProbability() {
        // Given: a probability below 1 / Long.MAX_VALUE
        GeneratorConfig.Builder builder = GeneratorConfig.builder().branchProbability(1e-20);

        // When/Then: building fails instead of yielding a never-exiting lazy loop
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1.0E-20");
        assertThat(GeneratorConfig.builder().branchProbability(1e-18).build().isCombinatorial()).isFalse();
    }

    @Test
    @DisplayName("Should ignore an unrepresentable probability override")
    void shouldIgnoreUnrepresentableOverride() {
        System.setProperty(GeneratorConfig.ENV_BRANCH_PROBABILITY, "1e-20");

        GeneratorConfig config = GeneratorConfig.loadDefault();

        assertThat(config.isCombinatorial()).isTrue();
    }

    @Test
    @DisplayName("Seeded configs should hand out identically seeded sources")
    void shouldCreateSeededRandoms() {
        GeneratorConfig config = GeneratorConfig.builder().seed(7).build();

        assertThat(config.randomSource().nextLong()).isEqualTo(config.randomSource().nextLong());

        Random shared = new Random(1);
        GeneratorConfig withRandom = config.toBuilder().random(shared).build();
        assertThat(withRandom.randomSource()).isSameAs(shared);
    }

    @Test
    @DisplayName("toBuilder should copy every setting")
    void toBuilderShouldCopySettings() {
        GeneratorConfig original = GeneratorConfig.builder()
                .distinctCodePoints(true)
                .branchProbability(0.1)
                .seed(5)
                .dotMatchesNewline(true)
                .flag(CompileFlag.LITERAL)
                .build();

        GeneratorConfig copy = original.toBuilder().dotMatchesNewline(false).build();

        assertThat(copy.isDistinctCodePoints()).isTrue();
        assertThat(copy.getBranchProbability()).isEqualTo(0.1);
        assertThat(copy.getSeed()).contains(5L);
        assertThat(copy.getCompileFlags()).containsExactly(CompileFlag.LITERAL);
        assertThat(original.getCompileFlags())
                .containsExactlyInAnyOrder(CompileFlag.DOT_MATCHES_NEWLINE, CompileFlag.LITERAL);
    }
}
