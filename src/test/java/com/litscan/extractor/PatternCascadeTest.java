package com.litscan.extractor;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class PatternCascadeTest {

    @Test
    void apply_shouldReturnFirstPresentResult() {
        PatternCascade<String> cascade = PatternCascade.of("demo",
                text -> Optional.empty(),
                text -> Optional.of("second"),
                text -> Optional.of("third"));

        assertThat(cascade.apply("anything")).contains("second");
        assertThat(cascade.size()).isEqualTo(3);
        assertThat(cascade.getName()).isEqualTo("demo");
    }

    @Test
    void apply_shouldShortCircuitBlankText() {
        PatternCascade<String> cascade = PatternCascade.of("demo", text -> Optional.of("hit"));

        assertThat(cascade.apply("   ")).isEmpty();
        assertThat(cascade.apply(null)).isEmpty();
    }

    @Test
    void firstGroup_shouldTreatBlankGroupAsMiss() {
        PatternCascade<String> cascade = PatternCascade.of("version",
                PatternCascade.firstGroup(Pattern.compile("version:(\\s*)"), String::trim),
                PatternCascade.firstGroup(Pattern.compile("v(\\d+)")));

        assertThat(cascade.apply("version: v42")).contains("42");
    }
}
