package com.dnobretech.loaningestor.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class ValueNormalizerTest {

    @Test
    void fixesScientificNotation() {
        assertThat(ValueNormalizer.fixScientific("1.23456789012E+11")).isEqualTo("123456789012");
        assertThat(ValueNormalizer.fixScientific("9.876543210e+09")).isEqualTo("9876543210");
        assertThat(ValueNormalizer.fixScientific(" 450000 ")).isEqualTo("450000");
    }

    @Test
    void keepsOriginalWhenNotParseable() {
        assertThat(ValueNormalizer.fixScientific("flat E+12")).isEqualTo("flat E+12");
    }

    @Test
    void hugeExponentIsLeftUntouched() {
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            assertThat(ValueNormalizer.fixScientific("1e+20000000")).isEqualTo("1e+20000000");
            assertThat(ValueNormalizer.fixScientific("9.99E+19")).isEqualTo("9.99E+19");
            assertThat(ValueNormalizer.plainDecimal("1e+20000000")).isNull();
            assertThat(ValueNormalizer.plainDecimal("1e-20000000")).isNull();
        });
        assertThat(ValueNormalizer.fixScientific("9.2E+18")).isEqualTo("9200000000000000000");
    }

    @Test
    void plainDecimalKeepsFractions() {
        assertThat(ValueNormalizer.plainDecimal("45000.50")).isEqualTo("45000.5");
        assertThat(ValueNormalizer.plainDecimal("450000.0")).isEqualTo("450000");
        assertThat(ValueNormalizer.plainDecimal("4.5E+5")).isEqualTo("450000");
        assertThat(ValueNormalizer.plainDecimal(" 1000 ")).isEqualTo("1000");
        assertThat(ValueNormalizer.plainDecimal("12abc")).isNull();
        assertThat(ValueNormalizer.plainDecimal("abc")).isNull();
    }

    @Test
    void titleCasesEachWord() {
        assertThat(ValueNormalizer.titleCase("john SMITH")).isEqualTo("John Smith");
        assertThat(ValueNormalizer.titleCase("self employed")).isEqualTo("Self Employed");
        assertThat(ValueNormalizer.titleCase("a  b")).isEqualTo("A  B");
    }
}
