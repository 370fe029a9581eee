package io.deephaven.pivot.parsers;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StrftimePatternsTest {
    @Test
    public void detectsStrftime() {
        assertThat(StrftimePatterns.isStrftime("%Y-%m-%d")).isTrue();
        assertThat(StrftimePatterns.isStrftime("yyyy-MM-dd")).isFalse();
    }

    @Test
    public void translatesDirectivesAndQuotesLiterals() {
        assertThat(StrftimePatterns.toJavaPattern("%Y-%m-%d %H:%M:%S")).isEqualTo("yyyy'-'MM'-'dd' 'HH':'mm':'ss");
        assertThat(StrftimePatterns.toJavaPattern("%F")).isEqualTo("yyyy-MM-dd");
        assertThat(StrftimePatterns.toJavaPattern("%d %B, %Y")).isEqualTo("dd' 'MMMM', 'yyyy");
    }

    @Test
    public void escapesPercentAndApostrophe() {
        assertThat(StrftimePatterns.toJavaPattern("%Y%%")).isEqualTo("yyyy'%'");
        assertThat(StrftimePatterns.toJavaPattern("%Y'%m")).isEqualTo("yyyy''''MM");
    }

    @Test
    public void rejectsUnsupportedDirectives() {
        assertThatThrownBy(() -> StrftimePatterns.toJavaPattern("%Y-%Q"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Date format `%Y-%Q` uses the unsupported directive %Q");
        assertThatThrownBy(() -> StrftimePatterns.toJavaPattern("%Y%"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Date format `%Y%` ends with an incomplete directive");
    }
}
