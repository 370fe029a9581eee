package io.deephaven.pivot.parsers;

import io.deephaven.pivot.tokenization.CustomDoubleParser;
import io.deephaven.pivot.tokenization.FastCustomDoubleParser;
import io.deephaven.pivot.tokenization.JdkDoubleParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DoubleParserTest {
    @Test
    public void fastParserIsRegistered() {
        assertThat(CustomDoubleParser.load()).containsInstanceOf(FastCustomDoubleParser.class);
        assertThat(CustomDoubleParser.loadOrJdk()).isInstanceOf(FastCustomDoubleParser.class);
    }

    @Test
    public void bothParsersAgree() {
        final DoubleParser fast = DoubleParser.create();
        final DoubleParser jdk = DoubleParser.of(JdkDoubleParser.INSTANCE);
        for (final String s : new String[] {"0", "-1.5", "3.14159", "1e10", "2.5E-3", " 42 "}) {
            assertThat(fast.tryParse(s)).isEqualTo(jdk.tryParse(s));
        }
    }

    @Test
    public void malformedDoublesAreRejected() {
        final DoubleParser parser = DoubleParser.create();
        assertThat(parser.tryParse("")).isNull();
        assertThat(parser.tryParse("abc")).isNull();
        assertThat(parser.tryParse("1.2.3")).isNull();
    }

    @Test
    public void javaOnlyLiteralsAreRejected() {
        final DoubleParser fast = DoubleParser.create();
        final DoubleParser jdk = DoubleParser.of(JdkDoubleParser.INSTANCE);
        for (final String s : new String[] {"0x1p3", "2.5f", "1d", "7D"}) {
            assertThat(fast.tryParse(s)).isNull();
            assertThat(jdk.tryParse(s)).isNull();
        }
        assertThat(jdk.tryParse("-Infinity")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(fast.tryParse("NaN")).isNaN();
    }

    @Test
    public void rendersInPlainNotation() {
        final DoubleParser parser = DoubleParser.create();
        assertThat(parser.format(2.0)).isEqualTo("2");
        assertThat(parser.format(1e10)).isEqualTo("10000000000");
        assertThat(parser.format(0.25)).isEqualTo("0.25");
        assertThat(parser.format(1.5e-7)).isEqualTo("0.00000015");
    }
}
