package io.deephaven.pivot.reading.headers;

import io.deephaven.pivot.util.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HeaderIndexResolverTest {
    private static final List<String> HEADERS = Arrays.asList(
            "FIELDNAME1", "FIELDNAME2", "FIELDNAME1", "FIELDNAME2[0]", "FIELDNAME2[0]");

    @Test
    public void resolvesEverySelectorForm() throws ConfigurationException {
        assertThat(HeaderIndexResolver.resolve("0", HEADERS, true)).isEqualTo(0);
        assertThat(HeaderIndexResolver.resolve("4", HEADERS, true)).isEqualTo(4);
        assertThat(HeaderIndexResolver.resolve("FIELDNAME1", HEADERS, true)).isEqualTo(0);
        assertThat(HeaderIndexResolver.resolve("FIELDNAME1[1]", HEADERS, true)).isEqualTo(2);
        assertThat(HeaderIndexResolver.resolve("'FIELDNAME2[0]'", HEADERS, true)).isEqualTo(3);
        assertThat(HeaderIndexResolver.resolve("'FIELDNAME2[0]'[1]", HEADERS, true)).isEqualTo(4);
        assertThat(HeaderIndexResolver.resolve("\"FIELDNAME2\"", HEADERS, true)).isEqualTo(1);
        assertThat(HeaderIndexResolver.resolve("\"FIELDNAME2[0]\"[1]", HEADERS, true)).isEqualTo(4);
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("'FIELDNAME2[0]'[2]", HEADERS, true))
                .hasMessage("There are only 2 occurrences of the fieldname FIELDNAME2[0]");
    }

    @Test
    public void quotePairsAreRemovedFromNames() throws ConfigurationException {
        final List<String> headers = Arrays.asList("city", "state, country", "it's", "say \"hi\"");
        assertThat(HeaderIndexResolver.resolve("'state, country'", headers, true)).isEqualTo(1);
        assertThat(HeaderIndexResolver.resolve("\"state, country\"", headers, true)).isEqualTo(1);
        assertThat(HeaderIndexResolver.resolve("\"it's\"", headers, true)).isEqualTo(2);
        assertThat(HeaderIndexResolver.resolve("'say \"hi\"'", headers, true)).isEqualTo(3);
        assertThat(HeaderIndexResolver.resolveAll(Arrays.asList("city,'state, country'"), headers, true))
                .containsExactly(0, 1);
    }

    @Test
    public void indexOutOfRange() {
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("5", HEADERS, true))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Column selection must be between 0 <= selection < 5, got 5");
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("99999999999", HEADERS, true))
                .hasMessage("Column selection must be between 0 <= selection < 5, got 99999999999");
    }

    @Test
    public void badNames() {
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("missing", HEADERS, true))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Could not find the fieldname `missing` in the header");
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("", HEADERS, true))
                .hasMessage("Could not parse the fieldname \"\"");
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("FIELDNAME1[5]", HEADERS, true))
                .hasMessage("There are only 2 occurrences of the fieldname FIELDNAME1");
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("FIELDNAME2[a]", HEADERS, true))
                .hasMessage("Could not parse the fieldname FIELDNAME2[a]. You may need to encapsulate the field in "
                        + "quotes");
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("FIELDNAME2[]", HEADERS, true))
                .hasMessageStartingWith("Fieldnames with brackets must be in quotes");
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("a[1]2]", HEADERS, true))
                .hasMessageStartingWith("Fieldnames with brackets must be in quotes");
    }

    @Test
    public void emptyHeaderNameCanBeSelected() throws ConfigurationException {
        assertThat(HeaderIndexResolver.resolve("", Arrays.asList("a", "", "b"), true)).isEqualTo(1);
    }

    @Test
    public void withoutHeaderRowOnlyIndicesResolve() throws ConfigurationException {
        assertThat(HeaderIndexResolver.resolve("3", HEADERS, false)).isEqualTo(3);
        assertThatThrownBy(() -> HeaderIndexResolver.resolve("FIELDNAME1", HEADERS, false))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("The input has no header row, so `FIELDNAME1` must be a 0-based field index");
    }

    @Test
    public void splitsOnUnquotedCommas() throws ConfigurationException {
        assertThat(HeaderIndexResolver.splitSelectors("a,b")).containsExactly("a", "b");
        assertThat(HeaderIndexResolver.splitSelectors("'a,b,c',c")).containsExactly("'a,b,c'", "c");
        assertThat(HeaderIndexResolver.splitSelectors("\"x, y\",z")).containsExactly("\"x, y\"", "z");
        assertThat(HeaderIndexResolver.splitSelectors("single")).containsExactly("single");
        assertThat(HeaderIndexResolver.splitSelectors("\"it's, ok\",'a\"b'")).containsExactly("\"it's, ok\"", "'a\"b'");
    }

    @Test
    public void malformedSelectorStrings() {
        assertThatThrownBy(() -> HeaderIndexResolver.splitSelectors(","))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("One of the fieldnames ends with an unquoted comma");
        assertThatThrownBy(() -> HeaderIndexResolver.splitSelectors("a,"))
                .hasMessage("One of the fieldnames ends with an unquoted comma");
        assertThatThrownBy(() -> HeaderIndexResolver.splitSelectors("'a,b"))
                .hasMessage("Quotes inside fieldname were not properly closed");
        assertThatThrownBy(() -> HeaderIndexResolver.splitSelectors("'a\""))
                .hasMessage("Quotes inside fieldname were not properly closed");
    }

    @Test
    public void duplicatesKeepTheirFirstPosition() throws ConfigurationException {
        assertThat(HeaderIndexResolver.resolveAll(Arrays.asList("FIELDNAME2,0", "FIELDNAME1", "1"), HEADERS, true))
                .containsExactly(1, 0);
        assertThat(HeaderIndexResolver.resolveAll(Arrays.asList("4", "0", "'FIELDNAME2[0]'[1]"), HEADERS, true))
                .containsExactly(4, 0);
        assertThat(HeaderIndexResolver.resolveAll(Collections.emptyList(), HEADERS, true)).isEmpty();
    }
}
