package com.hogql.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@Tag("generator")
@Tag("tier1")
@DisplayName("HogQLQuoting Tests")
public class HogQLQuotingTest {

    @ParameterizedTest
    @CsvSource({
        "event, event",
        "$pageview, $pageview",
        "_col1, _col1",
        "my column, `my column`",
        "1abc, `1abc`",
        "a-b, `a-b`"
    })
    @DisplayName("Identifiers are quoted only when needed")
    void testQuoteIdentifierIfNeeded(String identifier, String expected) {
        assertThat(HogQLQuoting.quoteIdentifierIfNeeded(identifier)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Backticks and backslashes are escaped")
    void testIdentifierEscaping() {
        assertThat(HogQLQuoting.quoteIdentifier("a`b")).isEqualTo("`a\\`b`");
        assertThat(HogQLQuoting.quoteIdentifier("a\\b")).isEqualTo("`a\\\\b`");
    }

    @Test
    @DisplayName("Empty identifier is rejected")
    void testEmptyIdentifier() {
        assertThatThrownBy(() -> HogQLQuoting.quoteIdentifierIfNeeded(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Literals are single quoted")
    void testQuoteLiteral() {
        assertThat(HogQLQuoting.quoteLiteral("$screen")).isEqualTo("'$screen'");
        assertThat(HogQLQuoting.quoteLiteral("o'clock")).isEqualTo("'o\\'clock'");
        assertThat(HogQLQuoting.quoteLiteral(null)).isEqualTo("NULL");
    }
}
