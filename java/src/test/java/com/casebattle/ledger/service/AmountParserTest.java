package com.casebattle.ledger.service;

import com.casebattle.ledger.exception.InvalidAmountException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class AmountParserTest {

    private final AmountParser parser = new AmountParser();

    @Test
    void testParse_DotCommaAndWhitespaceFormsAreEqual() {
        BigDecimal plain = parser.parse("1000");
        BigDecimal comma = parser.parse("1000,00");
        BigDecimal padded = parser.parse(" 1000.00 ");

        assertThat(plain).isEqualTo(new BigDecimal("1000.00"));
        assertThat(comma).isEqualTo(plain);
        assertThat(padded).isEqualTo(plain);
    }

    @Test
    void testParse_AlwaysTwoFractionDigits() {
        assertThat(parser.parse("5").scale()).isEqualTo(2);
        assertThat(parser.parse("12,5")).isEqualTo(new BigDecimal("12.50"));
    }

    @Test
    void testParse_RoundsHalfEven() {
        assertThat(parser.parse("0.015")).isEqualTo(new BigDecimal("0.02"));
        assertThat(parser.parse("0.025")).isEqualTo(new BigDecimal("0.02"));
        assertThat(parser.parse("10,126")).isEqualTo(new BigDecimal("10.13"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-5", "0", "0,00", "-0.01", "0.004", "0.005"})
    void testParse_NonPositive_ThrowsInvalidAmount(String raw) {
        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("greater than 0");
    }

    @Test
    void testParse_LargestStorableAmountAccepted() {
        assertThat(parser.parse("99999999999999999,99")).isEqualTo(AmountParser.MAX_AMOUNT);
        assertThat(parser.parse("99999999999999999.994")).isEqualTo(AmountParser.MAX_AMOUNT);
        assertThat(parser.parse("1e16")).isEqualTo(new BigDecimal("10000000000000000.00"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"100000000000000000", "99999999999999999.995", "1e20", "1E999999999"})
    void testParse_AboveMaximum_ThrowsInvalidAmount(String raw) {
        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("at most 99999999999999999.99");
    }

    @Test
    void testParse_VanishinglySmall_ThrowsInvalidAmount() {
        assertThatThrownBy(() -> parser.parse("1e-999999999"))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("greater than 0");
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "", "   ", "1,000.50", "12abc", "NaN"})
    void testParse_NotANumber_ThrowsInvalidAmount(String raw) {
        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("must be a number");
    }

    @Test
    void testParse_Null_ThrowsInvalidAmount() {
        assertThatThrownBy(() -> parser.parse(null))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessage("Amount is required");
    }

    @Test
    void testParse_KeepsRawTextOnFailure() {
        assertThatThrownBy(() -> parser.parse("abc"))
                .isInstanceOfSatisfying(InvalidAmountException.class,
                        e -> assertThat(e.getRawAmount()).isEqualTo("abc"));
    }
}
