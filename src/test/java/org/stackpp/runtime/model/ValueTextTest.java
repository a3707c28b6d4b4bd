package org.stackpp.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ValueTextTest {

    @ParameterizedTest
    @CsvSource({
            "7.0, 7",
            "-3.0, -3",
            "0.5, 0.5",
            "100.0, 100",
            "1.0E21, 1000000000000000000000",
            "1.0E-7, 0.0000001",
            "0.30000000000000004, 0.30000000000000004",
            "1.0E23, 100000000000000000000000",
            "2.82879384806159E17, 282879384806159000",
            "-1.0E23, -100000000000000000000000"
    })
    void formatsFiniteNumbersWithoutExponent(double value, String expected) {
        assertThat(ValueText.formatNumber(value)).isEqualTo(expected);
    }

    @Test
    void formatsSubnormalsWithShortestDigits() {
        assertThat(ValueText.formatNumber(Double.MIN_VALUE)).isEqualTo("0." + "0".repeat(323) + "5");
        assertThat(ValueText.formatNumber(1e-322)).isEqualTo("0." + "0".repeat(321) + "1");
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.1, 1.0 / 3, 2.0 / 3, 123456.789, 9007199254740993.0, 1e-5, 5e-324, 1.7976931348623157E308})
    void formattedTextReadsBackAsSameNumber(double value) {
        assertThat(Double.parseDouble(ValueText.formatNumber(value))).isEqualTo(value);
    }

    @Test
    void formatsSpecialValues() {
        assertThat(ValueText.formatNumber(0.0)).isEqualTo("0");
        assertThat(ValueText.formatNumber(-0.0)).isEqualTo("-0");
        assertThat(ValueText.formatNumber(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(ValueText.formatNumber(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
        assertThat(ValueText.formatNumber(Double.NaN)).isEqualTo("NaN");
    }

    @Test
    void debugFormatKeepsFractionOnIntegralValues() {
        assertThat(ValueText.formatNumberDebug(7)).isEqualTo("7.0");
        assertThat(ValueText.formatNumberDebug(0.25)).isEqualTo("0.25");
        assertThat(ValueText.formatNumberDebug(Double.NaN)).isEqualTo("NaN");
    }

    @Test
    void quotesAndEscapes() {
        assertThat(ValueText.quote("a\tb\\")).isEqualTo("\"a\\tb\\\\\"");
    }
}
