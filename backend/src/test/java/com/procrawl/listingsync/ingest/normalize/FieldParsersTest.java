package com.procrawl.listingsync.ingest.normalize;

import com.procrawl.listingsync.ingest.model.NumericFormat;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FieldParsersTest {

    @Test
    void parsesBrazilianCurrency() {
        assertThat((BigDecimal) FieldParsers.parseNumber("R$ 3.100,00", NumericFormat.BRAZILIAN_CURRENCY))
            .isEqualByComparingTo("3100");
        assertThat((BigDecimal) FieldParsers.parseNumber("R$ 1.250,50 /mês", NumericFormat.BRAZILIAN_CURRENCY))
            .isEqualByComparingTo("1250.5");
        assertThat((BigDecimal) FieldParsers.parseNumber("890", NumericFormat.BRAZILIAN_CURRENCY))
            .isEqualByComparingTo("890");
    }

    @Test
    void integerFormatTruncates() {
        assertThat(FieldParsers.parseNumber("2 quartos", NumericFormat.INTEGER)).isEqualTo(2L);
        assertThat(FieldParsers.parseNumber("3.5", NumericFormat.INTEGER)).isEqualTo(3L);
        assertThat(FieldParsers.parseNumber(4, NumericFormat.INTEGER)).isEqualTo(4L);
    }

    @Test
    void decimalFormatGuessesSeparators() {
        assertThat((BigDecimal) FieldParsers.parseNumber("72,5 m²", NumericFormat.DECIMAL)).isEqualByComparingTo("72.5");
        assertThat((BigDecimal) FieldParsers.parseNumber("1,250", NumericFormat.DECIMAL)).isEqualByComparingTo("1250");
        assertThat((BigDecimal) FieldParsers.parseNumber("1.234,56", NumericFormat.DECIMAL)).isEqualByComparingTo("1234.56");
        assertThat((BigDecimal) FieldParsers.parseNumber("1,234.56", NumericFormat.DECIMAL)).isEqualByComparingTo("1234.56");
    }

    @Test
    void numericInputsAreNormalizedWithoutTrailingZeros() {
        Number parsed = FieldParsers.parseNumber(new BigDecimal("3100.00"), NumericFormat.BRAZILIAN_CURRENCY);

        assertThat(parsed).isEqualTo(new BigDecimal("3100"));
    }

    @Test
    void largeIntegralValuesKeepTheirExactValue() {
        Number parsed = FieldParsers.parseNumber(new BigInteger("12345678901234567890123"), NumericFormat.DECIMAL);

        assertThat((BigDecimal) parsed).isEqualByComparingTo("12345678901234567890123");
    }

    @Test
    void integerOutsideLongRangeIsUnparsable() {
        assertThat(FieldParsers.parseNumber("99999999999999999999", NumericFormat.INTEGER)).isNull();
        assertThat(FieldParsers.parseNumber(new BigInteger("99999999999999999999"), NumericFormat.INTEGER)).isNull();
        assertThat(FieldParsers.parseNumber(String.valueOf(Long.MAX_VALUE), NumericFormat.INTEGER)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void unreadableValuesBecomeNull() {
        assertThat(FieldParsers.parseNumber("sob consulta", NumericFormat.BRAZILIAN_CURRENCY)).isNull();
        assertThat(FieldParsers.parseNumber("", NumericFormat.DECIMAL)).isNull();
        assertThat(FieldParsers.parseNumber(null, NumericFormat.INTEGER)).isNull();
    }

    @Test
    void htmlIsReducedToVisibleText() {
        assertThat(FieldParsers.htmlToText("<p>Apartamento <b>amplo</b>\n com   sacada</p>"))
            .isEqualTo("Apartamento amplo com sacada");
        assertThat(FieldParsers.htmlToText("<br/>")).isNull();
    }
}
