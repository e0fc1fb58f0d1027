package com.example.finstatement.parser;

import static com.example.finstatement.ReportFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NumericValueParser")
class NumericValueParserTest {

    @Test
    @DisplayName("rightmost numeric cell wins")
    void rightmostCellWins() {
        assertThat(NumericValueParser.fromRow(row("Revenue", 950000, 1000000)))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1000000"));
    }

    @Test
    @DisplayName("nil markers are skipped, not read as zero")
    void nilMarkersContinueLeftward() {
        assertThat(NumericValueParser.fromRow(row("Reserves", "12,500", "-")))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("12500"));
        assertThat(NumericValueParser.fromRow(row("Reserves", "1", "N/A", "nil", "NaN", "")))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1"));
    }

    @Test
    void parenthesisedAndCurrencyCellsAreNegativeOrCleaned() {
        assertThat(NumericValueParser.fromRow(row("Loss", "", "($1,234.50)")))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-1234.50"));
        assertThat(NumericValueParser.fromRow(row("Cost of Sales", "", "-400,000")))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-400000"));
    }

    @Test
    void labelCellIsNeverAValue() {
        assertThat(NumericValueParser.fromRow(row("2024"))).isEmpty();
        assertThat(NumericValueParser.fromRow(row("Revenue", "see note", null))).isEmpty();
    }

    @Test
    void nonFiniteNumbersAreAbsent() {
        assertThat(NumericValueParser.fromCell(Double.NaN)).isEmpty();
        assertThat(NumericValueParser.fromCell(new BigDecimal("7"))).contains(new BigDecimal("7"));
    }

    @Test
    @DisplayName("text lines take the last currency token")
    void lastTokenOnLine() {
        assertThat(NumericValueParser.fromLine("Cash and cash equivalents 6 12,000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("12000"));
        assertThat(NumericValueParser.fromLine("Income tax expense (25,000)"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-25000"));
        assertThat(NumericValueParser.fromLine("Net loss for the year -$3,500"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("-3500"));
    }

    @Test
    void lineWithoutAmountIsAbsent() {
        assertThat(NumericValueParser.fromLine("Revenue from sale of goods is recognised on delivery.")).isEmpty();
        assertThat(NumericValueParser.fromLine("")).isEmpty();
        assertThat(NumericValueParser.fromLine(null)).isEmpty();
    }

    @Test
    @DisplayName("a dash standing alone is a nil marker, not a sign")
    void detachedDashIsNotNegative() {
        assertThat(NumericValueParser.fromLine("Inventories - 12,000"))
                .hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("12000"));
    }
}
