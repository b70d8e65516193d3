package com.optionscalper.unit.position;

import static org.assertj.core.api.Assertions.assertThat;

import com.optionscalper.position.ExpirySymbolParser;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ExpirySymbolParserTest {

    @Test
    @DisplayName("Monthly symbol expires on the last day of its month")
    void monthly() {
        assertThat(ExpirySymbolParser.parseExpiry("NIFTY24DEC24000CE")).contains(LocalDate.of(2024, 12, 31));
        assertThat(ExpirySymbolParser.parseExpiry("BANKNIFTY26FEB52000PE")).contains(LocalDate.of(2026, 2, 28));
    }

    @Test
    @DisplayName("Weekly symbol decodes single-digit months")
    void weeklySingleDigitMonth() {
        assertThat(ExpirySymbolParser.parseExpiry("NIFTY2411424000CE")).contains(LocalDate.of(2024, 1, 14));
        assertThat(ExpirySymbolParser.parseExpiry("NIFTY2630522500PE")).contains(LocalDate.of(2026, 3, 5));
    }

    @Test
    @DisplayName("Weekly symbol decodes O, N and D as October to December")
    void weeklyLetterMonths() {
        assertThat(ExpirySymbolParser.parseExpiry("NIFTY25O0924800CE")).contains(LocalDate.of(2025, 10, 9));
        assertThat(ExpirySymbolParser.parseExpiry("NIFTY25N1324800CE")).contains(LocalDate.of(2025, 11, 13));
        assertThat(ExpirySymbolParser.parseExpiry("NIFTY25D2424800CE")).contains(LocalDate.of(2025, 12, 24));
    }

    @ParameterizedTest
    @ValueSource(strings = {"AAA", "RELIANCE", "NIFTY2423124000CE", "NIFTY 50", ""})
    @DisplayName("Unparseable or impossible symbols give no expiry")
    void unparseable(String symbol) {
        assertThat(ExpirySymbolParser.parseExpiry(symbol)).isEmpty();
    }

    @Test
    void nullSymbol() {
        assertThat(ExpirySymbolParser.parseExpiry(null)).isEmpty();
    }
}
