package com.policywatch.ingest.resolve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DateParsingTest {

    private static OffsetDateTime utc(int y, int m, int d, int h) {
        return OffsetDateTime.of(y, m, d, h, 0, 0, 0, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Machine formats normalize to UTC")
    void machineFormats() {
        assertThat(DateParsing.parse("2024-03-05T10:00:00-05:00")).contains(utc(2024, 3, 5, 15));
        assertThat(DateParsing.parse("Tue, 05 Mar 2024 14:00:00 GMT")).contains(utc(2024, 3, 5, 14));
        assertThat(DateParsing.parse("2024-03-05")).contains(utc(2024, 3, 5, 0));
        assertThat(DateParsing.parse("2024-03-05 09:30:00")).contains(utc(2024, 3, 5, 0));
    }

    @Test
    @DisplayName("Human formats are parsed as midnight UTC")
    void humanFormats() {
        assertThat(DateParsing.parse("March 5, 2024")).contains(utc(2024, 3, 5, 0));
        assertThat(DateParsing.parse("march 5th, 2024")).contains(utc(2024, 3, 5, 0));
        assertThat(DateParsing.parse("5 March 2024")).contains(utc(2024, 3, 5, 0));
        assertThat(DateParsing.parse("3/5/2024")).contains(utc(2024, 3, 5, 0));
        assertThat(DateParsing.parse("20240305")).contains(utc(2024, 3, 5, 0));
    }

    @Test
    @DisplayName("Garbage and impossible dates come back empty")
    void rejects() {
        assertThat(DateParsing.parse("yesterday")).isEmpty();
        assertThat(DateParsing.parse("  ")).isEmpty();
        assertThat(DateParsing.ofDate(2024, 2, 30)).isEmpty();
        assertThat(DateParsing.ofDate(1850, 1, 1)).isEmpty();
    }
}
