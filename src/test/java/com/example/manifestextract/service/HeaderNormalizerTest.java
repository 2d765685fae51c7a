package com.example.manifestextract.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderNormalizerTest {

    @Test
    void lowerCasesAndCollapsesWhitespace() {
        assertThat(HeaderNormalizer.normalize("  Shipping \t  MARK \n")).isEqualTo("shipping mark");
    }

    @Test
    void stripsPunctuationButKeepsSlashAndAmpersand() {
        assertThat(HeaderNormalizer.normalize("Weight (KG)*")).isEqualTo("weight kg");
        assertThat(HeaderNormalizer.normalize("L/W/H & Notes:")).isEqualTo("l/w/h & notes");
    }

    @Test
    void readsUnderscoresAsSpaces() {
        assertThat(HeaderNormalizer.normalize("unit_value")).isEqualTo("unit value");
    }

    @Test
    void treatsNonBreakingSpaceAsWhitespace() {
        assertThat(HeaderNormalizer.normalize("Tracking\u00A0No.")).isEqualTo("tracking no");
    }

    @Test
    void nonTextCellsNormalizeToEmpty() {
        assertThat(HeaderNormalizer.normalize(CellValue.number(new BigDecimal("12")))).isEmpty();
        assertThat(HeaderNormalizer.normalize(CellValue.date(LocalDate.of(2024, 3, 1)))).isEmpty();
        assertThat(HeaderNormalizer.normalize(CellValue.EMPTY)).isEmpty();
        assertThat(HeaderNormalizer.normalize((CellValue) null)).isEmpty();
    }

    @Test
    void nullAndBlankStringsNormalizeToEmpty() {
        assertThat(HeaderNormalizer.normalize((String) null)).isEmpty();
        assertThat(HeaderNormalizer.normalize("   ")).isEmpty();
        assertThat(HeaderNormalizer.normalize("###")).isEmpty();
    }
}
