package com.example.finstatement.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.finstatement.ReportFixtures;

class DocumentSectionScannerTest {

    private final DocumentSectionScanner scanner = new DocumentSectionScanner();

    @Test
    void recognisesHeadingsWithAndWithoutConsolidatedPrefix() {
        assertThat(scanner.headingOf("Statement of Profit or Loss and Other Comprehensive Income"))
                .isEqualTo(DocumentSection.INCOME_STATEMENT);
        assertThat(scanner.headingOf("Consolidated Statement of Financial Position as at 30 June 2024"))
                .isEqualTo(DocumentSection.BALANCE_SHEET);
        assertThat(scanner.headingOf("DIRECTORS’ DECLARATION")).isEqualTo(DocumentSection.DIRECTORS_DECLARATION);
        assertThat(scanner.headingOf("Independent Compilation Report")).isEqualTo(DocumentSection.COMPILATION_REPORT);
    }

    @Test
    void contentsEntriesAndDataRowsAreNotHeadings() {
        assertThat(scanner.headingOf("Statement of Financial Position 4")).isNull();
        assertThat(scanner.headingOf("Balance Sheet ........ 12")).isNull();
        assertThat(scanner.headingOf("Profit and loss attributable to members 5,000")).isNull();
        assertThat(scanner.headingOf("Revenue 900,000")).isNull();
    }

    @Test
    @DisplayName("a sentence opening with a heading's words is narrative")
    void sentenceIsNotAHeading() {
        assertThat(scanner.headingOf("Income statement comparatives have been reclassified to conform with the current year."))
                .isNull();
        assertThat(scanner.headingOf("Balance sheet items are measured at cost")).isNull();
        assertThat(scanner.headingOf("Statement of Profit or Loss for the Year Ended 30 June 2024"))
                .isEqualTo(DocumentSection.INCOME_STATEMENT);
        assertThat(scanner.headingOf("Statement of Financial Position (continued)"))
                .isEqualTo(DocumentSection.BALANCE_SHEET);
        assertThat(scanner.headingOf("Compilation Report to Example Holdings Pty Ltd"))
                .isEqualTo(DocumentSection.COMPILATION_REPORT);
    }

    @Test
    void sectionRunsUntilNextHeading() {
        List<DocumentSectionScanner.Block> blocks = scanner.scan(ReportFixtures.priorYearPages());

        assertThat(blocks).extracting(DocumentSectionScanner.Block::getSection).containsExactly(
                DocumentSection.CONTENTS,
                DocumentSection.INCOME_STATEMENT,
                DocumentSection.BALANCE_SHEET,
                DocumentSection.NOTES,
                DocumentSection.DIRECTORS_DECLARATION,
                DocumentSection.COMPILATION_REPORT);

        List<String> income = scanner.linesOf(blocks, DocumentSection.INCOME_STATEMENT);
        assertThat(income).contains("Revenue 900,000", "Net profit for the year 225,000");
        assertThat(income).doesNotContain("Statement of Financial Position");
        assertThat(blocks.get(1).getPage()).isEqualTo(2);
    }

    @Test
    void sectionContinuesAcrossPages() {
        List<DocumentSectionScanner.Block> blocks = scanner.scan(List.of(
                "Notes to the Financial Statements\n1. Basis of Preparation",
                "continued text on the next page"));

        assertThat(scanner.linesOf(blocks, DocumentSection.NOTES))
                .containsExactly("1. Basis of Preparation", "continued text on the next page");
    }

    @Test
    void linesBeforeFirstHeadingBelongNowhere() {
        List<DocumentSectionScanner.Block> blocks = scanner.scan(List.of(ReportFixtures.COVER_PAGE));

        assertThat(blocks).isEmpty();
        assertThat(scanner.contains(blocks, DocumentSection.INCOME_STATEMENT)).isFalse();
    }
}
