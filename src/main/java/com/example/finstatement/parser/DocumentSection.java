package com.example.finstatement.parser;

import java.util.List;

import com.example.finstatement.model.StatementType;

/**
 * Sections of a printed annual report that {@link DocumentSectionScanner} recognises by their
 * heading. Any of them ends the section before it.
 */
public enum DocumentSection {

    CONTENTS(null, List.of("Contents", "Table of Contents")),
    DIRECTORS_REPORT(null, List.of("Directors' Report", "Directors Report")),
    INCOME_STATEMENT(StatementType.INCOME_STATEMENT, StatementType.INCOME_STATEMENT.getSectionHeadings()),
    BALANCE_SHEET(StatementType.BALANCE_SHEET, StatementType.BALANCE_SHEET.getSectionHeadings()),
    CHANGES_IN_EQUITY(null, List.of("Statement of Changes in Equity")),
    CASH_FLOWS(null, List.of("Statement of Cash Flows", "Cash Flow Statement")),
    NOTES(null, List.of("Notes to the Financial Statements", "Notes to and forming part of the Financial Statements")),
    DIRECTORS_DECLARATION(null, List.of("Directors' Declaration", "Directors Declaration", "Director's Declaration")),
    COMPILATION_REPORT(null, List.of("Compilation Report", "Independent Compilation Report"));

    private final StatementType statement;
    private final List<String> headings;

    DocumentSection(StatementType statement, List<String> headings) {
        this.statement = statement;
        this.headings = headings;
    }

    /** The primary statement this section prints, or null. */
    public StatementType getStatement() {
        return statement;
    }

    public List<String> getHeadings() {
        return headings;
    }

    public static DocumentSection of(StatementType statement) {
        for (DocumentSection s : values()) {
            if (s.statement == statement) return s;
        }
        throw new IllegalArgumentException("no section for " + statement);
    }
}
