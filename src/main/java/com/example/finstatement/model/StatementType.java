package com.example.finstatement.model;

import java.util.List;

/**
 * The two primary statements. Each carries the workbook sheet aliases and the printed
 * section headings under which it can be found.
 */
public enum StatementType {

    INCOME_STATEMENT("Income Statement",
            List.of("Consol PL", "ConsolPL", "PL", "Profit Loss", "Income Statement"),
            List.of("Statement of Profit or Loss", "Income Statement", "Profit and Loss")),

    BALANCE_SHEET("Balance Sheet",
            List.of("Consol BS", "ConsolBS", "BS", "Balance Sheet", "Statement of Financial Position"),
            List.of("Statement of Financial Position", "Balance Sheet"));

    private final String displayName;
    private final List<String> tableAliases;
    private final List<String> sectionHeadings;

    StatementType(String displayName, List<String> tableAliases, List<String> sectionHeadings) {
        this.displayName = displayName;
        this.tableAliases = tableAliases;
        this.sectionHeadings = sectionHeadings;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getTableAliases() {
        return tableAliases;
    }

    public List<String> getSectionHeadings() {
        return sectionHeadings;
    }
}
