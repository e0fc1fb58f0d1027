package com.example.finstatement.exception;

import com.example.finstatement.model.StatementType;

/**
 * A required statement could not be located in the source, so no dataset can be built.
 * Distinct from a validation failure: validation never runs.
 */
public class StatementMissingException extends RuntimeException {

    private final StatementType statement;

    public StatementMissingException(StatementType statement, String sourceKind) {
        super("required statement missing: " + statement.getDisplayName()
                + " (no " + sourceKind + " matching "
                + ("section".equals(sourceKind) ? statement.getSectionHeadings() : statement.getTableAliases())
                + ")");
        this.statement = statement;
    }

    public StatementType getStatement() {
        return statement;
    }
}
