package com.example.finstatement.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one validation run. Issues are split by severity in the order they were raised.
 */
public final class ValidationReport {

    private final List<ValidationIssue> fatals;
    private final List<ValidationIssue> queries;
    private final List<ValidationIssue> warnings;

    public ValidationReport(List<ValidationIssue> issues) {
        List<ValidationIssue> f = new ArrayList<>();
        List<ValidationIssue> q = new ArrayList<>();
        List<ValidationIssue> w = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            switch (issue.getSeverity()) {
                case FATAL -> f.add(issue);
                case QUERY -> q.add(issue);
                case WARNING -> w.add(issue);
            }
        }
        this.fatals = Collections.unmodifiableList(f);
        this.queries = Collections.unmodifiableList(q);
        this.warnings = Collections.unmodifiableList(w);
    }

    public boolean isOverallOk() {
        return fatals.isEmpty();
    }

    public List<ValidationIssue> getFatals() {
        return fatals;
    }

    public List<ValidationIssue> getQueries() {
        return queries;
    }

    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    public List<ValidationIssue> allIssues() {
        List<ValidationIssue> all = new ArrayList<>(fatals);
        all.addAll(queries);
        all.addAll(warnings);
        return all;
    }

    /** A new report holding these issues plus {@code extra}. */
    public ValidationReport withAdditional(List<ValidationIssue> extra) {
        List<ValidationIssue> all = allIssues();
        all.addAll(extra);
        return new ValidationReport(all);
    }

    @Override
    public String toString() {
        return "ValidationReport{ok=" + isOverallOk()
                + ", fatals=" + fatals.size()
                + ", queries=" + queries.size()
                + ", warnings=" + warnings.size() + "}";
    }
}
