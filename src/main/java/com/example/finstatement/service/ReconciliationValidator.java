package com.example.finstatement.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;
import com.example.finstatement.model.NoteSection;
import com.example.finstatement.model.Signatory;
import com.example.finstatement.model.StatementBundle;
import com.example.finstatement.model.ValidationIssue;
import com.example.finstatement.model.ValidationReport;
import com.example.finstatement.utils.MoneyUtils;

/**
 * Runs every reconciliation check against one bundle and returns a fresh report. Checks
 * never short-circuit and each raises at most one issue. Holds no per-call state.
 */
public class ReconciliationValidator {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationValidator.class);

    /** Differences below one dollar are rounding. */
    public static final BigDecimal MONEY_TOLERANCE = BigDecimal.ONE;

    public static final String BALANCE = "BALANCE";
    public static final String RETAINED_EARNINGS_ROLLFORWARD = "RETAINED_EARNINGS_ROLLFORWARD";
    public static final String TAX_CONSOLIDATION = "TAX_CONSOLIDATION";
    public static final String CONTINGENT_LIABILITY = "CONTINGENT_LIABILITY";
    public static final String DIRECTOR_ROSTER = "DIRECTOR_ROSTER";
    public static final String COMPILER_CREDENTIALS = "COMPILER_CREDENTIALS";
    public static final String ZERO_CASH = "ZERO_CASH";
    public static final String ZERO_TAX = "ZERO_TAX";

    private static final int CONTINGENT_EXCERPT = 200;

    private final List<String> expectedDirectors;
    private final String expectedCompiler;

    public ReconciliationValidator(List<String> expectedDirectors, String expectedCompiler) {
        this.expectedDirectors = List.copyOf(expectedDirectors);
        this.expectedCompiler = expectedCompiler;
    }

    public List<String> getExpectedDirectors() {
        return expectedDirectors;
    }

    public String getExpectedCompiler() {
        return expectedCompiler;
    }

    public ValidationReport validate(StatementBundle bundle) {
        return validate(bundle.getCurrent(), bundle.getPrior(), bundle.getPriorRetainedEarnings(),
                bundle.getDirectors(), bundle.getCompiler(), bundle.getTaxConsolidationEntity(),
                bundle.getContingentLiabilityText(), bundle.getNotes());
    }

    public ValidationReport validate(FinancialDataset current,
                                     FinancialDataset prior,
                                     BigDecimal priorRetainedEarnings,
                                     List<Signatory> directors,
                                     Signatory compiler,
                                     String taxConsolidationEntity,
                                     String contingentLiabilityText,
                                     List<NoteSection> notes) {
        log.debug("validating {} against {}", current, prior);
        List<ValidationIssue> issues = new ArrayList<>();

        add(issues, checkBalance(current));
        add(issues, checkRetainedEarnings(current, priorRetainedEarnings));
        add(issues, checkTaxConsolidation(taxConsolidationEntity));
        add(issues, checkContingentLiability(contingentLiabilityText));
        add(issues, checkDirectors(directors));
        add(issues, checkCompiler(compiler));
        add(issues, checkCash(current));
        add(issues, checkIncomeTax(current, notes));

        ValidationReport report = new ValidationReport(issues);
        if (report.isOverallOk()) {
            log.info("✅ validation passed: {}", report);
        } else {
            log.warn("❌ validation failed: {}", report);
        }
        return report;
    }

    private static void add(List<ValidationIssue> issues, ValidationIssue issue) {
        if (issue != null) issues.add(issue);
    }

    // -------------------- fatal --------------------
    ValidationIssue checkBalance(FinancialDataset current) {
        BigDecimal assets = current.totalAssets();
        BigDecimal liabilitiesAndEquity = current.totalLiabilitiesAndEquity();
        BigDecimal delta = assets.subtract(liabilitiesAndEquity);
        if (delta.abs().compareTo(MONEY_TOLERANCE) < 0) return null;

        return ValidationIssue.fatal(BALANCE,
                "Balance sheet does not balance. Total assets: " + MoneyUtils.format(assets)
                        + ", total liabilities + equity: " + MoneyUtils.format(liabilitiesAndEquity)
                        + ", difference: " + MoneyUtils.format(delta)
                        + ". Reconcile the source and try again.",
                delta);
    }

    ValidationIssue checkRetainedEarnings(FinancialDataset current, BigDecimal priorRetainedEarnings) {
        BigDecimal prior = priorRetainedEarnings == null ? BigDecimal.ZERO : priorRetainedEarnings;
        BigDecimal net = current.amount(Category.NET_PROFIT_LOSS);
        BigDecimal expected = prior.add(net);
        BigDecimal actual = current.amount(Category.RETAINED_EARNINGS);
        BigDecimal delta = expected.subtract(actual);
        if (delta.abs().compareTo(MONEY_TOLERANCE) < 0) return null;

        return ValidationIssue.fatal(RETAINED_EARNINGS_ROLLFORWARD,
                "Retained earnings mismatch. Prior year RE: " + MoneyUtils.format(prior)
                        + ", net profit/(loss): " + MoneyUtils.format(net)
                        + ", expected RE: " + MoneyUtils.format(expected)
                        + ", actual RE: " + MoneyUtils.format(actual)
                        + ", difference: " + MoneyUtils.format(delta)
                        + ". Verify the opening balance and the profit or loss for the year.",
                delta);
    }

    // -------------------- query --------------------
    ValidationIssue checkTaxConsolidation(String headEntity) {
        if (isBlank(headEntity)) return null;
        return ValidationIssue.query(TAX_CONSOLIDATION,
                "Tax consolidation head entity: " + headEntity.trim()
                        + ". Confirm this matches the prior year disclosure.");
    }

    ValidationIssue checkContingentLiability(String text) {
        if (isBlank(text)) return null;
        String excerpt = text.length() > CONTINGENT_EXCERPT ? text.substring(0, CONTINGENT_EXCERPT) + "..." : text;
        return ValidationIssue.query(CONTINGENT_LIABILITY,
                "Prior year had a contingent liability disclosure. Confirm the current year retains identical wording: "
                        + excerpt);
    }

    ValidationIssue checkDirectors(List<Signatory> directors) {
        List<String> found = new ArrayList<>();
        if (directors != null) {
            for (Signatory d : directors) {
                if (d != null && !isBlank(d.getName())) found.add(d.getName().trim());
            }
        }
        List<String> missing = new ArrayList<>();
        for (String name : expectedDirectors) {
            if (!found.contains(name)) missing.add(name);
        }
        List<String> extra = new ArrayList<>();
        for (String name : found) {
            if (!expectedDirectors.contains(name)) extra.add(name);
        }
        if (missing.isEmpty() && extra.isEmpty()) return null;

        return ValidationIssue.query(DIRECTOR_ROSTER,
                "Director names differ from the roster. Expected: " + String.join(", ", expectedDirectors)
                        + "; found: " + String.join(", ", found)
                        + "; missing: " + (missing.isEmpty() ? "none" : String.join(", ", missing))
                        + "; extra: " + (extra.isEmpty() ? "none" : String.join(", ", extra))
                        + ". Confirm before updating the sign date.");
    }

    ValidationIssue checkCompiler(Signatory compiler) {
        String name = compiler == null || compiler.getName() == null ? "" : compiler.getName();
        String title = compiler == null || compiler.getTitle() == null ? "" : compiler.getTitle();
        if (isBlank(expectedCompiler) || name.contains(expectedCompiler)) return null;

        return ValidationIssue.query(COMPILER_CREDENTIALS,
                "Compilation signatory differs. Expected: " + expectedCompiler
                        + "; found: " + (name.isEmpty() ? "none" : name)
                        + (title.isEmpty() ? "" : " (" + title + ")")
                        + ". Verify credentials if changed.");
    }

    // -------------------- warning --------------------
    ValidationIssue checkCash(FinancialDataset current) {
        if (current.amount(Category.CASH).signum() != 0) return null;
        return ValidationIssue.warning(ZERO_CASH,
                "Cash balance is $0. Confirm closure of legacy accounts.");
    }

    ValidationIssue checkIncomeTax(FinancialDataset current, List<NoteSection> notes) {
        if (current.amount(Category.INCOME_TAX_EXPENSE).signum() != 0) return null;
        NoteSection taxNote = findIncomeTaxNote(notes);
        String noteHint = taxNote == null
                ? "No income tax note was found; add one explaining why no tax is recognised."
                : "Ensure note " + taxNote.getNumber() + " (" + taxNote.getHeading() + ") explains why.";
        return ValidationIssue.warning(ZERO_TAX,
                "No income tax expense recognised. " + noteHint);
    }

    private static NoteSection findIncomeTaxNote(List<NoteSection> notes) {
        if (notes == null) return null;
        for (NoteSection n : notes) {
            if (n.getHeading() != null && n.getHeading().toLowerCase(Locale.ROOT).contains("income tax")) return n;
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
