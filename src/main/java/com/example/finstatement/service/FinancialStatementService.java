package com.example.finstatement.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.finstatement.augment.AugmentationAdapter;
import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;
import com.example.finstatement.model.NoteSection;
import com.example.finstatement.model.PriorYearReport;
import com.example.finstatement.model.Signatory;
import com.example.finstatement.model.StatementBundle;
import com.example.finstatement.model.StatementRequest;
import com.example.finstatement.model.StatementResponse;
import com.example.finstatement.model.ValidationIssue;
import com.example.finstatement.model.ValidationReport;
import com.example.finstatement.parser.PriorYearReportParser;
import com.example.finstatement.parser.RowFieldExtractor;

/**
 * Extract, augment, derive, validate, roll forward. Structural failures propagate as
 * exceptions; everything else ends up in the report.
 */
@Service
public class FinancialStatementService {

    private static final Logger log = LoggerFactory.getLogger(FinancialStatementService.class);

    public static final String EBITDA_APPROXIMATED = "EBITDA_APPROXIMATED";
    public static final String AUGMENTED_VALUES = "AUGMENTED_VALUES";
    public static final String AI_RECOMMENDATION = "AI_RECOMMENDATION";
    public static final String NEW_DISCLOSURE = "NEW_DISCLOSURE";

    private static final String DIRECTOR_TITLE = "Director";

    private final RowFieldExtractor rowExtractor;
    private final PriorYearReportParser priorYearParser;
    private final DerivedValueCalculator calculator;
    private final ReconciliationValidator validator;
    private final AugmentationAdapter augmentation;
    private final String defaultCompilerTitle;

    public FinancialStatementService(RowFieldExtractor rowExtractor,
                                     PriorYearReportParser priorYearParser,
                                     DerivedValueCalculator calculator,
                                     ReconciliationValidator validator,
                                     AugmentationAdapter augmentation,
                                     @Value("${statement.expected.compiler-title:Chief Financial Officer}") String defaultCompilerTitle) {
        this.rowExtractor = rowExtractor;
        this.priorYearParser = priorYearParser;
        this.calculator = calculator;
        this.validator = validator;
        this.augmentation = augmentation;
        this.defaultCompilerTitle = defaultCompilerTitle;
    }

    public StatementResponse process(StatementRequest request) {
        // 1. extraction; a missing statement stops here
        FinancialDataset currentRaw = rowExtractor.extractCurrentPeriod(request.getTables());
        PriorYearReport priorReport = priorYearParser.parse(request.getPriorYearPages());
        FinancialDataset priorRaw = priorReport.dataset;

        List<ValidationIssue> extra = new ArrayList<>();
        boolean useAi = request.isUseAi() && augmentation.isEnabled();

        // 2. optional gap fill of the prior year, never overriding extracted values
        Set<Category> augmented = EnumSet.noneOf(Category.class);
        if (useAi) {
            Optional<FinancialDataset> proposed = augmentation.augment(priorRaw, String.join("\n", request.getPriorYearPages()));
            if (proposed.isPresent()) {
                for (Category c : proposed.get().asMap().keySet()) {
                    if (!priorRaw.has(c)) augmented.add(c);
                }
                priorRaw = priorRaw.merge(proposed.get());
            }
        }
        if (!augmented.isEmpty()) {
            extra.add(ValidationIssue.query(AUGMENTED_VALUES,
                    "Prior year values supplied by the assistant, not read from the report: " + keys(augmented)
                            + ". Confirm them against the signed statements."));
        }

        // 3. derivation
        DerivedValueCalculator.Result currentDerived = calculator.derive(currentRaw);
        DerivedValueCalculator.Result priorDerived = calculator.derive(priorRaw);
        FinancialDataset current = currentDerived.getDataset();
        FinancialDataset prior = priorDerived.getDataset();
        if (currentDerived.isEbitdaApproximated()) {
            extra.add(ValidationIssue.warning(EBITDA_APPROXIMATED,
                    "EBITDA was not in the source and is shown equal to profit before tax; "
                            + "interest, depreciation and amortisation are not added back."));
        }

        // 4. validation
        BigDecimal priorRe = request.getPriorRetainedEarnings() != null
                ? request.getPriorRetainedEarnings()
                : priorReport.dataset.get(Category.RETAINED_EARNINGS).orElse(BigDecimal.ZERO);
        List<Signatory> directors = resolveDirectors(request, priorReport);
        Signatory compiler = resolveCompiler(request, priorReport);

        StatementBundle bundle = StatementBundle.builder()
                .current(current)
                .prior(prior)
                .priorRetainedEarnings(priorRe)
                .directors(directors)
                .compiler(compiler)
                .taxConsolidationEntity(priorReport.taxConsolidationEntity)
                .contingentLiabilityText(priorReport.contingentLiabilityText)
                .notes(priorReport.notes)
                .build();
        ValidationReport report = validator.validate(bundle);

        // 5. advisory checks, never fatal
        if (request.getDraftPages() != null && !request.getDraftPages().isEmpty()) {
            extra.addAll(newDisclosures(priorYearParser.parseNotes(request.getDraftPages()), priorReport.notes));
        }
        if (useAi) {
            for (String advice : augmentation.advise(current, prior)) {
                extra.add(ValidationIssue.warning(AI_RECOMMENDATION, advice));
            }
        }
        report = report.withAdditional(extra);

        StatementResponse response = new StatementResponse();
        response.entityName = priorReport.entityName;
        response.priorYear = priorReport.priorYear;
        response.current = current;
        response.prior = prior;
        response.priorRetainedEarnings = priorRe;
        response.directors = directors;
        response.compiler = compiler;
        response.priorYearReport = priorReport;
        response.derived = keys(currentDerived.getDerived());
        response.augmented = keys(augmented);
        response.report = report;

        // 6. only a clean run may be finalised
        if (report.isOverallOk()) {
            response.rolledForward = calculator.rollForwardRetainedEarnings(current, priorRe);
        } else {
            log.warn("🛑 {} fatal issue(s), statements must not be generated", report.getFatals().size());
        }
        return response;
    }

    /** Request names, else the prior-year declaration, else the configured roster. */
    List<Signatory> resolveDirectors(StatementRequest request, PriorYearReport priorReport) {
        List<Signatory> out = new ArrayList<>();
        if (request.getDirectors() != null && !request.getDirectors().isEmpty()) {
            for (String name : request.getDirectors()) {
                if (name != null && !name.isBlank()) out.add(new Signatory(name.trim(), DIRECTOR_TITLE));
            }
            if (!out.isEmpty()) return out;
        }
        if (priorReport.directors != null && !priorReport.directors.isEmpty()) {
            return new ArrayList<>(priorReport.directors);
        }
        for (String name : validator.getExpectedDirectors()) {
            out.add(new Signatory(name, DIRECTOR_TITLE));
        }
        return out;
    }

    Signatory resolveCompiler(StatementRequest request, PriorYearReport priorReport) {
        if (request.getCompilerName() != null && !request.getCompilerName().isBlank()) {
            String title = request.getCompilerTitle() == null || request.getCompilerTitle().isBlank()
                    ? defaultCompilerTitle : request.getCompilerTitle().trim();
            return new Signatory(request.getCompilerName().trim(), title);
        }
        if (priorReport.compiler != null) return priorReport.compiler;
        return new Signatory(validator.getExpectedCompiler(), defaultCompilerTitle);
    }

    /** Note headings in the draft that the prior year did not have. */
    List<ValidationIssue> newDisclosures(List<NoteSection> draftNotes, List<NoteSection> priorNotes) {
        Set<String> known = new HashSet<>();
        for (NoteSection n : priorNotes) {
            known.add(normalise(n.getHeading()));
        }
        List<ValidationIssue> out = new ArrayList<>();
        for (NoteSection n : draftNotes) {
            if (!known.contains(normalise(n.getHeading()))) {
                out.add(ValidationIssue.query(NEW_DISCLOSURE,
                        "Draft note " + n.getNumber() + " '" + n.getHeading()
                                + "' has no counterpart in the prior year report. Confirm the new disclosure."));
            }
        }
        return out;
    }

    private static String normalise(String heading) {
        return heading == null ? "" : heading.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> keys(Set<Category> categories) {
        List<String> out = new ArrayList<>();
        for (Category c : categories) out.add(c.getKey());
        return out;
    }
}
