package com.example.finstatement.parser;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.finstatement.exception.StatementMissingException;
import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;
import com.example.finstatement.model.ReportingPeriod;
import com.example.finstatement.model.StatementType;

/**
 * Reads the prior period from the text of a printed report. Only lines inside the
 * statement's own section are offered to the rules; narrative elsewhere is ignored.
 */
public class TextLineFieldExtractor extends BaseStatementExtractor {

    private static final Logger log = LoggerFactory.getLogger(TextLineFieldExtractor.class);

    private final DocumentSectionScanner scanner;

    public TextLineFieldExtractor(PositionalTieBreak tieBreak, DocumentSectionScanner scanner) {
        super(tieBreak);
        this.scanner = scanner;
    }

    public TextLineFieldExtractor() {
        this(PositionalTieBreak.leadingRows(StatementRuleTable.DEFAULT_CURRENT_ROW_LIMIT), new DocumentSectionScanner());
    }

    public FinancialDataset extractPriorPeriod(List<String> pages) {
        List<DocumentSectionScanner.Block> blocks = scanner.scan(pages);
        FinancialDataset pl = extractBlocks(blocks, StatementType.INCOME_STATEMENT);
        FinancialDataset bs = extractBlocks(blocks, StatementType.BALANCE_SHEET);
        return pl.merge(bs);
    }

    public FinancialDataset extract(List<String> pages, StatementType statement) {
        return extractBlocks(scanner.scan(pages), statement);
    }

    /** Same as {@link #extract} over pages already split by the scanner. */
    public FinancialDataset extractBlocks(List<DocumentSectionScanner.Block> blocks, StatementType statement) {
        DocumentSection section = DocumentSection.of(statement);
        if (!scanner.contains(blocks, section)) {
            throw new StatementMissingException(statement, "section");
        }

        List<String> lines = scanner.linesOf(blocks, section);
        log.info("📄 {} ← {} lines of report text", statement.getDisplayName(), lines.size());

        StatementRuleTable rules = table(statement);
        EnumMap<Category, BigDecimal> found = new EnumMap<>(Category.class);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Category stored = offer(rules, new MatchContext(line, i), NumericValueParser.fromLine(line), found);
            if (stored != null) {
                log.debug("line '{}' → {} = {}", line, stored.getKey(), found.get(stored));
            }
        }
        return FinancialDataset.of(ReportingPeriod.PRIOR, found);
    }
}
