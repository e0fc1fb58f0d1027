package com.example.finstatement.parser;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.finstatement.exception.StatementMissingException;
import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;
import com.example.finstatement.model.ReportingPeriod;
import com.example.finstatement.model.SourceTable;
import com.example.finstatement.model.StatementType;

/**
 * Reads the current period from the management-report workbook: one sheet per statement,
 * labels in the first column, the latest period rightmost.
 */
public class RowFieldExtractor extends BaseStatementExtractor {

    private static final Logger log = LoggerFactory.getLogger(RowFieldExtractor.class);

    public RowFieldExtractor(PositionalTieBreak tieBreak) {
        super(tieBreak);
    }

    public RowFieldExtractor() {
        this(PositionalTieBreak.leadingRows(StatementRuleTable.DEFAULT_CURRENT_ROW_LIMIT));
    }

    /** Income statement and balance sheet combined into one current-period dataset. */
    public FinancialDataset extractCurrentPeriod(List<SourceTable> tables) {
        FinancialDataset pl = extract(tables, StatementType.INCOME_STATEMENT);
        FinancialDataset bs = extract(tables, StatementType.BALANCE_SHEET);
        return pl.merge(bs);
    }

    public FinancialDataset extract(List<SourceTable> tables, StatementType statement) {
        SourceTable table = findTable(tables, statement);
        log.info("📊 {} ← sheet '{}' ({} rows)", statement.getDisplayName(), table.getName(), table.getRows().size());
        return extractRows(table.getRows(), statement);
    }

    public SourceTable findTable(List<SourceTable> tables, StatementType statement) {
        // alias order is the preference order
        for (String alias : statement.getTableAliases()) {
            for (SourceTable t : tables) {
                if (t != null && alias.equalsIgnoreCase(t.getName() == null ? "" : t.getName().trim())) {
                    return t;
                }
            }
        }
        throw new StatementMissingException(statement, "sheet");
    }

    public FinancialDataset extractRows(List<List<Object>> rows, StatementType statement) {
        StatementRuleTable rules = table(statement);
        EnumMap<Category, BigDecimal> found = new EnumMap<>(Category.class);

        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row == null || row.isEmpty()) continue;

            MatchContext ctx = new MatchContext(labelText(row), i);
            if (ctx.text().isEmpty()) continue;

            Optional<BigDecimal> value = NumericValueParser.fromRow(row);
            Category stored = offer(rules, ctx, value, found);
            if (stored != null) {
                log.debug("row {} → {} = {}", ctx, stored.getKey(), found.get(stored));
            }
        }
        return FinancialDataset.of(ReportingPeriod.CURRENT, found);
    }

    /** Text cells of the row joined, so a keyword may sit in any cell. */
    private String labelText(List<Object> row) {
        StringBuilder sb = new StringBuilder();
        for (Object cell : row) {
            if (cell instanceof String) {
                String s = ((String) cell).trim();
                if (!s.isEmpty()) sb.append(s).append(' ');
            }
        }
        return sb.toString();
    }
}
