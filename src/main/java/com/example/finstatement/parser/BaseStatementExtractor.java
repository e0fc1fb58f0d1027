package com.example.finstatement.parser;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.StatementType;

public abstract class BaseStatementExtractor {

    private static final Logger log = LoggerFactory.getLogger(BaseStatementExtractor.class);

    private final Map<StatementType, StatementRuleTable> tables = new EnumMap<>(StatementType.class);

    protected BaseStatementExtractor(PositionalTieBreak tieBreak) {
        for (StatementType type : StatementType.values()) {
            tables.put(type, StatementRuleTable.forStatement(type, tieBreak));
        }
    }

    protected StatementRuleTable table(StatementType type) {
        return tables.get(type);
    }

    /**
     * Offers one row/line to the statement's rules. The first matching rule claims it; the
     * value is stored only if that category is still empty and the row carries an amount.
     *
     * @return the category that received a value, or null
     */
    protected Category offer(StatementRuleTable table, MatchContext ctx, Optional<BigDecimal> value,
                             EnumMap<Category, BigDecimal> found) {
        MatchRule rule = table.claim(ctx);
        if (rule == null) return null;

        Category category = rule.getCategory();
        if (found.containsKey(category)) {
            log.debug("skip {}: {} already set", ctx, category.getKey());
            return null;
        }
        if (value.isEmpty()) {
            log.debug("skip {}: claimed by {} but no amount", ctx, category.getKey());
            return null;
        }
        found.put(category, rule.getSignPolicy().apply(value.get()));
        return category;
    }
}
