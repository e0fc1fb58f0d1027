package com.example.finstatement.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.StatementType;

/**
 * Ordered label rules per statement. A row is offered to the rules top to bottom and the
 * first rule that matches claims it, so specific rules sit above general ones
 * (non-current before current, profit-before-tax before income tax).
 */
public final class StatementRuleTable {

    /** Ambiguous provisions rows above this index are treated as current. */
    public static final int DEFAULT_CURRENT_ROW_LIMIT = 15;

    private final StatementType statement;
    private final List<MatchRule> rules;

    private StatementRuleTable(StatementType statement, List<MatchRule> rules) {
        this.statement = statement;
        this.rules = Collections.unmodifiableList(rules);
    }

    public static StatementRuleTable forStatement(StatementType statement, PositionalTieBreak tieBreak) {
        return statement == StatementType.INCOME_STATEMENT
                ? incomeStatement()
                : balanceSheet(tieBreak);
    }

    public StatementType getStatement() {
        return statement;
    }

    public List<MatchRule> getRules() {
        return rules;
    }

    /** First rule whose predicate accepts the row, or null. */
    public MatchRule claim(MatchContext ctx) {
        for (MatchRule rule : rules) {
            if (rule.matches(ctx)) return rule;
        }
        return null;
    }

    // -------------------- income statement --------------------
    public static StatementRuleTable incomeStatement() {
        List<MatchRule> r = new ArrayList<>();
        r.add(new MatchRule(Category.EBITDA, "ebitda",
                c -> c.has("ebitda")));
        r.add(new MatchRule(Category.REVENUE, "revenue",
                c -> c.has("revenue") && !c.has("cost")));
        r.add(new MatchRule(Category.COST_OF_SALES, "cost of sales / goods sold / revenue",
                c -> c.hasAny("cost of sales", "cost of goods sold", "cost of revenue")));
        r.add(new MatchRule(Category.GROSS_PROFIT, "gross profit",
                c -> c.has("gross") && c.hasAny("profit", "loss", "margin")));
        r.add(new MatchRule(Category.OTHER_INCOME, "other income",
                c -> c.has("other income")));
        r.add(new MatchRule(Category.DISTRIBUTION_COSTS, "distribution + cost",
                c -> c.has("distribution", "cost")));
        r.add(new MatchRule(Category.ADMINISTRATIVE_EXPENSES, "administrative + expense",
                c -> c.has("administrative", "expense")));
        r.add(new MatchRule(Category.OTHER_EXPENSES, "other + expense, not income",
                c -> c.has("other", "expense") && !c.has("income")));
        r.add(new MatchRule(Category.PROFIT_BEFORE_TAX, "profit|loss before tax",
                c -> c.hasAny("profit", "loss") && c.has("before", "tax")));
        r.add(new MatchRule(Category.INCOME_TAX_EXPENSE, "income tax / tax expense, not profit after tax",
                c -> c.hasAny("income tax", "tax expense") && !(c.hasAny("profit", "loss") && c.has("after"))));
        r.add(new MatchRule(Category.NET_PROFIT_LOSS, "net profit|loss, profit for the year",
                c -> (c.has("net") && c.hasAny("profit", "loss"))
                        || (c.hasAny("profit", "loss") && c.hasAny("for the year", "for the period", "after tax", "after income tax"))));
        return new StatementRuleTable(StatementType.INCOME_STATEMENT, r);
    }

    // -------------------- balance sheet --------------------
    public static StatementRuleTable balanceSheet(PositionalTieBreak tieBreak) {
        List<MatchRule> r = new ArrayList<>();
        r.add(new MatchRule(Category.CASH, "cash + equivalent",
                c -> c.has("cash") && c.hasAny("equivalent", "at bank")));
        r.add(new MatchRule(Category.RECEIVABLES, "receivable",
                c -> c.has("receivable")));
        r.add(new MatchRule(Category.INVENTORIES, "inventor(y|ies)",
                c -> c.has("inventor")));
        r.add(new MatchRule(Category.OTHER_NON_CURRENT_ASSET, "other non-current asset",
                c -> c.has("other", "asset") && c.nonCurrent()));
        r.add(new MatchRule(Category.OTHER_CURRENT_ASSET, "other current asset",
                c -> c.has("other", "asset") && c.currentOnly()));
        r.add(new MatchRule(Category.PPE, "property + plant, ppe",
                c -> c.has("property", "plant") || c.mentionsPpe()));
        r.add(new MatchRule(Category.INTANGIBLES, "intangible",
                c -> c.has("intangible")));
        r.add(new MatchRule(Category.PAYABLES, "payable",
                c -> c.has("payable")));

        r.add(new MatchRule(Category.PROVISIONS_NON_CURRENT, "provision, non-current",
                c -> c.has("provision") && c.nonCurrent()));
        r.add(new MatchRule(Category.PROVISIONS_CURRENT, "provision, current",
                c -> c.has("provision") && c.currentOnly()));
        r.add(new MatchRule(Category.PROVISIONS_CURRENT, "provision, term unstated, early row",
                c -> c.has("provision") && c.silentOnTerm() && tieBreak.isCurrent(c.position())));
        r.add(new MatchRule(Category.PROVISIONS_NON_CURRENT, "provision, term unstated, late row",
                c -> c.has("provision") && c.silentOnTerm() && !tieBreak.isCurrent(c.position())));

        r.add(new MatchRule(Category.RELATED_PARTY_LOAN_NON_CURRENT, "related party, non-current",
                c -> c.has("related", "part") && c.nonCurrent()));
        r.add(new MatchRule(Category.RELATED_PARTY_LOAN_CURRENT, "related party, current",
                c -> c.has("related", "part") && c.currentOnly()));
        r.add(new MatchRule(Category.OTHER_NON_CURRENT_LIABILITY, "other non-current liabilit(y|ies)",
                c -> c.has("other", "liabilit") && c.nonCurrent()));
        r.add(new MatchRule(Category.OTHER_CURRENT_LIABILITY, "other current liabilit(y|ies)",
                c -> c.has("other", "liabilit") && c.currentOnly()));
        r.add(new MatchRule(Category.BORROWINGS, "borrowing",
                c -> c.has("borrowing")));
        r.add(new MatchRule(Category.SHARE_CAPITAL, "share capital, issued capital",
                c -> c.has("share", "capital") || c.hasAny("issued capital", "contributed equity")));
        r.add(new MatchRule(Category.RESERVES, "reserve",
                c -> c.has("reserve")));
        r.add(new MatchRule(Category.RETAINED_EARNINGS, "retained earnings, accumulated losses",
                c -> (c.has("retained") && c.hasAny("earning", "profit")) || c.has("accumulated loss")));
        return new StatementRuleTable(StatementType.BALANCE_SHEET, r);
    }
}
