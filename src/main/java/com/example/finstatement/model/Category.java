package com.example.finstatement.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Financial line items recognised by the extractors. The key is the field name the
 * rendering side consumes.
 */
public enum Category {

    // -------------------- income statement --------------------
    REVENUE("revenue", null, SignPolicy.AS_IS),
    COST_OF_SALES("cost_of_sales", null, SignPolicy.NON_NEGATIVE_MAGNITUDE),
    GROSS_PROFIT("gross_profit", null, SignPolicy.AS_IS),
    OTHER_INCOME("other_income", null, SignPolicy.AS_IS),
    DISTRIBUTION_COSTS("distribution_costs", null, SignPolicy.NON_NEGATIVE_MAGNITUDE),
    ADMINISTRATIVE_EXPENSES("administrative_expenses", null, SignPolicy.NON_NEGATIVE_MAGNITUDE),
    OTHER_EXPENSES("other_expenses", null, SignPolicy.NON_NEGATIVE_MAGNITUDE),
    PROFIT_BEFORE_TAX("profit_before_tax", null, SignPolicy.AS_IS),
    INCOME_TAX_EXPENSE("income_tax_expense", null, SignPolicy.NON_NEGATIVE_MAGNITUDE),
    NET_PROFIT_LOSS("net_profit_loss", null, SignPolicy.AS_IS),
    EBITDA("ebitda", null, SignPolicy.AS_IS),

    // -------------------- balance sheet --------------------
    CASH("cash", StatementGroup.CURRENT_ASSETS, SignPolicy.AS_IS),
    RECEIVABLES("receivables", StatementGroup.CURRENT_ASSETS, SignPolicy.AS_IS),
    INVENTORIES("inventories", StatementGroup.CURRENT_ASSETS, SignPolicy.AS_IS),
    OTHER_CURRENT_ASSET("other_current_asset", StatementGroup.CURRENT_ASSETS, SignPolicy.AS_IS),
    PPE("ppe", StatementGroup.NON_CURRENT_ASSETS, SignPolicy.AS_IS),
    INTANGIBLES("intangibles", StatementGroup.NON_CURRENT_ASSETS, SignPolicy.AS_IS),
    OTHER_NON_CURRENT_ASSET("other_non_current_asset", StatementGroup.NON_CURRENT_ASSETS, SignPolicy.AS_IS),
    PAYABLES("payables", StatementGroup.CURRENT_LIABILITIES, SignPolicy.AS_IS),
    PROVISIONS_CURRENT("provisions_current", StatementGroup.CURRENT_LIABILITIES, SignPolicy.AS_IS),
    PROVISIONS_NON_CURRENT("provisions_non_current", StatementGroup.NON_CURRENT_LIABILITIES, SignPolicy.AS_IS),
    RELATED_PARTY_LOAN_CURRENT("related_party_loan_current", StatementGroup.CURRENT_LIABILITIES, SignPolicy.AS_IS),
    RELATED_PARTY_LOAN_NON_CURRENT("related_party_loan_non_current", StatementGroup.NON_CURRENT_LIABILITIES, SignPolicy.AS_IS),
    OTHER_CURRENT_LIABILITY("other_current_liability", StatementGroup.CURRENT_LIABILITIES, SignPolicy.AS_IS),
    BORROWINGS("borrowings", StatementGroup.NON_CURRENT_LIABILITIES, SignPolicy.AS_IS),
    OTHER_NON_CURRENT_LIABILITY("other_non_current_liability", StatementGroup.NON_CURRENT_LIABILITIES, SignPolicy.AS_IS),
    SHARE_CAPITAL("share_capital", StatementGroup.EQUITY, SignPolicy.AS_IS),
    RESERVES("reserves", StatementGroup.EQUITY, SignPolicy.AS_IS),
    RETAINED_EARNINGS("retained_earnings", StatementGroup.EQUITY, SignPolicy.AS_IS);

    private final String key;
    // null for income-statement categories
    private final StatementGroup group;
    private final SignPolicy signPolicy;

    Category(String key, StatementGroup group, SignPolicy signPolicy) {
        this.key = key;
        this.group = group;
        this.signPolicy = signPolicy;
    }

    public String getKey() {
        return key;
    }

    public SignPolicy getSignPolicy() {
        return signPolicy;
    }

    public static List<Category> inGroup(StatementGroup group) {
        List<Category> result = new ArrayList<>();
        for (Category c : values()) {
            if (c.group == group) result.add(c);
        }
        return result;
    }

    /** Looks up a category by its snake_case key, or returns null. */
    public static Category fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Category c : values()) {
            if (c.key.equals(k)) return c;
        }
        return null;
    }
}
