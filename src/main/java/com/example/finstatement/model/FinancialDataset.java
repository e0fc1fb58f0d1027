package com.example.finstatement.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Line items of one reporting period. Instances are immutable: every change returns a copy.
 * A category with no entry is absent, which is not the same as zero. Group totals are
 * summed from the current values on every call and never stored.
 */
public final class FinancialDataset {

    private final ReportingPeriod period;
    private final EnumMap<Category, BigDecimal> values;

    private FinancialDataset(ReportingPeriod period, EnumMap<Category, BigDecimal> values) {
        this.period = Objects.requireNonNull(period, "period");
        this.values = values;
    }

    public static FinancialDataset empty(ReportingPeriod period) {
        return new FinancialDataset(period, new EnumMap<>(Category.class));
    }

    public static FinancialDataset of(ReportingPeriod period, Map<Category, BigDecimal> values) {
        EnumMap<Category, BigDecimal> copy = new EnumMap<>(Category.class);
        values.forEach((c, v) -> {
            if (c != null && v != null) copy.put(c, v);
        });
        return new FinancialDataset(period, copy);
    }

    // -------------------- access --------------------
    public ReportingPeriod getPeriod() {
        return period;
    }

    public Optional<BigDecimal> get(Category category) {
        return Optional.ofNullable(values.get(category));
    }

    public boolean has(Category category) {
        return values.containsKey(category);
    }

    /** Value or zero. Only meaningful for sums; absence checks must use {@link #has}. */
    public BigDecimal amount(Category category) {
        return values.getOrDefault(category, BigDecimal.ZERO);
    }

    public Map<Category, BigDecimal> asMap() {
        return Collections.unmodifiableMap(values);
    }

    // -------------------- copies --------------------
    public FinancialDataset with(Category category, BigDecimal value) {
        EnumMap<Category, BigDecimal> copy = new EnumMap<>(values);
        if (value == null) {
            copy.remove(category);
        } else {
            copy.put(category, value);
        }
        return new FinancialDataset(period, copy);
    }

    /** Values present here win; {@code other} only fills absent categories. */
    public FinancialDataset merge(FinancialDataset other) {
        EnumMap<Category, BigDecimal> copy = new EnumMap<>(values);
        other.values.forEach(copy::putIfAbsent);
        return new FinancialDataset(period, copy);
    }

    /** Every absent category set to zero. */
    public FinancialDataset withDefaults() {
        EnumMap<Category, BigDecimal> copy = new EnumMap<>(values);
        for (Category c : Category.values()) {
            copy.putIfAbsent(c, BigDecimal.ZERO);
        }
        return new FinancialDataset(period, copy);
    }

    // -------------------- totals --------------------
    public BigDecimal groupTotal(StatementGroup group) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Category c : Category.inGroup(group)) {
            sum = sum.add(amount(c));
        }
        return sum;
    }

    public BigDecimal totalCurrentAssets() {
        return groupTotal(StatementGroup.CURRENT_ASSETS);
    }

    public BigDecimal totalNonCurrentAssets() {
        return groupTotal(StatementGroup.NON_CURRENT_ASSETS);
    }

    public BigDecimal totalAssets() {
        return totalCurrentAssets().add(totalNonCurrentAssets());
    }

    public BigDecimal totalCurrentLiabilities() {
        return groupTotal(StatementGroup.CURRENT_LIABILITIES);
    }

    public BigDecimal totalNonCurrentLiabilities() {
        return groupTotal(StatementGroup.NON_CURRENT_LIABILITIES);
    }

    public BigDecimal totalLiabilities() {
        return totalCurrentLiabilities().add(totalNonCurrentLiabilities());
    }

    public BigDecimal totalEquity() {
        return groupTotal(StatementGroup.EQUITY);
    }

    public BigDecimal totalLiabilitiesAndEquity() {
        return totalLiabilities().add(totalEquity());
    }

    // -------------------- serialised view --------------------
    /** Present line items keyed by category name, in statement order. */
    public Map<String, BigDecimal> getValues() {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        values.forEach((c, v) -> out.put(c.getKey(), v));
        return out;
    }

    public Map<String, BigDecimal> getTotals() {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        out.put("total_current_assets", totalCurrentAssets());
        out.put("total_non_current_assets", totalNonCurrentAssets());
        out.put("total_assets", totalAssets());
        out.put("total_current_liabilities", totalCurrentLiabilities());
        out.put("total_non_current_liabilities", totalNonCurrentLiabilities());
        out.put("total_liabilities", totalLiabilities());
        out.put("total_equity", totalEquity());
        out.put("total_liabilities_and_equity", totalLiabilitiesAndEquity());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FinancialDataset)) return false;
        FinancialDataset that = (FinancialDataset) o;
        return period == that.period && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, values);
    }

    @Override
    public String toString() {
        return "FinancialDataset{" + period + ", " + getValues() + "}";
    }
}
