package com.example.finstatement.service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;

/**
 * Fills aggregates the source left out, using the income-statement identities. Only absent
 * values are derived; an extracted value always wins.
 */
@Service
public class DerivedValueCalculator {

    private static final Logger log = LoggerFactory.getLogger(DerivedValueCalculator.class);

    public static class Result {
        private final FinancialDataset dataset;
        private final Set<Category> derived;

        Result(FinancialDataset dataset, Set<Category> derived) {
            this.dataset = dataset;
            this.derived = Collections.unmodifiableSet(derived);
        }

        /** Derived and zero-defaulted dataset. */
        public FinancialDataset getDataset() {
            return dataset;
        }

        public Set<Category> getDerived() {
            return derived;
        }

        /** EBITDA was copied from profit before tax rather than found in the source. */
        public boolean isEbitdaApproximated() {
            return derived.contains(Category.EBITDA);
        }
    }

    public Result derive(FinancialDataset input) {
        FinancialDataset ds = input;
        Set<Category> derived = EnumSet.noneOf(Category.class);

        // 1. gross profit needs both operands
        if (!ds.has(Category.GROSS_PROFIT) && ds.has(Category.REVENUE) && ds.has(Category.COST_OF_SALES)) {
            ds = ds.with(Category.GROSS_PROFIT, ds.amount(Category.REVENUE).subtract(ds.amount(Category.COST_OF_SALES)));
            derived.add(Category.GROSS_PROFIT);
        }

        // 2. absent operands count as zero from here on
        if (!ds.has(Category.PROFIT_BEFORE_TAX)) {
            BigDecimal pbt = ds.amount(Category.GROSS_PROFIT)
                    .add(ds.amount(Category.OTHER_INCOME))
                    .subtract(ds.amount(Category.DISTRIBUTION_COSTS))
                    .subtract(ds.amount(Category.ADMINISTRATIVE_EXPENSES))
                    .subtract(ds.amount(Category.OTHER_EXPENSES));
            ds = ds.with(Category.PROFIT_BEFORE_TAX, pbt);
            derived.add(Category.PROFIT_BEFORE_TAX);
        }

        // 3.
        if (!ds.has(Category.NET_PROFIT_LOSS)) {
            ds = ds.with(Category.NET_PROFIT_LOSS,
                    ds.amount(Category.PROFIT_BEFORE_TAX).subtract(ds.amount(Category.INCOME_TAX_EXPENSE)));
            derived.add(Category.NET_PROFIT_LOSS);
        }

        // 4. no interest/depreciation/amortisation breakdown is extracted, so this is an approximation
        if (!ds.has(Category.EBITDA)) {
            ds = ds.with(Category.EBITDA, ds.amount(Category.PROFIT_BEFORE_TAX));
            derived.add(Category.EBITDA);
        }

        if (!derived.isEmpty()) {
            log.info("🧮 {} derived: {}", input.getPeriod(), derived);
        }
        return new Result(ds.withDefaults(), derived);
    }

    /**
     * A new dataset whose retained earnings equal {@code priorRetainedEarnings} plus this
     * year's net profit. The input is left untouched.
     */
    public FinancialDataset rollForwardRetainedEarnings(FinancialDataset current, BigDecimal priorRetainedEarnings) {
        BigDecimal prior = priorRetainedEarnings == null ? BigDecimal.ZERO : priorRetainedEarnings;
        BigDecimal rolled = prior.add(current.amount(Category.NET_PROFIT_LOSS));
        log.info("🔁 retained earnings rolled forward: {} → {}", current.amount(Category.RETAINED_EARNINGS), rolled);
        return current.with(Category.RETAINED_EARNINGS, rolled);
    }
}
