package com.example.finstatement.augment;

import java.util.List;
import java.util.Optional;

import com.example.finstatement.model.FinancialDataset;

/**
 * Optional assistant behind the deterministic pipeline. Implementations must never throw:
 * any failure is reported as an empty result so the caller carries on without it.
 */
public interface AugmentationAdapter {

    /**
     * Proposes values for categories {@code partial} lacks, read from {@code sourceText}.
     * Returned values for categories already present are ignored by the caller.
     */
    Optional<FinancialDataset> augment(FinancialDataset partial, String sourceText);

    /** Free-text review remarks on the current figures against the prior year. */
    List<String> advise(FinancialDataset current, FinancialDataset prior);

    default boolean isEnabled() {
        return true;
    }
}
