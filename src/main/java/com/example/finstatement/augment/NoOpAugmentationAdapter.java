package com.example.finstatement.augment;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.example.finstatement.model.FinancialDataset;

/** Used when augmentation is switched off or no API key is configured. */
public class NoOpAugmentationAdapter implements AugmentationAdapter {

    @Override
    public Optional<FinancialDataset> augment(FinancialDataset partial, String sourceText) {
        return Optional.empty();
    }

    @Override
    public List<String> advise(FinancialDataset current, FinancialDataset prior) {
        return Collections.emptyList();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
