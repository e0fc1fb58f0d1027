package com.example.finstatement.model;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Current and prior datasets with the signatory metadata, as handed to the validator.
 */
@Getter
@Builder
public class StatementBundle {
    private final FinancialDataset current;
    private final FinancialDataset prior;
    private final BigDecimal priorRetainedEarnings;
    @Singular
    private final List<Signatory> directors;
    private final Signatory compiler;
    private final String taxConsolidationEntity;
    private final String contingentLiabilityText;
    @Singular
    private final List<NoteSection> notes;
}
