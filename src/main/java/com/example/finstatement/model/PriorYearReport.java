package com.example.finstatement.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything read from the prior year's printed report: comparative figures plus the
 * structure and wording the current year must stay consistent with.
 */
public class PriorYearReport {
    public String entityName;
    public Integer priorYear;
    public Map<String, Integer> contents = new LinkedHashMap<>();
    public List<NoteSection> notes = new ArrayList<>();
    public List<Signatory> directors = new ArrayList<>();
    public Signatory compiler;
    public String taxConsolidationEntity;
    public String contingentLiabilityText;
    public FinancialDataset dataset = FinancialDataset.empty(ReportingPeriod.PRIOR);
}
