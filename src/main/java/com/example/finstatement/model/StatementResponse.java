package com.example.finstatement.model;

import java.math.BigDecimal;
import java.util.List;

public class StatementResponse {
    public String entityName;
    public Integer priorYear;
    public FinancialDataset current;
    public FinancialDataset prior;
    // present only when validation raised no fatal issue
    public FinancialDataset rolledForward;
    public BigDecimal priorRetainedEarnings;
    public List<Signatory> directors;
    public Signatory compiler;
    public PriorYearReport priorYearReport;
    public List<String> derived;
    public List<String> augmented;
    public ValidationReport report;

    public StatementResponse() {}
}
