package com.example.finstatement.model;

public enum StatementGroup {
    CURRENT_ASSETS,
    NON_CURRENT_ASSETS,
    CURRENT_LIABILITIES,
    NON_CURRENT_LIABILITIES,
    EQUITY
}
