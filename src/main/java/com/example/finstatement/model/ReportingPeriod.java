package com.example.finstatement.model;

public enum ReportingPeriod {
    CURRENT,
    PRIOR
}
