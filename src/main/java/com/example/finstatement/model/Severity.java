package com.example.finstatement.model;

public enum Severity {
    /** Generation halts. */
    FATAL,
    /** A person must sign off before generation proceeds. */
    QUERY,
    /** Informational. */
    WARNING
}
