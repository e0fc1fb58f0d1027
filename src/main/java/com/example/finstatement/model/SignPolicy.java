package com.example.finstatement.model;

import java.math.BigDecimal;

public enum SignPolicy {

    AS_IS,

    /** Deductions are stored as magnitudes; the renderer parenthesises them. */
    NON_NEGATIVE_MAGNITUDE;

    public BigDecimal apply(BigDecimal value) {
        if (value == null) return null;
        return this == NON_NEGATIVE_MAGNITUDE ? value.abs() : value;
    }
}
