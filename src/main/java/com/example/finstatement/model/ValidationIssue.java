package com.example.finstatement.model;

import java.math.BigDecimal;
import java.util.Objects;

public final class ValidationIssue {

    private final Severity severity;
    private final String code;
    private final String message;
    private final BigDecimal delta;

    public ValidationIssue(Severity severity, String code, String message, BigDecimal delta) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.delta = delta;
    }

    public static ValidationIssue fatal(String code, String message, BigDecimal delta) {
        return new ValidationIssue(Severity.FATAL, code, message, delta);
    }

    public static ValidationIssue query(String code, String message) {
        return new ValidationIssue(Severity.QUERY, code, message, null);
    }

    public static ValidationIssue warning(String code, String message) {
        return new ValidationIssue(Severity.WARNING, code, message, null);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /** Signed difference for numeric checks, null otherwise. */
    public BigDecimal getDelta() {
        return delta;
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message;
    }
}
