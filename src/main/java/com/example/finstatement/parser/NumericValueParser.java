package com.example.finstatement.parser;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the single relevant amount out of a spreadsheet row or a line of report text.
 * An empty result means no amount was found; it is never reported as zero.
 */
public final class NumericValueParser {

    /** Cells that are filled in but carry no value. */
    private static final Set<String> NIL_TOKENS = Set.of("-", "nil", "n/a", "", "nan");

    // $1,234,567.89  (1,234)  -1234  -$500. A dash standing apart from the digits is a nil marker, not a sign.
    private static final Pattern P_CURRENCY_TOKEN = Pattern.compile(
            "(?<![\\w.,])(\\(\\s*\\$?\\s*\\d[\\d,]*(?:\\.\\d+)?\\s*\\)|(?:-(?=[$\\d]))?\\$?\\s?\\d[\\d,]*(?:\\.\\d+)?)(?!\\w)");

    private NumericValueParser() {
    }

    // -------------------- rows --------------------
    /**
     * Scans right to left, skipping the label cell; the rightmost numeric cell wins because
     * the latest period sits in the rightmost column.
     */
    public static Optional<BigDecimal> fromRow(List<?> row) {
        if (row == null || row.size() < 2) return Optional.empty();
        for (int i = row.size() - 1; i >= 1; i--) {
            Optional<BigDecimal> value = fromCell(row.get(i));
            if (value.isPresent()) return value;
        }
        return Optional.empty();
    }

    public static Optional<BigDecimal> fromCell(Object cell) {
        if (cell == null) return Optional.empty();
        if (cell instanceof BigDecimal) return Optional.of((BigDecimal) cell);
        if (cell instanceof Number) {
            double d = ((Number) cell).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return Optional.empty();
            if (cell instanceof Integer || cell instanceof Long) {
                return Optional.of(BigDecimal.valueOf(((Number) cell).longValue()));
            }
            return Optional.of(BigDecimal.valueOf(d));
        }
        return parseCellText(cell.toString());
    }

    static Optional<BigDecimal> parseCellText(String raw) {
        String cleaned = raw.replace(",", "")
                .replace("$", "")
                .replace("(", "-")
                .replace(")", "")
                .trim();
        if (NIL_TOKENS.contains(cleaned.toLowerCase(Locale.ROOT))) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    // -------------------- text lines --------------------
    /** Last currency-shaped token on the line; parenthesised or minus-prefixed means negative. */
    public static Optional<BigDecimal> fromLine(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        Matcher m = P_CURRENCY_TOKEN.matcher(line);
        String last = null;
        while (m.find()) {
            last = m.group(1);
        }
        if (last == null) return Optional.empty();

        String token = last.replaceAll("\\s", "");
        boolean negative = token.startsWith("(") || token.startsWith("-");
        String digits = token.replaceAll("[()$,\\-]", "");
        if (digits.isEmpty()) return Optional.empty();
        try {
            BigDecimal value = new BigDecimal(digits);
            return Optional.of(negative ? value.negate() : value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
