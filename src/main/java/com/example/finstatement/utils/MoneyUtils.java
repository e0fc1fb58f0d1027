package com.example.finstatement.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public class MoneyUtils {

    // whole dollars, as printed in the statements
    private static final String PATTERN = "#,##0";

    private MoneyUtils() {
    }

    /** 1234567.4 → "$1,234,567", -500 → "-$500". */
    public static String format(BigDecimal amount) {
        if (amount == null) return "n/a";
        BigDecimal rounded = amount.setScale(0, RoundingMode.HALF_UP);
        DecimalFormat fmt = new DecimalFormat(PATTERN, DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        String digits = fmt.format(rounded.abs());
        return (rounded.signum() < 0 ? "-$" : "$") + digits;
    }

    /** Parses a user-supplied amount such as "$1,200" or "(300)"; blank gives null. */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) return null;
        String cleaned = text.replace(",", "").replace("$", "").replace("(", "-").replace(")", "").trim();
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an amount: " + text, e);
        }
    }
}
