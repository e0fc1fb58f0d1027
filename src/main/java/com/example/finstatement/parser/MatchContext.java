package com.example.finstatement.parser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Label text of one row or line, lower-cased, plus its position within the statement.
 */
public final class MatchContext {

    private static final Pattern P_NON_CURRENT = Pattern.compile("non[\\s-]*current");
    private static final Pattern P_WORD_PPE = Pattern.compile("\\bppe\\b");

    private final String text;
    private final int position;

    public MatchContext(String text, int position) {
        this.text = text == null ? "" : text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        this.position = position;
    }

    public String text() {
        return text;
    }

    /** Zero-based row index in the table, or line index within the section. */
    public int position() {
        return position;
    }

    /** True when every keyword appears somewhere in the text. */
    public boolean has(String... keywords) {
        for (String k : keywords) {
            if (!text.contains(k)) return false;
        }
        return true;
    }

    public boolean hasAny(String... keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    public boolean nonCurrent() {
        return P_NON_CURRENT.matcher(text).find();
    }

    /** Says "current" without saying "non-current". */
    public boolean currentOnly() {
        return text.contains("current") && !nonCurrent();
    }

    /** Says neither "current" nor "non-current". */
    public boolean silentOnTerm() {
        return !text.contains("current");
    }

    public boolean mentionsPpe() {
        return P_WORD_PPE.matcher(text).find();
    }

    @Override
    public String toString() {
        return "#" + position + " '" + text + "'";
    }
}
