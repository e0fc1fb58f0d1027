package com.example.finstatement.parser;

/**
 * Decides current vs non-current for a row whose label does not say which, from where the
 * row sits in the statement. Layout-dependent; replace it when a source puts its
 * liabilities elsewhere.
 */
public interface PositionalTieBreak {

    boolean isCurrent(int position);

    /** Rows above {@code limit} count as current. */
    static PositionalTieBreak leadingRows(int limit) {
        return position -> position < limit;
    }
}
