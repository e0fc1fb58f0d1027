package com.example.finstatement.parser;

import java.util.function.Predicate;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.SignPolicy;

/**
 * One entry of a statement's rule table. Uniqueness is always first-match-wins: once the
 * category holds a value, later rows claimed by this rule are ignored.
 */
public final class MatchRule {

    private final Category category;
    private final String description;
    private final Predicate<MatchContext> predicate;
    private final SignPolicy signPolicy;

    public MatchRule(Category category, String description, Predicate<MatchContext> predicate) {
        this(category, description, predicate, category.getSignPolicy());
    }

    public MatchRule(Category category, String description, Predicate<MatchContext> predicate, SignPolicy signPolicy) {
        this.category = category;
        this.description = description;
        this.predicate = predicate;
        this.signPolicy = signPolicy;
    }

    public boolean matches(MatchContext ctx) {
        return predicate.test(ctx);
    }

    public Category getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public SignPolicy getSignPolicy() {
        return signPolicy;
    }

    @Override
    public String toString() {
        return category.getKey() + " <- " + description;
    }
}
