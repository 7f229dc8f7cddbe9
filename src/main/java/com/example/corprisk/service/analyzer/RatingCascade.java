package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.Rating;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered rule list where the first matching condition decides the rating. When nothing
 * matches the fallback applies, which always rates {@link Rating#CLEAN}. Order encodes
 * severity precedence and is part of each dimension's contract.
 *
 * @param <F> facts type the rules read
 */
public final class RatingCascade<F> {

    public static final String FALLBACK_ID = "clean";

    private final List<RatingRule<F>> rules;
    private final RatingRule<F> fallback;

    private RatingCascade(List<RatingRule<F>> rules, RatingRule<F> fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
    }

    public static <F> Builder<F> builder() {
        return new Builder<>();
    }

    public Verdict evaluate(F facts) {
        for (RatingRule<F> rule : rules) {
            if (rule.condition().test(facts)) {
                return rule.apply(facts);
            }
        }
        return fallback.apply(facts);
    }

    /** Rule ids in evaluation order, fallback excluded. */
    public List<String> ruleIds() {
        return rules.stream().map(RatingRule::id).toList();
    }

    public static final class Builder<F> {
        private final List<RatingRule<F>> rules = new ArrayList<>();

        private Builder() {}

        public Builder<F> rule(String id, Predicate<F> condition, Rating rating,
                               Function<F, String> logic, Function<F, String> summary) {
            if (FALLBACK_ID.equals(id) || rules.stream().anyMatch(r -> r.id().equals(id))) {
                throw new IllegalArgumentException("duplicate rule id: " + id);
            }
            rules.add(new RatingRule<>(id, condition, rating, logic, summary));
            return this;
        }

        public RatingCascade<F> otherwise(Function<F, String> logic, Function<F, String> summary) {
            return new RatingCascade<>(rules, new RatingRule<>(FALLBACK_ID, f -> true, Rating.CLEAN, logic, summary));
        }
    }
}
