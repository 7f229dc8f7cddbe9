package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.Rating;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of a rating cascade.
 *
 * @param id        stable rule id, used by tests to pin the cascade order
 * @param condition fires when true
 * @param rating    rating assigned when this rule wins
 * @param logic     rating_logic text, rendered from the facts
 * @param summary   summary text, rendered from the facts
 * @param <F>       facts gathered by one analyzer
 */
public record RatingRule<F>(
        String id,
        Predicate<F> condition,
        Rating rating,
        Function<F, String> logic,
        Function<F, String> summary
) {
    public Verdict apply(F facts) {
        return new Verdict(id, rating, logic.apply(facts), summary.apply(facts));
    }
}
