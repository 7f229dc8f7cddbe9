package com.example.corprisk.service.analyzer;

import com.example.corprisk.model.Rating;

/**
 * Outcome of a rating cascade: the id of the winning rule plus what it says.
 */
public record Verdict(String ruleId, Rating rating, String ratingLogic, String summary) {
}
