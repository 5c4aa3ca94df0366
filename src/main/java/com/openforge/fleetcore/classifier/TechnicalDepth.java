package com.openforge.fleetcore.classifier;

/**
 * Outcome of {@link TechnicalDepthScorer#score}.
 *
 * @param score           0..10
 * @param keywordMatches  distinct technical-vocabulary terms found
 * @param phraseMatches   explicit depth-request phrases found
 * @param required        whether the answer should go into technical depth
 */
public record TechnicalDepth(int score, int keywordMatches, int phraseMatches, boolean required) {

    public static final TechnicalDepth NONE = new TechnicalDepth(0, 0, 0, false);
}
