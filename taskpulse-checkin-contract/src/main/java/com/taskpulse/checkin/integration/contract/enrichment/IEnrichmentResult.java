package com.taskpulse.checkin.integration.contract.enrichment;

/**
 * Output of an enrichment call. Every field is optional.
 */
public interface IEnrichmentResult {

    /**
     * Sentiment in {@code [0, 1]}, where lower is more negative.
     */
    Double getSentimentScore();

    String getSuggestion();

    Double getConfidence();

    default boolean isEmpty() {
        return getSentimentScore() == null && getSuggestion() == null && getConfidence() == null;
    }
}
