package com.taskpulse.checkin.core.engine.enrichment.impl;

import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentGateway;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentResult;
import com.taskpulse.checkin.integration.contract.enrichment.ISuggestionRequest;
import com.taskpulse.checkin.integration.models.enrichment.EnrichmentResult;
import reactor.core.publisher.Mono;

/**
 * Gateway used when no enrichment provider is configured. Always answers with an empty result.
 */
public class NoOpEnrichmentGateway implements IEnrichmentGateway {

    @Override
    public Mono<IEnrichmentResult> analyzeSentiment(String text) {
        return Mono.just(EnrichmentResult.empty());
    }

    @Override
    public Mono<IEnrichmentResult> suggest(ISuggestionRequest request) {
        return Mono.just(EnrichmentResult.empty());
    }
}
