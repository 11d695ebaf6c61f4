package com.taskpulse.checkin.integration.contract.enrichment;

import reactor.core.publisher.Mono;

/**
 * External AI collaborator producing sentiment scores and suggestions for check-in submissions.
 *
 * <p>Implementations may be slow or fail; callers must treat every error as
 * non-fatal. A result with no fields set is a valid answer.</p>
 */
public interface IEnrichmentGateway {

    Mono<IEnrichmentResult> analyzeSentiment(String text);

    Mono<IEnrichmentResult> suggest(ISuggestionRequest request);
}
