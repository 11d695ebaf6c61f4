package com.taskpulse.checkin.core.engine.enrichment;

import com.taskpulse.checkin.core.exception.EnrichmentDependencyException;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentGateway;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentResult;
import com.taskpulse.checkin.integration.contract.enrichment.ISuggestionRequest;
import com.taskpulse.checkin.integration.models.enrichment.EnrichmentResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Engine-side wrapper of the enrichment gateway.
 *
 * <p>Each call is bounded by a timeout. Errors and timeouts are logged at warn and
 * turned into an empty result, so callers never see a failed enrichment.</p>
 */
@Slf4j
public class CheckInEnrichmentAdapter {

    private final IEnrichmentGateway gateway;
    private final Duration timeout;

    public CheckInEnrichmentAdapter(IEnrichmentGateway gateway, Duration timeout) {
        this.gateway = gateway;
        this.timeout = timeout;
    }

    public Mono<IEnrichmentResult> analyzeSentiment(String text) {
        if (text == null || text.isBlank()) {
            return Mono.just(EnrichmentResult.empty());
        }
        return guard("sentiment", Mono.defer(() -> gateway.analyzeSentiment(text)));
    }

    public Mono<IEnrichmentResult> suggest(ISuggestionRequest request) {
        return guard("suggestion", Mono.defer(() -> gateway.suggest(request)));
    }

    private Mono<IEnrichmentResult> guard(String operation, Mono<IEnrichmentResult> call) {
        return call
                .timeout(timeout)
                .map(result -> sanitize(operation, result))
                .defaultIfEmpty(EnrichmentResult.empty())
                .onErrorResume(error -> {
                    EnrichmentDependencyException failure = new EnrichmentDependencyException(operation, error);
                    log.warn("{} ({})", failure.getMessage(), failure.getErrorCode());
                    return Mono.just(EnrichmentResult.empty());
                });
    }

    private static IEnrichmentResult sanitize(String operation, IEnrichmentResult result) {
        Double score = result.getSentimentScore();
        if (score != null && (score.isNaN() || score < 0 || score > 1)) {
            log.warn("Discarding out-of-range sentiment score from {} call: {}", operation, score);
            return EnrichmentResult.builder()
                    .suggestion(result.getSuggestion())
                    .confidence(result.getConfidence())
                    .build();
        }
        return result;
    }
}
