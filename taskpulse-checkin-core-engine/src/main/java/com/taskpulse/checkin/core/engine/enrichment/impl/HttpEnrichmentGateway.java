package com.taskpulse.checkin.core.engine.enrichment.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentGateway;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentResult;
import com.taskpulse.checkin.integration.contract.enrichment.ISuggestionRequest;
import com.taskpulse.checkin.integration.models.enrichment.EnrichmentResult;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enrichment gateway backed by an HTTP service.
 *
 * <ul>
 *   <li>{@code POST {baseUrl}/sentiment} with {@code {"text": ...}}, answering {@code {"sentiment_score": 0.42}}</li>
 *   <li>{@code POST {baseUrl}/suggestions} with the submission context, answering
 *       {@code {"suggestion": "...", "confidence": 0.8}}</li>
 * </ul>
 *
 * <p>Server errors are retried once; errors are propagated to the caller, which decides how to degrade.</p>
 */
@Slf4j
public class HttpEnrichmentGateway implements IEnrichmentGateway {

    private final WebClient webClient;
    private int retryAttempts = 1;
    private Duration retryBackoff = Duration.ofMillis(200);

    public HttpEnrichmentGateway(String baseUrl) {
        this(WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                .build());
    }

    public HttpEnrichmentGateway(WebClient webClient) {
        this.webClient = webClient;
        log.info("HttpEnrichmentGateway initialized");
    }

    public HttpEnrichmentGateway withRetryAttempts(int attempts) {
        this.retryAttempts = attempts;
        return this;
    }

    public HttpEnrichmentGateway withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    @Override
    public Mono<IEnrichmentResult> analyzeSentiment(String text) {
        return webClient.post()
                .uri("/sentiment")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", text))
                .retrieve()
                .bodyToMono(SentimentResponse.class)
                .retryWhen(retrySpec("sentiment"))
                .map(response -> (IEnrichmentResult) EnrichmentResult.builder()
                        .sentimentScore(response.getSentimentScore())
                        .build());
    }

    @Override
    public Mono<IEnrichmentResult> suggest(ISuggestionRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("check_in_id", request.getCheckInId());
        payload.put("task_id", request.getTaskId());
        payload.put("task_title", request.getTaskTitle());
        payload.put("progress_indicator", request.getProgressIndicator());
        payload.put("progress_notes", request.getProgressNotes());
        payload.put("blockers_reported", request.getBlockersReported());
        payload.put("help_needed", request.isHelpNeeded());

        return webClient.post()
                .uri("/suggestions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(SuggestionResponse.class)
                .retryWhen(retrySpec("suggestion"))
                .map(response -> (IEnrichmentResult) EnrichmentResult.suggestion(
                        response.getSuggestion(), response.getConfidence()));
    }

    private Retry retrySpec(String operation) {
        return Retry.backoff(retryAttempts, retryBackoff)
                .filter(HttpEnrichmentGateway::isRetryableError)
                .doBeforeRetry(signal -> log.warn("Retrying enrichment {} call, attempt {}",
                        operation, signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private static boolean isRetryableError(Throwable error) {
        if (error instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError();
        }
        return true;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SentimentResponse {
        @JsonProperty("sentiment_score")
        private Double sentimentScore;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SuggestionResponse {
        private String suggestion;
        private Double confidence;
    }
}
