package com.taskpulse.checkin.integration.models.enrichment;

import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentResult implements IEnrichmentResult {

    private Double sentimentScore;
    private String suggestion;
    private Double confidence;

    public static EnrichmentResult empty() {
        return new EnrichmentResult();
    }

    public static EnrichmentResult sentiment(double score) {
        return EnrichmentResult.builder().sentimentScore(score).build();
    }

    public static EnrichmentResult suggestion(String suggestion, Double confidence) {
        return EnrichmentResult.builder().suggestion(suggestion).confidence(confidence).build();
    }
}
