package com.taskpulse.checkin.integration.models.enrichment;

import com.taskpulse.checkin.integration.contract.enrichment.ISuggestionRequest;
import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionRequest implements ISuggestionRequest {
    private String checkInId;
    private String taskId;
    private String taskTitle;
    private ProgressIndicator progressIndicator;
    private String progressNotes;
    private String blockersReported;
    private boolean helpNeeded;
}
