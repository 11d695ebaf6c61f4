package com.taskpulse.checkin.integration.contract.enrichment;

import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;

/**
 * Context handed to the enrichment gateway when asking for a suggestion.
 */
public interface ISuggestionRequest {

    String getCheckInId();

    String getTaskId();

    String getTaskTitle();

    ProgressIndicator getProgressIndicator();

    String getProgressNotes();

    String getBlockersReported();

    boolean isHelpNeeded();
}
