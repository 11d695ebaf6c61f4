package com.taskpulse.checkin.integration.models.checkin;

import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckInSubmission Tests")
class CheckInSubmissionTest {

    @Test
    @DisplayName("should ignore blank blockers")
    void shouldIgnoreBlankBlockers() {
        CheckInSubmission submission = CheckInSubmission.builder()
                .progressIndicator(ProgressIndicator.ON_TRACK)
                .blockersReported("   ")
                .build();

        assertFalse(submission.hasBlockers());
    }

    @Test
    @DisplayName("should join non-blank text fields for analysis")
    void shouldJoinTextForAnalysis() {
        CheckInSubmission submission = CheckInSubmission.builder()
                .progressIndicator(ProgressIndicator.AT_RISK)
                .progressNotes(" halfway ")
                .blockersReported("waiting on review")
                .build();

        assertTrue(submission.hasBlockers());
        assertEquals("halfway\nwaiting on review", submission.toAnalysisText());
    }

    @Test
    @DisplayName("should signal friction for help requests and blocked progress without blocker text")
    void shouldSignalFrictionWithoutBlockerText() {
        CheckInSubmission helpWanted = CheckInSubmission.builder()
                .progressIndicator(ProgressIndicator.ON_TRACK)
                .helpNeeded(true)
                .build();
        CheckInSubmission blocked = CheckInSubmission.builder()
                .progressIndicator(ProgressIndicator.BLOCKED)
                .build();
        CheckInSubmission fine = CheckInSubmission.builder()
                .progressIndicator(ProgressIndicator.AT_RISK)
                .blockersReported(" ")
                .build();

        assertTrue(helpWanted.signalsFriction());
        assertTrue(blocked.signalsFriction());
        assertFalse(fine.signalsFriction());
    }
}
