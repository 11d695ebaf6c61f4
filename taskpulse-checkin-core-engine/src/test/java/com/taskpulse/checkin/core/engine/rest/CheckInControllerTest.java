package com.taskpulse.checkin.core.engine.rest;

import com.jayway.jsonpath.JsonPath;
import com.taskpulse.checkin.core.engine.TaskPulseCheckInEngine;
import com.taskpulse.checkin.core.engine.support.MutableClock;
import com.taskpulse.checkin.core.engine.validation.CheckInRequestValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.taskpulse.checkin.core.engine.support.CheckInTestFixtures.*;

/**
 * HTTP contract tests for {@link CheckInController} against an in-memory engine.
 */
class CheckInControllerTest {

    private static final String BASE = "/api/v1/checkins";

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        TaskPulseCheckInEngine engine = TaskPulseCheckInEngine.builder()
                .directory(directory(MONDAY_0800).withAssignment(assignment("task-2", "carol", MONDAY_0800)))
                .clock(new MutableClock(MONDAY_1000))
                .build();
        installDefault(engine);
        CheckInController controller = new CheckInController(engine.getLifecycleService(),
                engine.getStatisticsService(), engine.getAuditService(), CheckInRequestValidator.create(),
                engine.getSettings());
        client = WebTestClient.bindToController(controller).build();
    }

    private String createCheckIn(String taskId) {
        byte[] body = client.post().uri(BASE)
                .header(CheckInController.ORG_HEADER, ORG)
                .header(CheckInController.USER_HEADER, MANAGER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("task_id", taskId))
                .exchange()
                .expectStatus().isCreated()
                .expectBody().returnResult().getResponseBodyContent();
        return JsonPath.read(new String(body, StandardCharsets.UTF_8), "$.data.id");
    }

    // ========================================================================
    // CREATE AND READ TESTS
    // ========================================================================

    @Nested
    @DisplayName("Create and Read")
    class CreateAndReadTests {

        @Test
        @DisplayName("POST /checkins returns 201 with a pending check-in")
        void shouldCreate() {
            client.post().uri(BASE)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("task_id", TASK))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.data.status").isEqualTo("pending")
                    .jsonPath("$.data.trigger").isEqualTo("manual")
                    .jsonPath("$.data.user_id").isEqualTo(USER)
                    .jsonPath("$.data.cycle_number").isEqualTo(1);
        }

        @Test
        @DisplayName("POST /checkins without task_id returns 400 with field errors")
        void shouldRejectMissingTask() {
            client.post().uri(BASE)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0001")
                    .jsonPath("$.field_errors.task_id").isEqualTo("is required");
        }

        @Test
        @DisplayName("POST /checkins while one is pending returns 409")
        void shouldRejectSecondPending() {
            createCheckIn(TASK);

            client.post().uri(BASE)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("task_id", TASK))
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0006");
        }

        @Test
        @DisplayName("GET /checkins/{id} includes the transition count and hides other organizations")
        void shouldGetById() {
            String id = createCheckIn(TASK);

            client.get().uri(BASE + "/{id}", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.id").isEqualTo(id)
                    .jsonPath("$.data.transition_count").isEqualTo(1);

            client.get().uri(BASE + "/{id}", id)
                    .header(CheckInController.ORG_HEADER, "org-2")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0002");
        }

        @Test
        @DisplayName("GET /checkins filters by status and pages")
        void shouldListWithFilters() {
            String first = createCheckIn(TASK);
            createCheckIn("task-2");
            client.post().uri(BASE + "/{id}/skip", first)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .exchange()
                    .expectStatus().isOk();

            client.get().uri(uri -> uri.path(BASE).queryParam("status", "pending,skipped").queryParam("limit", 1).build())
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.total").isEqualTo(2)
                    .jsonPath("$.data.items.length()").isEqualTo(1)
                    .jsonPath("$.data.has_more").isEqualTo(true);

            client.get().uri(uri -> uri.path(BASE).queryParam("status", "skipped").build())
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectBody()
                    .jsonPath("$.data.items[0].id").isEqualTo(first)
                    .jsonPath("$.data.items[0].status").isEqualTo("skipped");
        }

        @Test
        @DisplayName("GET /checkins with an unknown status returns 400")
        void shouldRejectUnknownStatus() {
            client.get().uri(uri -> uri.path(BASE).queryParam("status", "lost").build())
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.field_errors.status").exists();
        }

        @Test
        @DisplayName("GET /checkins/pending lists the caller's open check-ins")
        void shouldListPending() {
            createCheckIn(TASK);
            createCheckIn("task-2");

            client.get().uri(BASE + "/pending")
                    .header(CheckInController.USER_HEADER, USER)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.length()").isEqualTo(1)
                    .jsonPath("$.data[0].task_id").isEqualTo(TASK);
        }
    }

    // ========================================================================
    // ACTION TESTS
    // ========================================================================

    @Nested
    @DisplayName("Actions")
    class ActionTests {

        @Test
        @DisplayName("POST /respond records the update")
        void shouldRespond() {
            String id = createCheckIn(TASK);

            client.post().uri(BASE + "/{id}/respond", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("progress_indicator", "on_track", "progress_notes", "tests are green"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.status").isEqualTo("responded")
                    .jsonPath("$.data.progress_indicator").isEqualTo("on_track")
                    .jsonPath("$.data.friction_detected").isEqualTo(false);
        }

        @Test
        @DisplayName("POST /respond with blockers comes back escalated to the manager")
        void shouldEscalateOnBlockers() {
            String id = createCheckIn(TASK);

            client.post().uri(BASE + "/{id}/respond", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("progress_indicator", "blocked", "blockers_reported", "no test data"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.status").isEqualTo("escalated")
                    .jsonPath("$.data.escalated_to").isEqualTo(MANAGER)
                    .jsonPath("$.data.friction_detected").isEqualTo(true);
        }

        @Test
        @DisplayName("POST /respond without a progress indicator returns 400")
        void shouldRejectRespondWithoutIndicator() {
            String id = createCheckIn(TASK);

            client.post().uri(BASE + "/{id}/respond", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("progress_notes", "busy"))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.field_errors.progress_indicator").isEqualTo("is required");
        }

        @Test
        @DisplayName("POST /respond twice returns 409")
        void shouldRejectSecondResponse() {
            String id = createCheckIn(TASK);
            Map<String, String> body = Map.of("progress_indicator", "on_track");
            client.post().uri(BASE + "/{id}/respond", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isOk();

            client.post().uri(BASE + "/{id}/respond", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0005");
        }

        @Test
        @DisplayName("POST /skip with a reason stores it trimmed")
        void shouldSkip() {
            String id = createCheckIn(TASK);

            client.post().uri(BASE + "/{id}/skip", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("reason", "  on leave "))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.status").isEqualTo("skipped")
                    .jsonPath("$.data.skip_reason").isEqualTo("on leave");
        }

        @Test
        @DisplayName("POST /escalate routes to the manager")
        void shouldEscalate() {
            String id = createCheckIn(TASK);

            client.post().uri(BASE + "/{id}/escalate", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("reason", "scope unclear"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.status").isEqualTo("escalated")
                    .jsonPath("$.data.escalated_to").isEqualTo(MANAGER)
                    .jsonPath("$.data.escalation_reason").isEqualTo("scope unclear");
        }

        @Test
        @DisplayName("POST /escalate on an unknown id returns 404")
        void shouldRejectUnknownEscalation() {
            client.post().uri(BASE + "/{id}/escalate", "missing")
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, USER)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("reason", "scope unclear"))
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("actions from another organization return 404 and leave the check-in pending")
        void shouldHideCheckInFromOtherOrganization() {
            String id = createCheckIn(TASK);

            client.post().uri(BASE + "/{id}/escalate", id)
                    .header(CheckInController.ORG_HEADER, "org-2")
                    .header(CheckInController.USER_HEADER, "mallory")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("reason", "take over", "escalate_to", "mallory"))
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0002");

            client.post().uri(BASE + "/{id}/respond", id)
                    .header(CheckInController.ORG_HEADER, "org-2")
                    .header(CheckInController.USER_HEADER, "mallory")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("progress_indicator", "on_track"))
                    .exchange()
                    .expectStatus().isNotFound();

            client.post().uri(BASE + "/{id}/skip", id)
                    .header(CheckInController.ORG_HEADER, "org-2")
                    .header(CheckInController.USER_HEADER, "mallory")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .exchange()
                    .expectStatus().isNotFound();

            client.get().uri(BASE + "/{id}", id)
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.status").isEqualTo("pending")
                    .jsonPath("$.data.escalated").isEqualTo(false)
                    .jsonPath("$.data.transition_count").isEqualTo(1);
        }
    }

    // ========================================================================
    // STATISTICS AND FEED TESTS
    // ========================================================================

    @Nested
    @DisplayName("Statistics and Feed")
    class StatisticsAndFeedTests {

        @Test
        @DisplayName("GET /statistics summarizes the organization")
        void shouldReturnStatistics() {
            createCheckIn(TASK);

            client.get().uri(BASE + "/statistics")
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.total_checkins").isEqualTo(1)
                    .jsonPath("$.data.pending").isEqualTo(1)
                    .jsonPath("$.data.period_days").isEqualTo(30)
                    .jsonPath("$.data.response_rate").isEqualTo(0.0);
        }

        @Test
        @DisplayName("GET /statistics rejects a period outside one to 365 days")
        void shouldRejectPeriod() {
            client.get().uri(uri -> uri.path(BASE + "/statistics").queryParam("days", 366).build())
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.field_errors.days").isEqualTo("must be between 1 and 365");
        }

        @Test
        @DisplayName("GET /feed uses the caller as manager")
        void shouldReturnFeed() {
            createCheckIn(TASK);
            createCheckIn("task-2");

            client.get().uri(BASE + "/feed")
                    .header(CheckInController.ORG_HEADER, ORG)
                    .header(CheckInController.USER_HEADER, MANAGER)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.total").isEqualTo(1)
                    .jsonPath("$.data.items[0].checkin.user_id").isEqualTo(USER)
                    .jsonPath("$.data.items[0].needs_attention").isEqualTo(false)
                    .jsonPath("$.data.needs_attention_count").isEqualTo(0);
        }

        @Test
        @DisplayName("GET /feed without a manager returns 400")
        void shouldRequireManager() {
            client.get().uri(BASE + "/feed")
                    .header(CheckInController.ORG_HEADER, ORG)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.field_errors.manager_id").isEqualTo("is required");
        }
    }
}
