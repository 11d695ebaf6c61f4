package com.taskpulse.checkin.core.engine.rest;

import com.jayway.jsonpath.JsonPath;
import com.taskpulse.checkin.core.engine.TaskPulseCheckInEngine;
import com.taskpulse.checkin.core.engine.support.MutableClock;
import com.taskpulse.checkin.core.engine.validation.CheckInRequestValidator;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.taskpulse.checkin.core.engine.support.CheckInTestFixtures.*;

/**
 * HTTP contract tests for {@link CheckInConfigController}.
 */
class CheckInConfigControllerTest {

    private static final String BASE = "/api/v1/checkins/config";

    private WebTestClient client;
    private ICheckInConfig orgDefault;

    @BeforeEach
    void setUp() {
        TaskPulseCheckInEngine engine = TaskPulseCheckInEngine.builder()
                .directory(directory(MONDAY_0800))
                .clock(new MutableClock(MONDAY_1000))
                .build();
        orgDefault = installDefault(engine);
        client = WebTestClient.bindToController(
                new CheckInConfigController(engine.getConfigService(), CheckInRequestValidator.create())).build();
    }

    private String createTeamConfig() {
        byte[] body = client.post().uri(BASE)
                .header(CheckInController.ORG_HEADER, ORG)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("team_id", TEAM, "interval_hours", 4))
                .exchange()
                .expectStatus().isCreated()
                .expectBody().returnResult().getResponseBodyContent();
        return JsonPath.read(new String(body, StandardCharsets.UTF_8), "$.data.id");
    }

    @Test
    @DisplayName("GET /config lists the organization default")
    void shouldListConfigs() {
        client.get().uri(BASE)
                .header(CheckInController.ORG_HEADER, ORG)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].id").isEqualTo(orgDefault.getId())
                .jsonPath("$.data[0].scope").isEqualTo("ORGANIZATION")
                .jsonPath("$.data[0].max_daily_checkins").isEqualTo(4)
                .jsonPath("$.data[0].excluded_days.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("POST /config creates a team config with defaults for absent fields")
    void shouldCreateTeamConfig() {
        client.post().uri(BASE)
                .header(CheckInController.ORG_HEADER, ORG)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("team_id", TEAM, "interval_hours", 4))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.data.scope").isEqualTo("TEAM")
                .jsonPath("$.data.team_id").isEqualTo(TEAM)
                .jsonPath("$.data.interval_hours").isEqualTo(4.0)
                .jsonPath("$.data.work_start_hour").isEqualTo(9);
    }

    @Test
    @DisplayName("POST /config for a taken scope returns 409")
    void shouldRejectDuplicateScope() {
        createTeamConfig();

        client.post().uri(BASE)
                .header(CheckInController.ORG_HEADER, ORG)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("team_id", TEAM))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0007");
    }

    @Test
    @DisplayName("POST /config with out-of-range values returns 400")
    void shouldRejectInvalidConfig() {
        client.post().uri(BASE)
                .header(CheckInController.ORG_HEADER, ORG)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("user_id", USER, "interval_hours", 0.5, "silent_mode_threshold", 2))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.field_errors.interval_hours").isEqualTo("must be at least 1")
                .jsonPath("$.field_errors.silent_mode_threshold").isEqualTo("must be between 0 and 1");
    }

    @Test
    @DisplayName("PATCH /config/{id} updates present fields and checks the hours pair")
    void shouldPatchConfig() {
        client.patch().uri(BASE + "/{id}", orgDefault.getId())
                .header(CheckInController.ORG_HEADER, ORG)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("max_daily_checkins", 2, "respect_timezone", false))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.max_daily_checkins").isEqualTo(2)
                .jsonPath("$.data.respect_timezone").isEqualTo(false)
                .jsonPath("$.data.interval_hours").isEqualTo(3.0);

        client.patch().uri(BASE + "/{id}", orgDefault.getId())
                .header(CheckInController.ORG_HEADER, ORG)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("work_start_hour", 20))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.field_errors.work_end_hour").isEqualTo("must be after work_start_hour");
    }

    @Test
    @DisplayName("GET /config/{id} from another organization returns 404")
    void shouldHideOtherOrganizations() {
        client.get().uri(BASE + "/{id}", orgDefault.getId())
                .header(CheckInController.ORG_HEADER, "org-2")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0003");
    }

    @Test
    @DisplayName("DELETE /config/{id} keeps the default and removes narrower configs")
    void shouldDeleteConfig() {
        String teamConfig = createTeamConfig();

        client.delete().uri(BASE + "/{id}", orgDefault.getId())
                .header(CheckInController.ORG_HEADER, ORG)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("TASKPULSE_ERR_0008");

        client.delete().uri(BASE + "/{id}", teamConfig)
                .header(CheckInController.ORG_HEADER, ORG)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);

        client.get().uri(BASE + "/{id}", teamConfig)
                .header(CheckInController.ORG_HEADER, ORG)
                .exchange()
                .expectStatus().isNotFound();
    }
}
