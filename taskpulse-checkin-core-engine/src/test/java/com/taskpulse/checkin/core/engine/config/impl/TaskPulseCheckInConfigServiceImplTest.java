package com.taskpulse.checkin.core.engine.config.impl;

import com.taskpulse.checkin.core.engine.config.CheckInConfigPatch;
import com.taskpulse.checkin.core.engine.support.MutableClock;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.models.config.CheckInConfigModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TaskPulseCheckInConfigServiceImpl}.
 */
class TaskPulseCheckInConfigServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private MutableClock clock;
    private TaskPulseCheckInConfigServiceImpl configService;
    private ICheckInConfig orgDefault;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        configService = new TaskPulseCheckInConfigServiceImpl(new InMemoryCheckInConfigStore(), clock);
        orgDefault = configService.create(CheckInConfigModel.organizationDefault("org-1")).block();
    }

    // ========================================================================
    // CREATE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("should assign an id and timestamps")
        void shouldAssignIdentity() {
            assertNotNull(orgDefault.getId());
            assertEquals(NOW, orgDefault.getCreatedAt());
            assertEquals(NOW, orgDefault.getUpdatedAt());
        }

        @Test
        @DisplayName("should report every invalid field at once")
        void shouldReportInvalidFields() {
            // Given
            CheckInConfigModel invalid = CheckInConfigModel.organizationDefault("org-1")
                    .withTeamId("team-1")
                    .withIntervalHours(0.5)
                    .withSilentModeThreshold(1.5)
                    .withWorkStartHour(18)
                    .withWorkEndHour(9);

            // When / Then
            StepVerifier.create(configService.create(invalid))
                    .expectErrorSatisfies(error -> assertThat(((CheckInValidationException) error).getFieldErrors())
                            .containsOnlyKeys("interval_hours", "silent_mode_threshold", "work_end_hour"))
                    .verify();
        }

        @Test
        @DisplayName("should reject configs with more than one scope id or no eligible day")
        void shouldRejectAmbiguousScope() {
            CheckInConfigModel twoScopes = CheckInConfigModel.organizationDefault("org-1")
                    .withTeamId("team-1")
                    .withUserId("alice");
            CheckInConfigModel noDays = CheckInConfigModel.organizationDefault("org-1")
                    .withTeamId("team-1")
                    .withExcludedDays(EnumSet.allOf(DayOfWeek.class));

            StepVerifier.create(configService.create(twoScopes))
                    .expectErrorSatisfies(error -> assertThat(((CheckInValidationException) error).getFieldErrors())
                            .containsKey("scope"))
                    .verify();
            StepVerifier.create(configService.create(noDays))
                    .expectErrorSatisfies(error -> assertThat(((CheckInValidationException) error).getFieldErrors())
                            .containsKey("excluded_days"))
                    .verify();
        }

        @Test
        @DisplayName("should reject a second config for the same scope")
        void shouldRejectDuplicateScope() {
            StepVerifier.create(configService.create(CheckInConfigModel.organizationDefault("org-1").withIntervalHours(5)))
                    .expectErrorSatisfies(error -> assertEquals(
                            TaskPulseCheckInErrorCodes.CONFIG_SCOPE_CONFLICT.getErrorCode(),
                            ((CheckInConflictException) error).getErrorCode()))
                    .verify();
        }
    }

    // ========================================================================
    // PATCH AND DELETE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Patch and Delete")
    class PatchAndDeleteTests {

        @Test
        @DisplayName("should change only the fields present in the patch")
        void shouldPatchPresentFields() {
            // Given
            clock.advance(Duration.ofMinutes(5));
            CheckInConfigPatch patch = CheckInConfigPatch.builder()
                    .maxDailyCheckins(6)
                    .excludedDays(EnumSet.of(DayOfWeek.SUNDAY))
                    .build();

            // When
            ICheckInConfig updated = configService.patch(orgDefault.getId(), patch).block();

            // Then
            assertEquals(6, updated.getMaxDailyCheckins());
            assertEquals(EnumSet.of(DayOfWeek.SUNDAY), updated.getExcludedDays());
            assertEquals(orgDefault.getIntervalHours(), updated.getIntervalHours());
            assertEquals(NOW, updated.getCreatedAt());
            assertEquals(NOW.plus(Duration.ofMinutes(5)), updated.getUpdatedAt());
        }

        @Test
        @DisplayName("should validate the patched result")
        void shouldValidatePatchedResult() {
            StepVerifier.create(configService.patch(orgDefault.getId(), CheckInConfigPatch.builder().workStartHour(20).build()))
                    .expectErrorSatisfies(error -> assertThat(((CheckInValidationException) error).getFieldErrors())
                            .containsKey("work_end_hour"))
                    .verify();
            assertEquals(9, configService.get(orgDefault.getId()).block().getWorkStartHour());
        }

        @Test
        @DisplayName("should reset a custom response window to the engine default")
        void shouldResetResponseWindow() {
            // Given
            configService.patch(orgDefault.getId(), CheckInConfigPatch.builder().responseWindowMinutes(45).build()).block();

            // When
            ICheckInConfig reset = configService.patch(orgDefault.getId(),
                    CheckInConfigPatch.builder().resetResponseWindow(true).build()).block();

            // Then
            assertNull(reset.getResponseWindowMinutes());
            StepVerifier.create(configService.patch(orgDefault.getId(), CheckInConfigPatch.builder()
                            .resetResponseWindow(true)
                            .responseWindowMinutes(30)
                            .build()))
                    .expectErrorSatisfies(error -> assertThat(((CheckInValidationException) error).getFieldErrors())
                            .containsKey("response_window_minutes"))
                    .verify();
            assertNull(configService.get(orgDefault.getId()).block().getResponseWindowMinutes());
        }

        @Test
        @DisplayName("should refuse to delete the organization default")
        void shouldKeepOrganizationDefault() {
            StepVerifier.create(configService.delete(orgDefault.getId()))
                    .expectErrorSatisfies(error -> assertEquals(
                            TaskPulseCheckInErrorCodes.CONFIG_DEFAULT_REQUIRED.getErrorCode(),
                            ((CheckInConflictException) error).getErrorCode()))
                    .verify();
        }

        @Test
        @DisplayName("should delete a narrower config and free its scope")
        void shouldDeleteNarrowerConfig() {
            // Given
            ICheckInConfig team = configService.create(CheckInConfigModel.organizationDefault("org-1").withTeamId("team-1")).block();

            // When
            configService.delete(team.getId()).block();

            // Then
            StepVerifier.create(configService.get(team.getId()))
                    .expectError(CheckInNotFoundException.class)
                    .verify();
            List<ICheckInConfig> remaining = configService.list("org-1").collectList().block();
            assertEquals(1, remaining.size());
            assertNotNull(configService.create(CheckInConfigModel.organizationDefault("org-1").withTeamId("team-1")).block());
        }
    }
}
