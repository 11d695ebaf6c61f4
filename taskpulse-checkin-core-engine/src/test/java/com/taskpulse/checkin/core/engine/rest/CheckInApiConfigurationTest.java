package com.taskpulse.checkin.core.engine.rest;

import com.taskpulse.checkin.core.engine.ITaskPulseCheckInEngine;
import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.exception.CheckInPolicyException;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.time.ZoneId;

import static com.taskpulse.checkin.core.engine.support.CheckInTestFixtures.MONDAY_0800;
import static com.taskpulse.checkin.core.engine.support.CheckInTestFixtures.directory;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CheckInApiConfiguration}.
 */
class CheckInApiConfigurationTest {

    @Test
    @DisplayName("should bind settings from taskpulse.checkin properties")
    void shouldBindSettings() {
        // Given
        MockEnvironment environment = new MockEnvironment()
                .withProperty("taskpulse.checkin.scheduler-interval", "PT10M")
                .withProperty("taskpulse.checkin.default-response-window", " PT45M ")
                .withProperty("taskpulse.checkin.default-zone", "Europe/Berlin")
                .withProperty("taskpulse.checkin.max-page-limit", "500");

        // When
        CheckInEngineSettings settings = CheckInApiConfiguration.settingsFrom(environment);

        // Then
        assertEquals(Duration.ofMinutes(10), settings.getSchedulerInterval());
        assertEquals(Duration.ofMinutes(45), settings.getDefaultResponseWindow());
        assertEquals(ZoneId.of("Europe/Berlin"), settings.getDefaultZone());
        assertEquals(500, settings.getMaxPageLimit());
        assertEquals(CheckInEngineSettings.defaults().getExpirySweepInterval(), settings.getExpirySweepInterval());
        assertNull(settings.getEnrichmentBaseUrl());
    }

    @Test
    @DisplayName("should wire the controllers without starting when auto-start is off")
    void shouldWireWithoutStarting() {
        MockEnvironment environment = new MockEnvironment().withProperty(CheckInApiConfiguration.AUTO_START, "false");

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.setEnvironment(environment);
            context.register(CheckInApiConfiguration.class);
            context.refresh();

            assertNotNull(context.getBean(CheckInController.class));
            assertNotNull(context.getBean(CheckInConfigController.class));
            assertFalse(context.getBean(ITaskPulseCheckInEngine.class).isRunning());
        }
    }

    @Test
    @DisplayName("should fail the context when an organization has no default config")
    void shouldFailWithoutOrganizationDefault() {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.registerBean(ICheckInSubjectDirectory.class, () -> directory(MONDAY_0800));
        context.register(CheckInApiConfiguration.class);

        assertThatThrownBy(context::refresh).hasRootCauseInstanceOf(CheckInPolicyException.class);
    }
}
