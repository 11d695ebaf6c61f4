package com.taskpulse.checkin.integration.models.config;

import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckInConfigModel Tests")
class CheckInConfigModelTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("should carry documented defaults on an organization default")
        void shouldCarryDocumentedDefaults() {
            // When
            CheckInConfigModel config = CheckInConfigModel.organizationDefault("org-1");

            // Then
            assertEquals("org-1", config.getOrgId());
            assertEquals(3.0, config.getIntervalHours());
            assertTrue(config.isEnabled());
            assertEquals(0.3, config.getSilentModeThreshold());
            assertEquals(4, config.getMaxDailyCheckins());
            assertEquals(9, config.getWorkStartHour());
            assertEquals(18, config.getWorkEndHour());
            assertTrue(config.isRespectTimezone());
            assertEquals(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), config.getExcludedDays());
            assertEquals(2, config.getAutoEscalateAfterMissed());
            assertTrue(config.isEscalateToManager());
            assertTrue(config.isAiSuggestionsEnabled());
            assertTrue(config.isAiSentimentAnalysis());
            assertNull(config.getResponseWindowMinutes());
        }
    }

    @Nested
    @DisplayName("Scope")
    class ScopeTests {

        @Test
        @DisplayName("should report the most specific identifier as scope")
        void shouldReportScope() {
            CheckInConfigModel org = CheckInConfigModel.organizationDefault("org-1");

            assertEquals(CheckInConfigScope.ORGANIZATION, org.getScope());
            assertEquals(CheckInConfigScope.TEAM, org.withTeamId("team-1").getScope());
            assertEquals(CheckInConfigScope.USER, org.withUserId("user-1").getScope());
            assertEquals(CheckInConfigScope.TASK, org.withTaskId("task-1").getScope());
        }

        @Test
        @DisplayName("should treat excluded weekdays as ineligible")
        void shouldTreatExcludedDaysAsIneligible() {
            CheckInConfigModel config = CheckInConfigModel.organizationDefault("org-1");

            assertFalse(config.isEligibleDay(DayOfWeek.SUNDAY));
            assertTrue(config.isEligibleDay(DayOfWeek.MONDAY));
        }
    }
}
