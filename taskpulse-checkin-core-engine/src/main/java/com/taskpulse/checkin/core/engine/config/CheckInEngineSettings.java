package com.taskpulse.checkin.core.engine.config;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Engine-wide settings. Per-scope policy lives in check-in config records; these
 * values cover what a record does not say.
 */
@Data
@Builder(toBuilder = true)
public class CheckInEngineSettings {

    public static final String PROPERTY_PREFIX = "taskpulse.checkin.";

    /**
     * How often the scheduler sweeps active assignments.
     */
    @Builder.Default
    private final Duration schedulerInterval = Duration.ofMinutes(5);

    /**
     * How often pending check-ins are checked for expiry.
     */
    @Builder.Default
    private final Duration expirySweepInterval = Duration.ofMinutes(1);

    /**
     * Response window used when the effective config does not set one.
     */
    @Builder.Default
    private final Duration defaultResponseWindow = Duration.ofMinutes(120);

    /**
     * Upper bound on a single enrichment call.
     */
    @Builder.Default
    private final Duration enrichmentTimeout = Duration.ofSeconds(3);

    /**
     * Zone used for work hours when a config does not respect the subject zone,
     * or the subject zone is unknown.
     */
    @Builder.Default
    private final ZoneId defaultZone = ZoneId.of("UTC");

    @Builder.Default
    private final int defaultPageLimit = 50;

    @Builder.Default
    private final int maxPageLimit = 200;

    /**
     * Base URL of the HTTP enrichment gateway. When blank the no-op gateway is used.
     */
    private final String enrichmentBaseUrl;

    public static CheckInEngineSettings defaults() {
        return CheckInEngineSettings.builder().build();
    }

    public Duration responseWindow(Integer configuredMinutes) {
        return configuredMinutes != null ? Duration.ofMinutes(configuredMinutes) : defaultResponseWindow;
    }

    public int clampLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultPageLimit;
        }
        return Math.min(requested, maxPageLimit);
    }
}
