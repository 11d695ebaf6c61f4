package com.taskpulse.checkin.core.engine.rest;

import com.taskpulse.checkin.core.engine.ITaskPulseCheckInEngine;
import com.taskpulse.checkin.core.engine.TaskPulseCheckInEngine;
import com.taskpulse.checkin.core.engine.audit.ITaskPulseCheckInAuditService;
import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigService;
import com.taskpulse.checkin.core.engine.directory.impl.InMemoryCheckInSubjectDirectory;
import com.taskpulse.checkin.core.engine.enrichment.impl.HttpEnrichmentGateway;
import com.taskpulse.checkin.core.engine.enrichment.impl.NoOpEnrichmentGateway;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService;
import com.taskpulse.checkin.core.engine.statistics.ITaskPulseCheckInStatisticsService;
import com.taskpulse.checkin.core.engine.validation.CheckInRequestValidator;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Spring configuration for the check-in engine and its REST controllers.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * @SpringBootApplication
 * @Import(CheckInApiConfiguration.class)
 * public class MyApplication {
 *     @Bean
 *     public ICheckInSubjectDirectory checkInSubjectDirectory() {
 *         return new MyTaskDirectory();
 *     }
 * }
 * }</pre>
 *
 * <p>Engine settings are read from {@code taskpulse.checkin.*} properties, with the defaults in
 * {@code taskpulse-checkin.properties}. When the application defines no
 * {@link ICheckInSubjectDirectory}, an empty in-memory directory is used. When it defines no
 * {@link IEnrichmentGateway}, the HTTP gateway is used if
 * {@code taskpulse.checkin.enrichment-base-url} is set and the no-op gateway otherwise.</p>
 *
 * <h2>Endpoints Enabled</h2>
 * <ul>
 *   <li>/api/v1/checkins/* - Check-in lifecycle, statistics and manager feed</li>
 *   <li>/api/v1/checkins/config/* - Check-in config administration</li>
 * </ul>
 */
@Slf4j
@Configuration
@PropertySource("classpath:taskpulse-checkin.properties")
public class CheckInApiConfiguration {

    static final String AUTO_START = CheckInEngineSettings.PROPERTY_PREFIX + "auto-start";

    @Bean
    public CheckInEngineSettings checkInEngineSettings(Environment environment) {
        return settingsFrom(environment);
    }

    /**
     * Provides the engine. It is started on creation unless {@code taskpulse.checkin.auto-start}
     * is false, so a missing organization default fails the application context.
     */
    @Bean(destroyMethod = "stop")
    public ITaskPulseCheckInEngine checkInEngine(CheckInEngineSettings settings,
                                                 Environment environment,
                                                 ObjectProvider<ICheckInSubjectDirectory> directory,
                                                 ObjectProvider<IEnrichmentGateway> enrichmentGateway,
                                                 ObjectProvider<ICheckInNotificationService> notificationService,
                                                 ObjectProvider<Clock> clock) {
        ITaskPulseCheckInEngine engine = TaskPulseCheckInEngine.builder()
                .settings(settings)
                .directory(directory.getIfAvailable(InMemoryCheckInSubjectDirectory::create))
                .enrichmentGateway(enrichmentGateway.getIfAvailable(() -> defaultGateway(settings)))
                .notificationService(notificationService.getIfAvailable())
                .clock(clock.getIfAvailable(Clock::systemUTC))
                .build();
        if (environment.getProperty(AUTO_START, Boolean.class, Boolean.TRUE)) {
            engine.start().block();
        }
        return engine;
    }

    @Bean
    public ITaskPulseCheckInLifecycleService checkInLifecycleService(ITaskPulseCheckInEngine engine) {
        return engine.getLifecycleService();
    }

    @Bean
    public ITaskPulseCheckInConfigService checkInConfigService(ITaskPulseCheckInEngine engine) {
        return engine.getConfigService();
    }

    @Bean
    public ITaskPulseCheckInStatisticsService checkInStatisticsService(ITaskPulseCheckInEngine engine) {
        return engine.getStatisticsService();
    }

    @Bean
    public ITaskPulseCheckInAuditService checkInAuditService(ITaskPulseCheckInEngine engine) {
        return engine.getAuditService();
    }

    @Bean
    public CheckInRequestValidator checkInRequestValidator() {
        return CheckInRequestValidator.create();
    }

    @Bean
    public CheckInController checkInController(ITaskPulseCheckInLifecycleService lifecycleService,
                                               ITaskPulseCheckInStatisticsService statisticsService,
                                               ITaskPulseCheckInAuditService auditService,
                                               CheckInRequestValidator requestValidator,
                                               CheckInEngineSettings settings) {
        return new CheckInController(lifecycleService, statisticsService, auditService, requestValidator, settings);
    }

    @Bean
    public CheckInConfigController checkInConfigController(ITaskPulseCheckInConfigService configService,
                                                           CheckInRequestValidator requestValidator) {
        return new CheckInConfigController(configService, requestValidator);
    }

    // ========================================================================
    // SETTINGS BINDING
    // ========================================================================

    static CheckInEngineSettings settingsFrom(Environment environment) {
        CheckInEngineSettings defaults = CheckInEngineSettings.defaults();
        return CheckInEngineSettings.builder()
                .schedulerInterval(duration(environment, "scheduler-interval", defaults.getSchedulerInterval()))
                .expirySweepInterval(duration(environment, "expiry-sweep-interval", defaults.getExpirySweepInterval()))
                .defaultResponseWindow(duration(environment, "default-response-window", defaults.getDefaultResponseWindow()))
                .enrichmentTimeout(duration(environment, "enrichment-timeout", defaults.getEnrichmentTimeout()))
                .defaultZone(ZoneId.of(environment.getProperty(
                        CheckInEngineSettings.PROPERTY_PREFIX + "default-zone", defaults.getDefaultZone().getId())))
                .defaultPageLimit(environment.getProperty(
                        CheckInEngineSettings.PROPERTY_PREFIX + "default-page-limit", Integer.class, defaults.getDefaultPageLimit()))
                .maxPageLimit(environment.getProperty(
                        CheckInEngineSettings.PROPERTY_PREFIX + "max-page-limit", Integer.class, defaults.getMaxPageLimit()))
                .enrichmentBaseUrl(environment.getProperty(CheckInEngineSettings.PROPERTY_PREFIX + "enrichment-base-url"))
                .build();
    }

    private static Duration duration(Environment environment, String key, Duration fallback) {
        String value = environment.getProperty(CheckInEngineSettings.PROPERTY_PREFIX + key);
        return value == null || value.isBlank() ? fallback : Duration.parse(value.trim());
    }

    private static IEnrichmentGateway defaultGateway(CheckInEngineSettings settings) {
        String baseUrl = settings.getEnrichmentBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("No enrichment gateway configured, sentiment and suggestions are disabled");
            return new NoOpEnrichmentGateway();
        }
        log.info("Using HTTP enrichment gateway: baseUrl={}", baseUrl);
        return new HttpEnrichmentGateway(baseUrl);
    }
}
