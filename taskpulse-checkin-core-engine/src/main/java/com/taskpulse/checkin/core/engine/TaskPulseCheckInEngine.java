package com.taskpulse.checkin.core.engine;

import com.taskpulse.checkin.core.engine.audit.ITaskPulseCheckInAuditService;
import com.taskpulse.checkin.core.engine.audit.impl.InMemoryCheckInAuditService;
import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.config.ICheckInConfigStore;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigResolver;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigService;
import com.taskpulse.checkin.core.engine.config.impl.InMemoryCheckInConfigStore;
import com.taskpulse.checkin.core.engine.config.impl.TaskPulseCheckInConfigResolverImpl;
import com.taskpulse.checkin.core.engine.config.impl.TaskPulseCheckInConfigServiceImpl;
import com.taskpulse.checkin.core.engine.directory.impl.InMemoryCheckInSubjectDirectory;
import com.taskpulse.checkin.core.engine.enrichment.CheckInEnrichmentAdapter;
import com.taskpulse.checkin.core.engine.enrichment.impl.NoOpEnrichmentGateway;
import com.taskpulse.checkin.core.engine.escalation.ITaskPulseCheckInEscalationService;
import com.taskpulse.checkin.core.engine.escalation.impl.TaskPulseCheckInEscalationServiceImpl;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.lifecycle.impl.TaskPulseCheckInLifecycleServiceImpl;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService;
import com.taskpulse.checkin.core.engine.notification.impl.ConsoleNotificationService;
import com.taskpulse.checkin.core.engine.scheduler.ITaskPulseCheckInScheduler;
import com.taskpulse.checkin.core.engine.scheduler.impl.TaskPulseCheckInSchedulerImpl;
import com.taskpulse.checkin.core.engine.statistics.ITaskPulseCheckInStatisticsService;
import com.taskpulse.checkin.core.engine.statistics.impl.TaskPulseCheckInStatisticsServiceImpl;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.engine.store.impl.InMemoryCheckInStore;
import com.taskpulse.checkin.core.engine.timeout.ITaskPulseCheckInExpirySweeper;
import com.taskpulse.checkin.core.engine.timeout.impl.TaskPulseCheckInExpirySweeperImpl;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentGateway;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Wires the check-in services around one store, one directory and one clock.
 *
 * <pre>{@code
 * ITaskPulseCheckInEngine engine = TaskPulseCheckInEngine.builder()
 *         .directory(directory)
 *         .enrichmentGateway(gateway)
 *         .build();
 * engine.start().block();
 * }</pre>
 *
 * <p>Every collaborator is optional: in-memory stores, an empty directory, the no-op
 * enrichment gateway, console notifications, default settings and the UTC system clock
 * are used for the ones not given.</p>
 */
@Slf4j
@Getter
public class TaskPulseCheckInEngine implements ITaskPulseCheckInEngine {

    private final CheckInEngineSettings settings;
    private final ICheckInSubjectDirectory directory;
    private final ICheckInStore checkInStore;
    private final ITaskPulseCheckInConfigResolver configResolver;
    private final ITaskPulseCheckInConfigService configService;
    private final ITaskPulseCheckInLifecycleService lifecycleService;
    private final ITaskPulseCheckInEscalationService escalationService;
    private final ITaskPulseCheckInScheduler scheduler;
    private final ITaskPulseCheckInExpirySweeper expirySweeper;
    private final ITaskPulseCheckInStatisticsService statisticsService;
    private final ITaskPulseCheckInAuditService auditService;
    private final ICheckInNotificationService notificationService;

    @Builder
    private TaskPulseCheckInEngine(CheckInEngineSettings settings,
                                   ICheckInSubjectDirectory directory,
                                   ICheckInStore checkInStore,
                                   ICheckInConfigStore configStore,
                                   IEnrichmentGateway enrichmentGateway,
                                   ITaskPulseCheckInAuditService auditService,
                                   ICheckInNotificationService notificationService,
                                   Clock clock) {
        CheckInEngineSettings effectiveSettings = settings != null ? settings : CheckInEngineSettings.defaults();
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
        ICheckInConfigStore effectiveConfigStore = configStore != null ? configStore : new InMemoryCheckInConfigStore();

        this.settings = effectiveSettings;
        this.directory = directory != null ? directory : InMemoryCheckInSubjectDirectory.create();
        this.checkInStore = checkInStore != null ? checkInStore : new InMemoryCheckInStore();
        this.auditService = auditService != null ? auditService : new InMemoryCheckInAuditService();
        this.notificationService = notificationService != null ? notificationService : new ConsoleNotificationService();

        this.configResolver = new TaskPulseCheckInConfigResolverImpl(effectiveConfigStore);
        this.configService = new TaskPulseCheckInConfigServiceImpl(effectiveConfigStore, effectiveClock);

        CheckInEnrichmentAdapter enrichmentAdapter = new CheckInEnrichmentAdapter(
                enrichmentGateway != null ? enrichmentGateway : new NoOpEnrichmentGateway(),
                effectiveSettings.getEnrichmentTimeout());

        this.lifecycleService = new TaskPulseCheckInLifecycleServiceImpl(this.checkInStore, configResolver, this.directory,
                enrichmentAdapter, this.auditService, this.notificationService, effectiveSettings, effectiveClock);
        this.escalationService = TaskPulseCheckInEscalationServiceImpl.register(lifecycleService, this.checkInStore,
                configResolver, this.directory, this.notificationService, effectiveClock);
        this.scheduler = new TaskPulseCheckInSchedulerImpl(this.directory, configResolver, this.checkInStore,
                lifecycleService, effectiveSettings, effectiveClock);
        this.expirySweeper = new TaskPulseCheckInExpirySweeperImpl(this.checkInStore, lifecycleService,
                effectiveSettings, effectiveClock);
        this.statisticsService = new TaskPulseCheckInStatisticsServiceImpl(this.checkInStore, this.directory, effectiveClock);
    }

    @Override
    public Mono<Void> start() {
        return configResolver.verifyOrganizationDefaults(directory.listOrganizations())
                .doOnError(e -> log.error("Check-in engine cannot start: {}", e.getMessage()))
                .then(Mono.fromRunnable(() -> {
                    scheduler.start();
                    expirySweeper.start();
                    log.info("Check-in engine started");
                }));
    }

    @Override
    public void stop() {
        scheduler.stop();
        expirySweeper.stop();
        log.info("Check-in engine stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning() && expirySweeper.isRunning();
    }
}
