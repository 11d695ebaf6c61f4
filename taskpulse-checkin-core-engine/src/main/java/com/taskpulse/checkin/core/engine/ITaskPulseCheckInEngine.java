package com.taskpulse.checkin.core.engine;

import com.taskpulse.checkin.core.engine.audit.ITaskPulseCheckInAuditService;
import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigResolver;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigService;
import com.taskpulse.checkin.core.engine.escalation.ITaskPulseCheckInEscalationService;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService;
import com.taskpulse.checkin.core.engine.scheduler.ITaskPulseCheckInScheduler;
import com.taskpulse.checkin.core.engine.statistics.ITaskPulseCheckInStatisticsService;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.engine.timeout.ITaskPulseCheckInExpirySweeper;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import reactor.core.publisher.Mono;

/**
 * Entry point to a wired check-in engine.
 */
public interface ITaskPulseCheckInEngine {

    /**
     * Verifies that every organization of the directory has a default config, then starts
     * the scheduler and the expiry sweep. Errors with
     * {@link com.taskpulse.checkin.core.exception.CheckInPolicyException} when a default is missing;
     * nothing is started in that case.
     */
    Mono<Void> start();

    void stop();

    boolean isRunning();

    CheckInEngineSettings getSettings();

    ICheckInSubjectDirectory getDirectory();

    ICheckInStore getCheckInStore();

    ITaskPulseCheckInConfigResolver getConfigResolver();

    ITaskPulseCheckInConfigService getConfigService();

    ITaskPulseCheckInLifecycleService getLifecycleService();

    ITaskPulseCheckInEscalationService getEscalationService();

    ITaskPulseCheckInScheduler getScheduler();

    ITaskPulseCheckInExpirySweeper getExpirySweeper();

    ITaskPulseCheckInStatisticsService getStatisticsService();

    ITaskPulseCheckInAuditService getAuditService();

    ICheckInNotificationService getNotificationService();
}
