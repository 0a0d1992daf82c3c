package com.botops.scheduler.service;

import com.botops.config.AppProperties;
import com.botops.scheduler.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Fires tenant alarms. Each claimed tenant's timer callback runs on the alarm executor, so
 * different tenants proceed in parallel.
 */
@Component
@ConditionalOnProperty(value = "app.scheduler.dispatcher.enabled", havingValue = "true", matchIfMissing = true)
public class AlarmDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlarmDispatcher.class);

    private final JobStore store;
    private final SchedulerService schedulerService;
    private final TaskExecutor alarmExecutor;
    private final Clock clock;
    private final int maxTenantsPerPoll;

    public AlarmDispatcher(JobStore store,
                           SchedulerService schedulerService,
                           @Qualifier("alarmExecutor") TaskExecutor alarmExecutor,
                           Clock clock,
                           AppProperties appProperties) {
        this.store = store;
        this.schedulerService = schedulerService;
        this.alarmExecutor = alarmExecutor;
        this.clock = clock;
        this.maxTenantsPerPoll = Math.max(1, appProperties.scheduler().dispatcher().maxTenantsPerPoll());
    }

    @Scheduled(fixedDelayString = "${app.scheduler.dispatcher.delay-ms:500}")
    public void fireDueAlarms() {
        long now = clock.millis();
        List<String> claimed = store.claimDueAlarms(now, maxTenantsPerPoll);

        for (String tenantId : claimed) {
            try {
                alarmExecutor.execute(() -> schedulerService.forTenant(tenantId).onTimer());
            } catch (TaskRejectedException exception) {
                log.warn("Alarm executor saturated; deferring tenant {}", tenantId);
                store.setAlarm(tenantId, now);
            }
        }
    }
}
