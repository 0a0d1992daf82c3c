package com.botops.scheduler.service;

import com.botops.scheduler.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Restores every tenant's alarm from persisted jobs after a restart.
 */
@Component
public class SchedulerRecovery implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchedulerRecovery.class);

    private final JobStore store;
    private final SchedulerService schedulerService;

    public SchedulerRecovery(JobStore store, SchedulerService schedulerService) {
        this.store = store;
        this.schedulerService = schedulerService;
    }

    @Override
    public void run(ApplicationArguments args) {
        Set<String> tenants = store.tenants();
        for (String tenantId : tenants) {
            schedulerService.forTenant(tenantId).rearmFromStorage();
        }
        log.info("Scheduler recovery re-armed alarms for {} tenant(s)", tenants.size());
    }
}
