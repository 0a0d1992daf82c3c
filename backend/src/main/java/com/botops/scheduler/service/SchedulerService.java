package com.botops.scheduler.service;

import com.botops.common.exception.BadRequestException;
import com.botops.config.AppProperties;
import com.botops.delivery.service.MessageSenderRegistry;
import com.botops.executionlog.service.ExecutionLogService;
import com.botops.scheduler.dto.ScheduleJobRequest;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.JobStatus;
import com.botops.scheduler.model.Recurrence;
import com.botops.scheduler.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SchedulerService {

    private final JobStore store;
    private final MessageSenderRegistry registry;
    private final ExecutionLogService executionLogService;
    private final RecurrenceCalculator recurrenceCalculator;
    private final AppProperties appProperties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final String nodeId = UUID.randomUUID().toString();
    private final Map<String, TenantScheduler> tenants = new ConcurrentHashMap<>();

    public SchedulerService(JobStore store,
                            MessageSenderRegistry registry,
                            ExecutionLogService executionLogService,
                            RecurrenceCalculator recurrenceCalculator,
                            AppProperties appProperties,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.store = store;
        this.registry = registry;
        this.executionLogService = executionLogService;
        this.recurrenceCalculator = recurrenceCalculator;
        this.appProperties = appProperties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the tenant's scheduler, creating it. Only callers that know the tenant has jobs
     * (submission, alarm dispatch, recovery) should come through here.
     */
    public TenantScheduler forTenant(String tenantId) {
        return tenants.computeIfAbsent(tenantId, id -> new TenantScheduler(
                id,
                nodeId,
                store,
                registry,
                executionLogService,
                recurrenceCalculator,
                appProperties.scheduler(),
                clock,
                meterRegistry
        ));
    }

    public Job submit(ScheduleJobRequest request) {
        validateRecurrence(request.recurrence());

        long scheduledFor;
        if (request.scheduledFor() != null) {
            scheduledFor = request.scheduledFor();
        } else if (request.delayMs() != null) {
            scheduledFor = clock.millis() + request.delayMs();
        } else {
            scheduledFor = clock.millis();
        }

        String id = request.id() == null || request.id().isBlank()
                ? UUID.randomUUID().toString()
                : request.id().trim();
        int maxAttempts = request.maxAttempts() == null
                ? appProperties.scheduler().retry().maxAttempts()
                : request.maxAttempts();

        Job job = new Job(
                id,
                request.tenantId().trim(),
                scheduledFor,
                request.channel(),
                request.payload(),
                JobStatus.PENDING,
                0,
                maxAttempts,
                request.recurrence(),
                request.campaignId(),
                request.metadata()
        );
        forTenant(job.tenantId()).schedule(job);
        return job;
    }

    public boolean cancel(String tenantId, String jobId) {
        if (!tenants.containsKey(tenantId) && store.get(tenantId, jobId).isEmpty()) {
            return false;
        }
        return forTenant(tenantId).cancel(jobId);
    }

    public List<Job> pendingJobs(String tenantId) {
        TenantScheduler scheduler = tenants.get(tenantId);
        if (scheduler != null) {
            return scheduler.pendingJobs();
        }
        return store.list(tenantId)
                .stream()
                .sorted(Comparator.comparingLong(Job::scheduledFor))
                .toList();
    }

    int activeTenantCount() {
        return tenants.size();
    }

    private void validateRecurrence(Recurrence recurrence) {
        if (recurrence == null) {
            return;
        }
        if (recurrence.type() == null) {
            throw new BadRequestException("Recurrence type is required");
        }
        if (recurrence.time() != null && !recurrence.time().isBlank()) {
            try {
                RecurrenceCalculator.parseTime(recurrence.time());
            } catch (IllegalArgumentException exception) {
                throw new BadRequestException(exception.getMessage());
            }
        }
        if (recurrence.days() != null && recurrence.days().stream().anyMatch(day -> day == null || day < 0 || day > 6)) {
            throw new BadRequestException("Recurrence days must be between 0 and 6");
        }
    }
}
