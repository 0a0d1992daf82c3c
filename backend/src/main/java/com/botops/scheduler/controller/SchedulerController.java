package com.botops.scheduler.controller;

import com.botops.executionlog.dto.ExecutionLogResponse;
import com.botops.executionlog.service.ExecutionLogService;
import com.botops.scheduler.dto.CancelJobRequest;
import com.botops.scheduler.dto.CancelJobResponse;
import com.botops.scheduler.dto.ScheduleJobRequest;
import com.botops.scheduler.dto.ScheduleJobResponse;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.service.SchedulerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/remarketing")
@Validated
public class SchedulerController {

    private final SchedulerService schedulerService;
    private final ExecutionLogService executionLogService;

    public SchedulerController(SchedulerService schedulerService, ExecutionLogService executionLogService) {
        this.schedulerService = schedulerService;
        this.executionLogService = executionLogService;
    }

    @PostMapping("/schedule")
    public ScheduleJobResponse schedule(@RequestBody @Valid ScheduleJobRequest request) {
        Job job = schedulerService.submit(request);
        return new ScheduleJobResponse(true, job.id(), job.scheduledFor());
    }

    @PostMapping("/cancel")
    public CancelJobResponse cancel(@RequestBody @Valid CancelJobRequest request) {
        boolean removed = schedulerService.cancel(request.tenantId(), request.jobId());
        return new CancelJobResponse(true, removed);
    }

    @GetMapping("/jobs")
    public List<Job> pendingJobs(@RequestParam("tenantId") @NotBlank String tenantId) {
        return schedulerService.pendingJobs(tenantId);
    }

    @GetMapping("/logs")
    public List<ExecutionLogResponse> recentLogs(@RequestParam("tenantId") @NotBlank String tenantId,
                                                 @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(500) int limit) {
        return executionLogService.findRecent(tenantId, limit);
    }

    @GetMapping("/logs/job/{jobId}")
    public List<ExecutionLogResponse> logsForJob(@PathVariable String jobId) {
        return executionLogService.findByJobId(jobId);
    }
}
