package com.botops.executionlog.service;

import com.botops.executionlog.dto.ExecutionLogResponse;
import com.botops.executionlog.model.ExecutionLogEntity;
import com.botops.executionlog.model.ExecutionOutcome;
import com.botops.executionlog.repo.ExecutionLogRepository;
import com.botops.scheduler.model.Job;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Append-only audit trail, one row per terminal execution outcome.
 */
@Service
public class ExecutionLogService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLogService.class);
    private static final int MAX_RECENT = 500;

    private final ExecutionLogRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionLogService(ExecutionLogRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public void recordSuccess(Job job, Object response) {
        save(job, ExecutionOutcome.SUCCESS, null, response);
    }

    @Transactional
    public void recordFailure(Job job, String error) {
        save(job, ExecutionOutcome.FAILURE, error, null);
    }

    @Transactional(readOnly = true)
    public List<ExecutionLogResponse> findByJobId(String jobId) {
        return repository.findByJobIdOrderByExecutedAtDesc(jobId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ExecutionLogResponse> findRecent(String tenantId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT));
        return repository.findByTenantIdOrderByExecutedAtDesc(tenantId, PageRequest.of(0, size))
                .stream()
                .map(this::toResponse)
                .toList();
    }

    private void save(Job job, ExecutionOutcome outcome, String error, Object response) {
        ExecutionLogEntity entity = new ExecutionLogEntity();
        entity.setJobId(job.id());
        entity.setTenantId(job.tenantId());
        entity.setChannel(job.channel() == null ? "unknown" : job.channel().id());
        entity.setOutcome(outcome);
        entity.setExecutedAt(clock.instant());
        entity.setError(error);
        entity.setRequestPayload(write(job.payload()));
        entity.setResponsePayload(response == null ? null : write(response));
        repository.save(entity);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception exception) {
            log.warn("Unable to serialize log payload: {}", exception.getMessage());
            return null;
        }
    }

    private JsonNode read(String value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.readTree(value);
        } catch (Exception exception) {
            return objectMapper.getNodeFactory().textNode(value);
        }
    }

    private ExecutionLogResponse toResponse(ExecutionLogEntity entity) {
        return new ExecutionLogResponse(
                entity.getId(),
                entity.getJobId(),
                entity.getTenantId(),
                entity.getChannel(),
                entity.getOutcome(),
                entity.getExecutedAt(),
                entity.getError(),
                read(entity.getRequestPayload()),
                read(entity.getResponsePayload())
        );
    }
}
