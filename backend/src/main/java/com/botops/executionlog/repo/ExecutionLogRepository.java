package com.botops.executionlog.repo;

import com.botops.executionlog.model.ExecutionLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ExecutionLogRepository extends JpaRepository<ExecutionLogEntity, UUID> {
    List<ExecutionLogEntity> findByJobIdOrderByExecutedAtDesc(String jobId);

    List<ExecutionLogEntity> findByTenantIdOrderByExecutedAtDesc(String tenantId, Pageable pageable);

    long countByJobId(String jobId);
}
