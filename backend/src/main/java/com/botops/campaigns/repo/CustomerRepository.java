package com.botops.campaigns.repo;

import com.botops.campaigns.model.CustomerEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CustomerRepository extends JpaRepository<CustomerEntity, UUID> {
    List<CustomerEntity> findByTenantIdOrderByCreatedAtAsc(String tenantId, Pageable pageable);
}
