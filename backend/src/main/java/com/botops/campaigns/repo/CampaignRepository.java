package com.botops.campaigns.repo;

import com.botops.campaigns.model.CampaignEntity;
import com.botops.campaigns.model.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CampaignRepository extends JpaRepository<CampaignEntity, UUID> {
    Optional<CampaignEntity> findByIdAndTenantId(UUID id, String tenantId);

    List<CampaignEntity> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update CampaignEntity c set c.totalSent = c.totalSent + 1, c.updatedAt = :now where c.id = :id")
    int incrementSent(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update CampaignEntity c set c.totalFailed = c.totalFailed + 1, c.updatedAt = :now where c.id = :id")
    int incrementFailed(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update CampaignEntity c set c.status = :status, c.updatedAt = :now where c.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") CampaignStatus status, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update CampaignEntity c set c.status = :status, c.schedulerJobId = null, c.updatedAt = :now where c.id = :id")
    int updateStatusAndClearJob(@Param("id") UUID id, @Param("status") CampaignStatus status, @Param("now") Instant now);
}
