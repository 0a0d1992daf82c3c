package com.botops.campaigns.repo;

import com.botops.campaigns.model.PendingRecipient;
import com.botops.campaigns.model.RecipientEntity;
import com.botops.campaigns.model.RecipientStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface RecipientRepository extends JpaRepository<RecipientEntity, UUID> {

    @Query("""
            select new com.botops.campaigns.model.PendingRecipient(r.id, r.customerId, c.externalId, c.provider)
            from RecipientEntity r
            left join CustomerEntity c on c.id = r.customerId
            where r.campaignId = :campaignId and r.status = :status
            order by r.createdAt asc, r.id asc
            """)
    List<PendingRecipient> findBatch(@Param("campaignId") UUID campaignId,
                                     @Param("status") RecipientStatus status,
                                     Pageable pageable);

    long countByCampaignIdAndStatus(UUID campaignId, RecipientStatus status);

    long countByCampaignId(UUID campaignId);

    List<RecipientEntity> findByCampaignIdOrderByCreatedAtDesc(UUID campaignId, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update RecipientEntity r set r.status = :status, r.errorCode = :errorCode, r.updatedAt = :now where r.id = :id")
    int updateStatus(@Param("id") UUID id,
                     @Param("status") RecipientStatus status,
                     @Param("errorCode") Integer errorCode,
                     @Param("now") Instant now);
}
