package com.botops.campaigns.repo;

import com.botops.campaigns.model.BotEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface BotRepository extends JpaRepository<BotEntity, UUID> {
}
