package com.botops.campaigns.service;

import com.botops.campaigns.dto.CampaignResponse;
import com.botops.campaigns.dto.CreateCampaignRequest;
import com.botops.campaigns.dto.RecipientResponse;
import com.botops.campaigns.model.BotEntity;
import com.botops.campaigns.model.CampaignEntity;
import com.botops.campaigns.model.CampaignStatus;
import com.botops.campaigns.model.CustomerEntity;
import com.botops.campaigns.model.RecipientEntity;
import com.botops.campaigns.model.RecipientStatus;
import com.botops.campaigns.repo.BotRepository;
import com.botops.campaigns.repo.CampaignRepository;
import com.botops.campaigns.repo.CustomerRepository;
import com.botops.campaigns.repo.RecipientRepository;
import com.botops.common.exception.BadRequestException;
import com.botops.common.exception.NotFoundException;
import com.botops.config.AppProperties;
import com.botops.scheduler.dto.ScheduleJobRequest;
import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.Recurrence;
import com.botops.scheduler.model.RecurrenceType;
import com.botops.scheduler.service.RecurrenceCalculator;
import com.botops.scheduler.service.SchedulerService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class CampaignService {

    private static final Logger log = LoggerFactory.getLogger(CampaignService.class);
    private static final int MAX_RECIPIENT_PAGE = 500;

    private final CampaignRepository campaignRepository;
    private final RecipientRepository recipientRepository;
    private final CustomerRepository customerRepository;
    private final BotRepository botRepository;
    private final SchedulerService schedulerService;
    private final ObjectMapper objectMapper;
    private final AppProperties.Campaign settings;
    private final Clock clock;

    public CampaignService(CampaignRepository campaignRepository,
                           RecipientRepository recipientRepository,
                           CustomerRepository customerRepository,
                           BotRepository botRepository,
                           SchedulerService schedulerService,
                           ObjectMapper objectMapper,
                           AppProperties appProperties,
                           Clock clock) {
        this.campaignRepository = campaignRepository;
        this.recipientRepository = recipientRepository;
        this.customerRepository = customerRepository;
        this.botRepository = botRepository;
        this.schedulerService = schedulerService;
        this.objectMapper = objectMapper;
        this.settings = appProperties.campaign();
        this.clock = clock;
    }

    public CampaignResponse create(CreateCampaignRequest request) {
        String tenantId = request.tenantId().trim();
        BotEntity bot = botRepository.findById(request.botId())
                .filter(candidate -> tenantId.equals(candidate.getTenantId()))
                .orElseThrow(() -> new BadRequestException("Unknown bot: " + request.botId()));

        CampaignEntity campaign = new CampaignEntity();
        campaign.setTenantId(tenantId);
        campaign.setName(request.name().trim());
        campaign.setSegment(request.segment());
        campaign.setBotId(bot.getId());
        campaign.setContent(serializeContent(request.message()));
        campaign.setFrequency(request.frequency() == null ? RecurrenceType.ONCE : request.frequency());
        campaign.setStartTime(request.startTime());
        campaign.setStatus(CampaignStatus.DRAFT);

        CampaignEntity saved = campaignRepository.save(campaign);
        log.info("Created campaign {} for tenant {}", saved.getId(), tenantId);
        return CampaignMapper.toResponse(saved);
    }

    /**
     * Targets the tenant's customers on first activation and hands the campaign to the scheduler.
     * Activating an already active campaign is a no-op; activating a paused one resumes it with
     * the recipients it already has.
     */
    public CampaignResponse activate(String tenantId, UUID campaignId) {
        CampaignEntity campaign = getOwned(tenantId, campaignId);
        if (campaign.getStatus() == CampaignStatus.ACTIVE && campaign.getSchedulerJobId() != null) {
            return CampaignMapper.toResponse(campaign);
        }

        if (recipientRepository.countByCampaignId(campaignId) == 0) {
            int targeted = populateRecipients(campaign);
            campaign.setTotalTargeted(targeted);
        }

        campaign.setStatus(CampaignStatus.ACTIVE);
        campaign = campaignRepository.save(campaign);

        Job job = schedulerService.submit(new ScheduleJobRequest(
                null,
                campaign.getTenantId(),
                Channel.CAMPAIGN,
                Map.of("campaignId", campaignId.toString()),
                firstRunAt(campaign.getStartTime()),
                null,
                recurrenceOf(campaign),
                campaignId.toString(),
                null,
                null
        ));

        campaign.setSchedulerJobId(job.id());
        CampaignEntity saved = campaignRepository.save(campaign);
        log.info("Activated campaign {} with {} recipients, job {} due at {}",
                campaignId, saved.getTotalTargeted(), job.id(), job.scheduledFor());
        return CampaignMapper.toResponse(saved);
    }

    public CampaignResponse pause(String tenantId, UUID campaignId) {
        CampaignEntity campaign = getOwned(tenantId, campaignId);
        if (campaign.getStatus() == CampaignStatus.COMPLETED) {
            throw new BadRequestException("Campaign already completed");
        }

        if (campaign.getSchedulerJobId() != null) {
            boolean removed = schedulerService.cancel(campaign.getTenantId(), campaign.getSchedulerJobId());
            log.info("Paused campaign {}, scheduler job {} removed={}", campaignId, campaign.getSchedulerJobId(), removed);
        }
        // counters may be moving under a running batch, so only status and job id are written
        campaignRepository.updateStatusAndClearJob(campaignId, CampaignStatus.PAUSED, clock.instant());
        return CampaignMapper.toResponse(getOwned(tenantId, campaignId));
    }

    public List<CampaignResponse> list(String tenantId) {
        return campaignRepository.findByTenantIdOrderByCreatedAtDesc(tenantId).stream()
                .map(CampaignMapper::toResponse)
                .toList();
    }

    public CampaignResponse get(String tenantId, UUID campaignId) {
        return CampaignMapper.toResponse(getOwned(tenantId, campaignId));
    }

    public List<RecipientResponse> recipients(String tenantId, UUID campaignId, int limit) {
        getOwned(tenantId, campaignId);
        int bounded = Math.min(Math.max(limit, 1), MAX_RECIPIENT_PAGE);
        return recipientRepository.findByCampaignIdOrderByCreatedAtDesc(campaignId, PageRequest.of(0, bounded)).stream()
                .map(CampaignMapper::toResponse)
                .toList();
    }

    private int populateRecipients(CampaignEntity campaign) {
        List<CustomerEntity> customers = customerRepository.findByTenantIdOrderByCreatedAtAsc(
                campaign.getTenantId(), PageRequest.of(0, settings.recipientLimit()));

        List<RecipientEntity> recipients = customers.stream()
                .map(customer -> {
                    RecipientEntity recipient = new RecipientEntity();
                    recipient.setCampaignId(campaign.getId());
                    recipient.setCustomerId(customer.getId());
                    recipient.setStatus(RecipientStatus.PENDING);
                    return recipient;
                })
                .toList();
        recipientRepository.saveAll(recipients);
        return recipients.size();
    }

    long firstRunAt(String startTime) {
        if (startTime == null || startTime.isBlank()) {
            return clock.millis() + settings.startDelayMs();
        }

        LocalTime time = RecurrenceCalculator.parseTime(startTime);
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime candidate = now.truncatedTo(ChronoUnit.DAYS)
                .withHour(time.getHour())
                .withMinute(time.getMinute());
        if (candidate.isBefore(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant().toEpochMilli();
    }

    private Recurrence recurrenceOf(CampaignEntity campaign) {
        RecurrenceType frequency = campaign.getFrequency();
        if (frequency == null || frequency == RecurrenceType.ONCE) {
            return null;
        }
        return new Recurrence(frequency, campaign.getStartTime(), null);
    }

    private CampaignEntity getOwned(String tenantId, UUID campaignId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BadRequestException("tenantId is required");
        }
        return campaignRepository.findByIdAndTenantId(campaignId, tenantId.trim())
                .orElseThrow(() -> new NotFoundException("Campaign not found"));
    }

    private String serializeContent(String message) {
        try {
            return objectMapper.writeValueAsString(Map.of("text", message));
        } catch (JsonProcessingException ex) {
            throw new BadRequestException("Invalid campaign message");
        }
    }
}
