package com.botops.campaigns.service;

import com.botops.campaigns.model.BotEntity;
import com.botops.campaigns.model.CampaignEntity;
import com.botops.campaigns.model.CampaignStatus;
import com.botops.campaigns.model.PendingRecipient;
import com.botops.campaigns.model.RecipientStatus;
import com.botops.campaigns.repo.BotRepository;
import com.botops.campaigns.repo.CampaignRepository;
import com.botops.campaigns.repo.RecipientRepository;
import com.botops.config.AppProperties;
import com.botops.delivery.adapter.DiscordSender;
import com.botops.delivery.adapter.TelegramSender;
import com.botops.delivery.error.BlockedRecipientException;
import com.botops.delivery.error.DeliveryException;
import com.botops.delivery.error.InvalidRequestException;
import com.botops.delivery.error.RateLimitException;
import com.botops.delivery.error.SenderConfigurationException;
import com.botops.delivery.service.MessageSender;
import com.botops.progress.CampaignProgressEvent;
import com.botops.progress.CampaignProgressEvent.RecipientDelta;
import com.botops.progress.ProgressPublisher;
import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.SendResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Sends one batch of a campaign per invocation. While recipients remain pending the job is
 * continued after the batch delay; once none remain the campaign is marked completed.
 */
@Component
public class CampaignExecutor implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(CampaignExecutor.class);

    static final int ERROR_NO_ADDRESS = 404;
    static final int ERROR_BLOCKED = 403;
    static final int ERROR_INVALID = 400;
    static final int ERROR_OTHER = 500;

    private final CampaignRepository campaignRepository;
    private final RecipientRepository recipientRepository;
    private final BotRepository botRepository;
    private final TelegramSender telegramSender;
    private final DiscordSender discordSender;
    private final ProgressPublisher progressPublisher;
    private final SendPacer pacer;
    private final ObjectMapper objectMapper;
    private final AppProperties.Campaign settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public CampaignExecutor(CampaignRepository campaignRepository,
                            RecipientRepository recipientRepository,
                            BotRepository botRepository,
                            TelegramSender telegramSender,
                            DiscordSender discordSender,
                            ProgressPublisher progressPublisher,
                            SendPacer pacer,
                            ObjectMapper objectMapper,
                            AppProperties appProperties,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.campaignRepository = campaignRepository;
        this.recipientRepository = recipientRepository;
        this.botRepository = botRepository;
        this.telegramSender = telegramSender;
        this.discordSender = discordSender;
        this.progressPublisher = progressPublisher;
        this.pacer = pacer;
        this.objectMapper = objectMapper;
        this.settings = appProperties.campaign();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Channel channel() {
        return Channel.CAMPAIGN;
    }

    @Override
    public SendResult send(Job job) {
        UUID campaignId = campaignIdOf(job);
        CampaignEntity campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new SenderConfigurationException("Campaign " + campaignId + " not found"));

        if (campaign.getStatus() == CampaignStatus.PAUSED || campaign.getStatus() == CampaignStatus.COMPLETED) {
            log.info("Campaign {} is {}, stopping run of job {}", campaignId, campaign.getStatus(), job.id());
            return SendResult.completed();
        }

        BotEntity bot = botRepository.findById(campaign.getBotId())
                .orElseThrow(() -> new SenderConfigurationException("Bot " + campaign.getBotId() + " not found"));
        String token = botToken(bot);
        String text = messageText(campaign.getContent());

        List<PendingRecipient> batch = recipientRepository.findBatch(
                campaignId, RecipientStatus.PENDING, PageRequest.of(0, settings.batchSize()));
        log.info("Campaign {} processing batch of {} recipients", campaignId, batch.size());

        List<RecipientDelta> processed = new ArrayList<>();
        for (PendingRecipient recipient : batch) {
            pace();
            RecipientStatus status = deliver(job, recipient, token, text);
            processed.add(new RecipientDelta(recipient.id().toString(), status.name().toLowerCase(Locale.ROOT)));
            publishProgress(campaignId, job.tenantId(), null, List.copyOf(processed));
        }

        long remaining = recipientRepository.countByCampaignIdAndStatus(campaignId, RecipientStatus.PENDING);
        if (remaining > 0) {
            log.info("Campaign {} has {} recipients pending, continuing in {} ms",
                    campaignId, remaining, settings.batchDelayMs());
            return SendResult.continueAfter(Duration.ofMillis(settings.batchDelayMs()));
        }

        campaignRepository.updateStatus(campaignId, CampaignStatus.COMPLETED, clock.instant());
        publishProgress(campaignId, job.tenantId(), CampaignStatus.COMPLETED, List.of());
        log.info("Campaign {} completed", campaignId);
        return SendResult.completed(Map.of("campaignId", campaignId.toString(), "status", "completed"));
    }

    private RecipientStatus deliver(Job job, PendingRecipient recipient, String token, String text) {
        RecipientStatus status;
        Integer errorCode = null;

        if (recipient.externalId() == null || recipient.externalId().isBlank()) {
            status = RecipientStatus.FAILED;
            errorCode = ERROR_NO_ADDRESS;
        } else {
            try {
                sendToRecipient(job, recipient, token, text);
                status = RecipientStatus.SENT;
            } catch (RateLimitException ex) {
                // recipient stays pending; the scheduler retries the whole job after the provider's delay
                throw ex;
            } catch (BlockedRecipientException ex) {
                status = RecipientStatus.BLOCKED;
                errorCode = ERROR_BLOCKED;
            } catch (InvalidRequestException ex) {
                status = RecipientStatus.INVALID_ID;
                errorCode = ERROR_INVALID;
            } catch (DeliveryException ex) {
                log.warn("Send to recipient {} failed: {}", recipient.id(), ex.getMessage());
                status = RecipientStatus.FAILED;
                errorCode = ERROR_OTHER;
            }
        }

        recipientRepository.updateStatus(recipient.id(), status, errorCode, clock.instant());
        UUID campaignId = campaignIdOf(job);
        if (status == RecipientStatus.SENT) {
            campaignRepository.incrementSent(campaignId, clock.instant());
            meterRegistry.counter("remarketing.campaign.recipients.sent.total").increment();
        } else {
            campaignRepository.incrementFailed(campaignId, clock.instant());
            meterRegistry.counter("remarketing.campaign.recipients.failed.total",
                    "status", status.name().toLowerCase(Locale.ROOT)).increment();
        }
        return status;
    }

    private void sendToRecipient(Job job, PendingRecipient recipient, String token, String text) {
        if ("discord".equalsIgnoreCase(recipient.provider())) {
            discordSender.send(job.withPayload(Map.of(
                    "channelId", recipient.externalId(),
                    "content", text,
                    "botToken", token
            )));
        } else {
            telegramSender.send(job.withPayload(Map.of(
                    "chatId", recipient.externalId(),
                    "message", text,
                    "botToken", token
            )));
        }
    }

    // status defaults to the campaign row's current status, so a pause mid-batch is reported as such
    private void publishProgress(UUID campaignId, String tenantId, CampaignStatus status, List<RecipientDelta> batch) {
        try {
            CampaignEntity current = campaignRepository.findById(campaignId).orElse(null);
            if (current == null) {
                return;
            }
            CampaignStatus reported = status != null ? status : current.getStatus();
            progressPublisher.publish(new CampaignProgressEvent(
                    CampaignProgressEvent.CAMPAIGN_UPDATE,
                    tenantId,
                    campaignId.toString(),
                    reported.name().toLowerCase(Locale.ROOT),
                    current.getTotalTargeted(),
                    current.getTotalSent(),
                    current.getTotalFailed(),
                    batch
            ));
        } catch (RuntimeException ex) {
            log.warn("Failed to publish progress for campaign {}: {}", campaignId, ex.getMessage());
        }
    }

    private void pace() {
        try {
            pacer.pause();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Campaign batch interrupted", ex);
        }
    }

    private UUID campaignIdOf(Job job) {
        String raw = job.payloadString("campaignId");
        if (raw == null) {
            raw = job.campaignId();
        }
        if (raw == null || raw.isBlank()) {
            throw new SenderConfigurationException("Campaign job " + job.id() + " has no campaignId");
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException ex) {
            throw new SenderConfigurationException("Invalid campaignId: " + raw);
        }
    }

    private String botToken(BotEntity bot) {
        JsonNode credentials = readQuietly(bot.getCredentials());
        String token = credentials == null ? null : credentials.path("token").asText(null);
        if (token == null || token.isBlank()) {
            throw new SenderConfigurationException("Bot " + bot.getId() + " has no token");
        }
        return token;
    }

    // content is stored as {"text": "..."}; plain strings are sent as-is
    private String messageText(String content) {
        JsonNode node = readQuietly(content);
        if (node != null && node.hasNonNull("text")) {
            return node.get("text").asText();
        }
        return content == null ? "" : content;
    }

    private JsonNode readQuietly(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node.isObject() ? node : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
