package com.botops.delivery.adapter;

import com.botops.config.AppProperties;
import com.botops.delivery.error.BlockedRecipientException;
import com.botops.delivery.error.DeliveryException;
import com.botops.delivery.error.InvalidRequestException;
import com.botops.delivery.error.RateLimitException;
import com.botops.delivery.service.MessageSender;
import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.SendResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Map;

@Component
public class DiscordSender implements MessageSender {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public DiscordSender(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public Channel channel() {
        return Channel.DISCORD;
    }

    @Override
    public SendResult send(Job job) {
        String channelId = job.payloadString("channelId");
        String content = job.payloadString("content");
        String botToken = job.payloadString("botToken");

        if (botToken == null || channelId == null || content == null) {
            throw new InvalidRequestException("Missing required payload fields: botToken, channelId, or content");
        }

        try {
            String rawResponse = restClient.post()
                    .uri(appProperties.discord().baseUrl() + "/channels/" + channelId + "/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bot " + botToken)
                    .body(Map.of("content", content))
                    .retrieve()
                    .body(String.class);
            return SendResult.completed(readQuietly(rawResponse));
        } catch (RestClientResponseException exception) {
            throw classify(exception);
        } catch (RestClientException exception) {
            throw new DeliveryException("Discord request failed: " + exception.getMessage(), exception);
        }
    }

    private DeliveryException classify(RestClientResponseException exception) {
        int status = exception.getStatusCode().value();
        String errorText = exception.getResponseBodyAsString();
        JsonNode error = readQuietly(errorText);
        String description = error.path("message").asText(exception.getStatusText());

        if (status == 429) {
            // retry_after is in seconds and may be fractional
            JsonNode retryAfter = error.path("retry_after");
            if (!retryAfter.isNumber()) {
                return new RateLimitException(null);
            }
            return new RateLimitException(Duration.ofMillis((long) Math.ceil(retryAfter.asDouble() * 1000)));
        }
        if (status == 403) {
            return new BlockedRecipientException(description);
        }
        if (status == 400 || status == 404) {
            return new InvalidRequestException(description);
        }
        return new DeliveryException("Discord API error: " + status + " " + exception.getStatusText()
                + " - " + errorText, exception);
    }

    private JsonNode readQuietly(String raw) {
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (Exception exception) {
            return objectMapper.createObjectNode();
        }
    }
}
