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
public class TelegramSender implements MessageSender {


    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public TelegramSender(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public Channel channel() {
        return Channel.TELEGRAM;
    }

    @Override
    public SendResult send(Job job) {
        String chatId = job.payloadString("chatId");
        String message = job.payloadString("message");
        String botToken = job.payloadString("botToken");

        if (botToken == null || chatId == null || message == null) {
            throw new InvalidRequestException("Missing required payload fields: botToken, chatId, or message");
        }

        Map<String, Object> body = Map.of(
                "chat_id", chatId,
                "text", message
        );

        try {
            String rawResponse = restClient.post()
                    .uri(appProperties.telegram().baseUrl() + "/bot" + botToken + "/sendMessage")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
            return SendResult.completed(readQuietly(rawResponse));
        } catch (RestClientResponseException exception) {
            throw classify(exception);
        } catch (RestClientException exception) {
            throw new DeliveryException("Telegram request failed: " + exception.getMessage(), exception);
        }
    }

    private DeliveryException classify(RestClientResponseException exception) {
        String errorText = exception.getResponseBodyAsString();
        JsonNode error = readQuietly(errorText);

        int errorCode = error.path("error_code").asInt(exception.getStatusCode().value());
        String description = error.path("description").asText(exception.getStatusText());

        if (errorCode == 429) {
            JsonNode retryAfter = error.path("parameters").path("retry_after");
            return new RateLimitException(retryAfter.isNumber() ? Duration.ofSeconds(retryAfter.asLong()) : null);
        }
        if (errorCode == 403) {
            return new BlockedRecipientException(description);
        }
        if (errorCode == 400) {
            return new InvalidRequestException(description);
        }
        return new DeliveryException("Telegram API error: " + exception.getStatusCode().value()
                + " " + exception.getStatusText() + " - " + errorText, exception);
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
