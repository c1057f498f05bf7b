package com.flowb.social.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowb.social.config.TelegramProperties;
import com.flowb.social.model.Platform;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends through the Telegram Bot API to the chat id embedded in {@code telegram_<id>}.
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "flowb.telegram", name = "bot-token")
public class TelegramChannelSender implements ChannelSender {

    private static final Logger logger = LoggerFactory.getLogger(TelegramChannelSender.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TelegramProperties properties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public TelegramChannelSender(HttpClient externalHttpClient,
                                 ObjectMapper objectMapper,
                                 TelegramProperties properties,
                                 MeterRegistry meterRegistry) {
        this.httpClient = externalHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String prefix() {
        return Platform.TELEGRAM.getPrefix();
    }

    @Override
    public boolean send(String userId, String text) {
        long chatId;
        try {
            chatId = Long.parseLong(Platform.TELEGRAM.stripPrefix(userId));
        } catch (NumberFormatException e) {
            logger.warn("Not a Telegram chat id: {}", userId);
            record("invalid_recipient");
            return false;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "Markdown");

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(properties.getApiBaseUrl() + "/bot" + properties.getBotToken() + "/sendMessage"))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                logger.warn("Telegram rejected message to {} with status {}", userId, response.statusCode());
                record("rejected");
                return false;
            }
            JsonNode result = objectMapper.readTree(response.body());
            if (!result.path("ok").asBoolean(false)) {
                logger.warn("Telegram did not accept message to {}: {}", userId, result.path("description").asText());
                record("rejected");
                return false;
            }
            record("sent");
            return true;
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable Telegram response for {}", userId, e);
            record("error");
            return false;
        } catch (IOException e) {
            logger.warn("Telegram send failed for {}", userId, e);
            record("error");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted sending Telegram message to {}", userId);
            record("error");
            return false;
        }
    }

    private void record(String status) {
        meterRegistry.counter("channel_send_total", "channel", "telegram", "status", status).increment();
    }
}
