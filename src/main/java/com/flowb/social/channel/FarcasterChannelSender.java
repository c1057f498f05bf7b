package com.flowb.social.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowb.social.config.NotificationProperties;
import com.flowb.social.exception.RepositoryException;
import com.flowb.social.model.NotificationToken;
import com.flowb.social.model.Platform;
import com.flowb.social.repository.NotificationTokenRepository;
import com.flowb.social.service.NotificationTextGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Sends Mini App push notifications to {@code farcaster_<fid>} users.
 *
 * The user's enabled token is looked up by fid and the notification is posted to the URL
 * the client registered with it. A 410 or an {@code invalidTokens} echo disables the token.
 */
@Component
@Order(2)
public class FarcasterChannelSender implements ChannelSender {

    private static final Logger logger = LoggerFactory.getLogger(FarcasterChannelSender.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final int GONE = 410;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final NotificationTokenRepository tokenRepository;
    private final NotificationProperties notificationProperties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public FarcasterChannelSender(HttpClient externalHttpClient,
                                  ObjectMapper objectMapper,
                                  NotificationTokenRepository tokenRepository,
                                  NotificationProperties notificationProperties,
                                  MeterRegistry meterRegistry) {
        this.httpClient = externalHttpClient;
        this.objectMapper = objectMapper;
        this.tokenRepository = tokenRepository;
        this.notificationProperties = notificationProperties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String prefix() {
        return Platform.FARCASTER.getPrefix();
    }

    @Override
    public boolean send(String userId, String text) {
        long fid;
        try {
            fid = Long.parseLong(Platform.FARCASTER.stripPrefix(userId));
        } catch (NumberFormatException e) {
            logger.warn("Not a Farcaster fid: {}", userId);
            record("invalid_recipient");
            return false;
        }

        Optional<NotificationToken> token;
        try {
            token = tokenRepository.findEnabledByFid(fid);
        } catch (RepositoryException e) {
            logger.warn("Could not load notification token for fid {}", fid, e);
            record("error");
            return false;
        }
        if (token.isEmpty()) {
            logger.debug("No enabled notification token for fid {}", fid);
            record("no_token");
            return false;
        }
        return post(fid, token.get(), text);
    }

    private boolean post(long fid, NotificationToken token, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("notificationId", UUID.randomUUID().toString());
        body.put("title", NotificationTextGenerator.PUSH_TITLE);
        body.put("body", text);
        body.put("targetUrl", notificationProperties.getFarcasterAppUrl());
        body.put("tokens", List.of(token.getToken()));

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(token.getUrl()))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == GONE) {
                logger.info("Notification token for fid {} is gone, disabling it", fid);
                disable(fid);
                record("token_gone");
                return false;
            }
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                logger.warn("Notification host rejected fid {} with status {}", fid, response.statusCode());
                record("rejected");
                return false;
            }

            JsonNode result = objectMapper.readTree(response.body()).path("result");
            if (contains(result.path("invalidTokens"), token.getToken())) {
                logger.info("Notification token for fid {} reported invalid, disabling it", fid);
                disable(fid);
                record("token_invalid");
                return false;
            }
            if (contains(result.path("rateLimitedTokens"), token.getToken())) {
                logger.warn("Notification for fid {} was rate limited", fid);
                record("rate_limited");
                return false;
            }
            record("sent");
            return true;
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable notification response for fid {}", fid, e);
            record("error");
            return false;
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Farcaster notification failed for fid {}", fid, e);
            record("error");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted sending Farcaster notification to fid {}", fid);
            record("error");
            return false;
        }
    }

    private static boolean contains(JsonNode tokens, String token) {
        if (!tokens.isArray()) {
            return false;
        }
        for (JsonNode node : tokens) {
            if (token.equals(node.asText())) {
                return true;
            }
        }
        return false;
    }

    private void disable(long fid) {
        try {
            tokenRepository.disable(fid);
        } catch (RepositoryException e) {
            logger.warn("Could not disable notification token for fid {}", fid, e);
        }
    }

    private void record(String status) {
        meterRegistry.counter("channel_send_total", "channel", "farcaster", "status", status).increment();
    }
}
