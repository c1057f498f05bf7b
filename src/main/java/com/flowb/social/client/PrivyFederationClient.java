package com.flowb.social.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowb.social.config.PrivyProperties;
import com.flowb.social.dto.LinkedHandles;
import com.flowb.social.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Federation lookup against the Privy user API.
 *
 * Telegram and Farcaster handles are found through user search on the linked account's
 * subject, {@code web_<did>} handles are fetched directly. Linked accounts map to
 * {@code telegram_<id>}, {@code farcaster_<fid>} and {@code web_<privyId>}.
 */
@Component
@ConditionalOnProperty(prefix = "flowb.privy", name = {"app-id", "app-secret"})
public class PrivyFederationClient implements FederationClient {

    private static final Logger logger = LoggerFactory.getLogger(PrivyFederationClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PrivyProperties properties;

    @Autowired
    public PrivyFederationClient(HttpClient externalHttpClient, ObjectMapper objectMapper, PrivyProperties properties) {
        this.httpClient = externalHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Optional<LinkedHandles> lookupLinkedHandles(String platformUserId) {
        Platform platform = Platform.fromUserId(platformUserId);
        try {
            JsonNode user;
            switch (platform) {
                case TELEGRAM:
                    user = searchUser("telegram", platform.stripPrefix(platformUserId));
                    break;
                case FARCASTER:
                    user = searchUser("farcaster", platform.stripPrefix(platformUserId));
                    break;
                case WEB:
                    user = fetchUser(Platform.WEB.stripPrefix(platformUserId));
                    break;
                default:
                    return Optional.empty();
            }
            if (user == null) {
                return Optional.empty();
            }
            return extractLinkedHandles(user, platformUserId);
        } catch (IOException e) {
            logger.warn("Privy lookup failed for {}: {}", platformUserId, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Privy lookup interrupted for {}", platformUserId);
            return Optional.empty();
        }
    }

    private JsonNode searchUser(String accountType, String subject) throws IOException, InterruptedException {
        Map<String, Object> body = Map.of(
                "filter", Map.of(accountType, Map.of("subject", subject)),
                "limit", 1);
        HttpRequest request = authorized(properties.getBaseUrl() + "/api/v1/users/search")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            logger.debug("Privy search returned {} for {} {}", response.statusCode(), accountType, subject);
            return null;
        }
        JsonNode data = objectMapper.readTree(response.body()).path("data");
        return data.isArray() && data.size() > 0 ? data.get(0) : null;
    }

    private JsonNode fetchUser(String did) throws IOException, InterruptedException {
        String url = properties.getBaseUrl() + "/api/v1/users/" + URLEncoder.encode(did, StandardCharsets.UTF_8);
        HttpRequest request = authorized(url).GET().build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            logger.debug("Privy user fetch returned {} for {}", response.statusCode(), did);
            return null;
        }
        return objectMapper.readTree(response.body());
    }

    private HttpRequest.Builder authorized(String url) {
        String credentials = properties.getAppId() + ":" + properties.getAppSecret();
        String basicAuth = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Basic " + basicAuth)
                .header("privy-app-id", properties.getAppId());
    }

    Optional<LinkedHandles> extractLinkedHandles(JsonNode user, String excludedUserId) {
        String privyId = user.hasNonNull("id") ? user.get("id").asText() : user.path("did").asText(null);
        List<String> handles = new ArrayList<>();

        for (JsonNode account : user.path("linked_accounts")) {
            String type = account.path("type").asText();
            if ("telegram".equals(type) && account.hasNonNull("telegram_user_id")) {
                addUnlessExcluded(handles, Platform.TELEGRAM.toUserId(account.get("telegram_user_id").asText()), excludedUserId);
            } else if ("farcaster".equals(type) && account.hasNonNull("fid")) {
                addUnlessExcluded(handles, Platform.FARCASTER.toUserId(account.get("fid").asText()), excludedUserId);
            }
        }
        if (privyId != null && !privyId.isBlank()) {
            addUnlessExcluded(handles, Platform.WEB.toUserId(privyId), excludedUserId);
        }

        if (handles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LinkedHandles(privyId, handles));
    }

    private static void addUnlessExcluded(List<String> handles, String handle, String excluded) {
        if (!handle.equals(excluded) && !handles.contains(handle)) {
            handles.add(handle);
        }
    }
}
