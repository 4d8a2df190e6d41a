/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.autopost.integration.notify;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Sends plain-text messages through WxPusher.
 *
 * <p>
 * Disabled when no app token or recipient is configured. Delivery problems are reported through the return value,
 * never thrown.
 */
@ApplicationScoped
public class WxPusherClient {

    private static final Logger LOG = Logger.getLogger(WxPusherClient.class);

    private static final int SUCCESS_CODE = 1000;
    private static final int SUMMARY_LIMIT = 100;

    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final String appToken;
    private final List<String> uids;
    private final HttpClient httpClient;

    @Inject
    public WxPusherClient(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "notify.wxpusher.api-base",
                    defaultValue = "https://wxpusher.zjiecode.com") String apiBase,
            @ConfigProperty(
                    name = "notify.wxpusher.app-token") Optional<String> appToken,
            @ConfigProperty(
                    name = "notify.wxpusher.uids") Optional<String> uids) {
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
        this.appToken = appToken.orElse("");
        this.uids = Arrays.stream(uids.orElse("").split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    public boolean isEnabled() {
        return appToken != null && !appToken.isBlank() && !uids.isEmpty();
    }

    /**
     * Sends one message.
     *
     * @param summary
     *            short preview line (truncated to 100 characters)
     * @param content
     *            full text
     * @return true if WxPusher accepted the message
     */
    public boolean send(String summary, String content) {
        if (!isEnabled()) {
            LOG.debug("WxPusher not configured, skipping notification");
            return false;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("appToken", appToken);
        payload.put("content", content);
        payload.put("contentType", 1);
        payload.put("summary", summary.length() > SUMMARY_LIMIT ? summary.substring(0, SUMMARY_LIMIT) : summary);
        uids.forEach(payload.putArray("uids")::add);

        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(apiBase + "/api/send/message"))
                    .timeout(Duration.ofSeconds(10)).header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload.toString(), StandardCharsets.UTF_8)).build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            JsonNode body = objectMapper.readTree(response.body());
            if (body.path("code").asInt() != SUCCESS_CODE) {
                LOG.warnf("WxPusher rejected message: %s", body.path("msg").asText(response.body()));
                return false;
            }
            return true;
        } catch (IOException e) {
            LOG.warnf(e, "WxPusher request failed");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while sending WxPusher notification");
            return false;
        }
    }
}
