/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.autopost.integration.ai;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.data.models.AspectRatio;
import villagecompute.autopost.exceptions.GenerationException;

/**
 * Client for an OpenAI-style {@code /images/generations} endpoint (Seedream and compatible gateways).
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Request: {@code model}, {@code prompt}, {@code n=1}, {@code response_format=url}, {@code size},
 * {@code watermark=false}, optional {@code image} array of reference URLs</li>
 * <li>Models named {@code nano-banana*} take {@code aspect_ratio} instead of {@code size}</li>
 * <li>Response: {@code data[0].url} or {@code data[0].b64_json}</li>
 * <li>Timeout: 180 seconds per call</li>
 * </ul>
 */
@ApplicationScoped
public class ImageGenerationClient {

    private static final Logger LOG = Logger.getLogger(ImageGenerationClient.class);

    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;

    @Inject
    public ImageGenerationClient(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "image.api-base") String apiBase,
            @ConfigProperty(
                    name = "image.api-key") String apiKey,
            @ConfigProperty(
                    name = "image.model",
                    defaultValue = "doubao-seedream-4-5-251128") String model,
            @ConfigProperty(
                    name = "image.timeout",
                    defaultValue = "180s") Duration timeout) {
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(10)).build();
    }

    /**
     * Generates one image.
     *
     * @param prompt
     *            fully decorated prompt
     * @param ratio
     *            output aspect ratio
     * @param referenceUrls
     *            reference images, may be empty
     * @return the generated image; {@link GeneratedImageType#isEmpty()} if the API answered without data
     * @throws GenerationException
     *             on HTTP error, timeout or unreadable response
     */
    public GeneratedImageType generate(String prompt, AspectRatio ratio, List<String> referenceUrls) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("prompt", prompt);
        payload.put("response_format", "url");
        if (model.startsWith("nano-banana")) {
            payload.put("aspect_ratio", ratio.getLabel());
        } else {
            payload.put("n", 1);
            payload.put("size", ratio.getSize());
            payload.put("watermark", false);
        }
        if (referenceUrls != null && !referenceUrls.isEmpty()) {
            ArrayNode image = payload.putArray("image");
            referenceUrls.forEach(image::add);
        }

        LOG.debugf("Image request: model=%s, size=%s, promptLength=%d, references=%d", model, ratio.getSize(),
                prompt.length(), referenceUrls == null ? 0 : referenceUrls.size());
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(apiBase + "/images/generations"))
                    .timeout(timeout).header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload.toString(), StandardCharsets.UTF_8)).build();

            long startTime = System.currentTimeMillis();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            long latency = System.currentTimeMillis() - startTime;

            if (response.statusCode() / 100 != 2) {
                LOG.errorf("Image API returned status %d: %s", response.statusCode(), truncate(response.body()));
                throw new GenerationException(
                        "Image API returned status " + response.statusCode() + ": " + truncate(response.body()));
            }
            if (response.body() == null || response.body().isBlank()) {
                LOG.warnf("Image API returned an empty body (latency: %dms)", latency);
                return GeneratedImageType.empty(prompt);
            }

            JsonNode item = objectMapper.readTree(response.body()).path("data").path(0);
            GeneratedImageType image = new GeneratedImageType(prompt, item.path("url").asText(null),
                    item.path("b64_json").asText(null));
            LOG.infof("Image generated (latency: %dms, empty=%s)", latency, image.isEmpty());
            return image;
        } catch (JsonProcessingException e) {
            throw new GenerationException("Image API returned malformed JSON", e);
        } catch (IOException e) {
            throw new GenerationException("Image API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted during image generation", e);
        }
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
