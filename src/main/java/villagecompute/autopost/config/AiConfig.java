/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopost.config;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Configuration for the LangChain4j chat model that writes note copy and image prompts.
 *
 * <p>
 * Two providers are supported:
 * <ul>
 * <li><b>anthropic</b>: Anthropic Claude through {@link AnthropicChatModel}</li>
 * <li><b>openai</b>: any OpenAI-compatible endpoint (SiliconFlow, a local gateway) through {@link OpenAiChatModel}
 * with {@code ai.base-url}</li>
 * </ul>
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code ai.provider} - {@code anthropic} or {@code openai} (default: openai)</li>
 * <li>{@code ai.api-key} - Provider API key (from AI_API_KEY env var)</li>
 * <li>{@code ai.base-url} - Endpoint for the openai provider</li>
 * <li>{@code ai.model.name} - Model identifier</li>
 * <li>{@code ai.model.temperature} - Sampling temperature (default: 0.8)</li>
 * <li>{@code ai.model.max-tokens} - Max output tokens (default: 4096)</li>
 * <li>{@code ai.model.timeout-seconds} - Request timeout (default: 60)</li>
 * <li>{@code ai.model.max-retries} - Retry attempts (default: 2)</li>
 * </ul>
 *
 * @see villagecompute.autopost.services.ContentGenerationService
 * @see villagecompute.autopost.services.PromptResolutionService
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    public static final String WRITER_MODEL = "writer";

    @ConfigProperty(
            name = "ai.provider",
            defaultValue = "openai")
    String provider;

    @ConfigProperty(
            name = "ai.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.base-url",
            defaultValue = "https://api.siliconflow.cn/v1")
    String baseUrl;

    @ConfigProperty(
            name = "ai.model.name",
            defaultValue = "Qwen/Qwen3-VL-32B-Instruct")
    String modelName;

    @ConfigProperty(
            name = "ai.model.temperature",
            defaultValue = "0.8")
    double temperature;

    @ConfigProperty(
            name = "ai.model.max-tokens",
            defaultValue = "4096")
    int maxTokens;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "60")
    int timeoutSeconds;

    @ConfigProperty(
            name = "ai.model.max-retries",
            defaultValue = "2")
    int maxRetries;

    /**
     * Fails startup when no API key is configured or the provider is unknown.
     *
     * @throws AiConfigurationException
     *             if the configuration cannot produce a chat model
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey.isEmpty() || apiKey.get().isBlank()) {
            String errorMessage = "AI_API_KEY environment variable is not configured. "
                    + "Note and prompt generation require a chat model API key.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        if (!"anthropic".equals(provider) && !"openai".equals(provider)) {
            String errorMessage = "Unknown ai.provider '" + provider + "', expected anthropic or openai";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        LOG.infof("LangChain4j configured with provider=%s, model=%s", provider, modelName);
    }

    /**
     * Produces the chat model used for copywriting and prompt resolution.
     *
     * @return configured ChatModel
     */
    @Produces
    @ApplicationScoped
    @Named(WRITER_MODEL)
    public ChatModel createWriterModel() {
        LOG.infof("Creating %s ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds, maxRetries=%d",
                provider, modelName, temperature, maxTokens, timeoutSeconds, maxRetries);

        if ("anthropic".equals(provider)) {
            return AnthropicChatModel.builder().apiKey(apiKey.orElseThrow()).modelName(modelName)
                    .temperature(temperature).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                    .maxRetries(maxRetries).logRequests(false).logResponses(false).build();
        }
        return OpenAiChatModel.builder().baseUrl(baseUrl).apiKey(apiKey.orElseThrow()).modelName(modelName)
                .temperature(temperature).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries).logRequests(false).logResponses(false).build();
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }

        public AiConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
