/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.classifier.config;

import java.net.URI;
import java.time.Duration;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.classifier.integration.ai.ModelHandle;

/**
 * Configuration class for the language models and embedding model used by the classifier.
 *
 * <p>
 * Produces three {@link ModelHandle} beans, one per cascade endpoint:
 * <ul>
 * <li><b>primary</b> - legal-domain model served behind an OpenAI-compatible endpoint</li>
 * <li><b>fallback-api</b> - remote general-purpose model behind an OpenAI-compatible endpoint</li>
 * <li><b>fallback-local</b> - the same general-purpose model hosted locally through Ollama</li>
 * </ul>
 * and one {@link EmbeddingModel} shared by the taxonomy, example and past-document collections.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code classifier.models.primary.base-url} / {@code model-name} / {@code api-key} / {@code max-tokens} /
 * {@code timeout-seconds}</li>
 * <li>{@code classifier.models.fallback-api.base-url} / {@code model-name} / {@code api-key} / {@code max-tokens} /
 * {@code timeout-seconds}</li>
 * <li>{@code classifier.models.fallback-local.base-url} / {@code model-name} / {@code max-tokens} /
 * {@code timeout-seconds}</li>
 * <li>{@code classifier.models.temperature} - sampling temperature (default: 0.1)</li>
 * <li>{@code classifier.models.slot-timeout-seconds} - wait for a busy model's inference slot (default: 120)</li>
 * <li>{@code classifier.embedding.base-url} / {@code model-name} / {@code api-key} /
 * {@code timeout-seconds}</li>
 * </ul>
 *
 * <p>
 * Model clients are built lazily by their handles, so a model endpoint that is down at startup does not prevent the
 * application from starting; the cascade simply treats it as unavailable.
 *
 * <p>
 * <b>Usage:</b>
 *
 * <pre>
 * &#64;Inject
 * &#64;Named("primary")
 * ModelHandle primaryModel;
 * </pre>
 *
 * @see villagecompute.classifier.services.ClassifierCascadeService
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "classifier.models.primary.base-url",
            defaultValue = "http://localhost:8000/v1")
    String primaryBaseUrl;

    @ConfigProperty(
            name = "classifier.models.primary.model-name",
            defaultValue = "Equall/Saul-7B-Instruct-v1")
    String primaryModelName;

    @ConfigProperty(
            name = "classifier.models.primary.api-key",
            defaultValue = "not-required")
    String primaryApiKey;

    @ConfigProperty(
            name = "classifier.models.primary.max-tokens",
            defaultValue = "100")
    int primaryMaxTokens;

    @ConfigProperty(
            name = "classifier.models.primary.timeout-seconds",
            defaultValue = "30")
    int primaryTimeoutSeconds;

    @ConfigProperty(
            name = "classifier.models.fallback-api.base-url",
            defaultValue = "http://localhost:8001")
    String fallbackApiBaseUrl;

    @ConfigProperty(
            name = "classifier.models.fallback-api.model-name",
            defaultValue = "mistral")
    String fallbackApiModelName;

    @ConfigProperty(
            name = "classifier.models.fallback-api.api-key",
            defaultValue = "not-required")
    String fallbackApiKey;

    @ConfigProperty(
            name = "classifier.models.fallback-api.max-tokens",
            defaultValue = "150")
    int fallbackApiMaxTokens;

    @ConfigProperty(
            name = "classifier.models.fallback-api.timeout-seconds",
            defaultValue = "10")
    int fallbackApiTimeoutSeconds;

    @ConfigProperty(
            name = "classifier.models.fallback-local.base-url",
            defaultValue = "http://localhost:11434")
    String fallbackLocalBaseUrl;

    @ConfigProperty(
            name = "classifier.models.fallback-local.model-name",
            defaultValue = "mistral")
    String fallbackLocalModelName;

    @ConfigProperty(
            name = "classifier.models.fallback-local.max-tokens",
            defaultValue = "150")
    int fallbackLocalMaxTokens;

    @ConfigProperty(
            name = "classifier.models.fallback-local.timeout-seconds",
            defaultValue = "60")
    int fallbackLocalTimeoutSeconds;

    @ConfigProperty(
            name = "classifier.models.temperature",
            defaultValue = "0.1")
    double temperature;

    @ConfigProperty(
            name = "classifier.models.slot-timeout-seconds",
            defaultValue = "120")
    int slotTimeoutSeconds;

    @ConfigProperty(
            name = "classifier.embedding.base-url",
            defaultValue = "http://localhost:8002/v1")
    String embeddingBaseUrl;

    @ConfigProperty(
            name = "classifier.embedding.model-name",
            defaultValue = "all-MiniLM-L6-v2")
    String embeddingModelName;

    @ConfigProperty(
            name = "classifier.embedding.api-key",
            defaultValue = "not-required")
    String embeddingApiKey;

    @ConfigProperty(
            name = "classifier.embedding.timeout-seconds",
            defaultValue = "30")
    int embeddingTimeoutSeconds;

    /**
     * Validates endpoint URLs and numeric settings at startup.
     *
     * @throws AiConfigurationException
     *             if any endpoint is not an absolute http(s) URL, or a timeout or temperature is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requireHttpUrl("classifier.models.primary.base-url", primaryBaseUrl);
        requireHttpUrl("classifier.models.fallback-api.base-url", fallbackApiBaseUrl);
        requireHttpUrl("classifier.models.fallback-local.base-url", fallbackLocalBaseUrl);
        requireHttpUrl("classifier.embedding.base-url", embeddingBaseUrl);

        if (temperature < 0.0 || temperature > 2.0) {
            fail("classifier.models.temperature must be between 0.0 and 2.0, got " + temperature);
        }
        if (primaryTimeoutSeconds <= 0 || fallbackApiTimeoutSeconds <= 0 || fallbackLocalTimeoutSeconds <= 0
                || embeddingTimeoutSeconds <= 0 || slotTimeoutSeconds <= 0) {
            fail("Model, embedding and slot timeouts must be positive");
        }
        LOG.infof("Classifier models configured: primary=%s, fallback-api=%s, fallback-local=%s, embedding=%s",
                primaryModelName, fallbackApiModelName, fallbackLocalModelName, embeddingModelName);
    }

    /**
     * Produces the handle for the legal-domain primary model.
     */
    @Produces
    @Singleton
    @Named("primary")
    public ModelHandle createPrimaryModel() {
        return new ModelHandle("primary", () -> {
            LOG.infof("Creating primary ChatModel: model=%s, url=%s, maxTokens=%d, timeout=%ds", primaryModelName,
                    primaryBaseUrl, primaryMaxTokens, primaryTimeoutSeconds);
            return openAiCompatible(primaryBaseUrl, primaryApiKey, primaryModelName, primaryMaxTokens,
                    primaryTimeoutSeconds);
        }, Duration.ofSeconds(slotTimeoutSeconds));
    }

    /**
     * Produces the handle for the remote general-purpose fallback endpoint.
     */
    @Produces
    @Singleton
    @Named("fallback-api")
    public ModelHandle createFallbackApiModel() {
        return new ModelHandle("fallback-api", () -> {
            LOG.infof("Creating fallback-api ChatModel: model=%s, url=%s, maxTokens=%d, timeout=%ds",
                    fallbackApiModelName, fallbackApiBaseUrl, fallbackApiMaxTokens, fallbackApiTimeoutSeconds);
            return openAiCompatible(fallbackApiBaseUrl, fallbackApiKey, fallbackApiModelName, fallbackApiMaxTokens,
                    fallbackApiTimeoutSeconds);
        }, Duration.ofSeconds(slotTimeoutSeconds));
    }

    /**
     * Produces the handle for the locally hosted fallback model.
     */
    @Produces
    @Singleton
    @Named("fallback-local")
    public ModelHandle createFallbackLocalModel() {
        return new ModelHandle("fallback-local", () -> {
            LOG.infof("Creating fallback-local ChatModel: model=%s, url=%s, timeout=%ds", fallbackLocalModelName,
                    fallbackLocalBaseUrl, fallbackLocalTimeoutSeconds);
            return OllamaChatModel.builder().baseUrl(fallbackLocalBaseUrl).modelName(fallbackLocalModelName)
                    .temperature(temperature).numPredict(fallbackLocalMaxTokens)
                    .timeout(Duration.ofSeconds(fallbackLocalTimeoutSeconds)).maxRetries(0).build();
        }, Duration.ofSeconds(slotTimeoutSeconds));
    }

    /**
     * Produces the embedding model for all similarity collections.
     */
    @Produces
    @ApplicationScoped
    public EmbeddingModel createEmbeddingModel() {
        LOG.infof("Creating EmbeddingModel: model=%s, url=%s", embeddingModelName, embeddingBaseUrl);
        return OpenAiEmbeddingModel.builder().baseUrl(embeddingBaseUrl).apiKey(embeddingApiKey)
                .modelName(embeddingModelName).timeout(Duration.ofSeconds(embeddingTimeoutSeconds)).maxRetries(1)
                .logRequests(false).logResponses(false).build();
    }

    private ChatModel openAiCompatible(String baseUrl, String apiKey, String modelName, int maxTokens,
            int timeoutSeconds) {
        // cascade moves on after a failure, so no client-side retries
        return OpenAiChatModel.builder().baseUrl(baseUrl).apiKey(apiKey).modelName(modelName)
                .temperature(temperature).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(0).logRequests(false).logResponses(false).build();
    }

    private static void requireHttpUrl(String property, String value) {
        if (value == null || value.isBlank()) {
            fail(property + " is not configured");
        }
        try {
            URI uri = URI.create(value.trim());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                fail(property + " must be an absolute http(s) URL, got " + value);
            }
        } catch (IllegalArgumentException e) {
            throw new AiConfigurationException(property + " is not a valid URL: " + value, e);
        }
    }

    private static void fail(String message) {
        LOG.fatal(message);
        throw new AiConfigurationException(message);
    }

    /**
     * Exception thrown when classifier configuration is invalid or incomplete.
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
